package com.proposalbus.bus;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class BusConfiguration {

    /**
     * The single cooperative loop every timer, backoff and handler continuation runs on.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler competitionLoop() {
        return Schedulers.newSingle("competition-loop");
    }

    @Bean
    public EventJournal eventJournal(EventBusProperties properties) {
        return new InMemoryEventJournal(properties.getJournalCapacity());
    }
}
