package com.proposalbus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProposalBusApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProposalBusApplication.class, args);
    }
}
