package com.proposalbus.api;

import com.proposalbus.bus.BusEvent;
import com.proposalbus.bus.EventBusService;
import com.proposalbus.bus.JournalEntry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/v1/events")
public class EventController {

    private final EventBusService eventBusService;

    public EventController(EventBusService eventBusService) {
        this.eventBusService = eventBusService;
    }

    /**
     * Journal lookup. With {@code after}, returns entries newer than that sequence number
     * so a disconnected observer can catch up.
     */
    @GetMapping
    public List<JournalEntry> query(@RequestParam(required = false) String type,
                                    @RequestParam(required = false) Long after,
                                    @RequestParam(defaultValue = "100") int limit) {
        int capped = Math.min(limit, 1000);
        if (after != null) {
            return eventBusService.queryAfter(after, capped).stream()
                .filter(entry -> matchesType(type, entry.event()))
                .toList();
        }
        return eventBusService.query(Optional.ofNullable(type), capped);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String type) {
        SseEmitter emitter = new SseEmitter(0L);
        String observerId = eventBusService.observe(event -> {
            if (!matchesType(type, event)) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .id(event.id())
                    .name(event.type())
                    .data(event));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> eventBusService.stopObserving(observerId));
        emitter.onTimeout(() -> eventBusService.stopObserving(observerId));
        emitter.onError(ex -> eventBusService.stopObserving(observerId));
        return emitter;
    }

    private boolean matchesType(String type, BusEvent event) {
        return type == null || type.equals(event.type());
    }
}
