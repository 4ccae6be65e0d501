package com.proposalbus.bus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable envelope for everything that travels over the bus.
 * The payload is one of the records in {@code com.proposalbus.contract}.
 */
public record BusEvent(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("payload") Object payload,
    @JsonProperty("timestamp") Instant timestamp
) {

    public static BusEvent of(String type, Object payload) {
        String id = "evt_" + System.currentTimeMillis() + "_"
            + UUID.randomUUID().toString().substring(0, 8);
        return new BusEvent(id, type, payload, Instant.now());
    }

    public <T> T payloadAs(Class<T> payloadType) {
        if (!payloadType.isInstance(payload)) {
            throw new IllegalArgumentException("event " + type + " carries "
                + (payload == null ? "no payload" : payload.getClass().getSimpleName())
                + ", expected " + payloadType.getSimpleName());
        }
        return payloadType.cast(payload);
    }
}
