package com.flagship.supply_chain.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An entry of the event log.
 *
 * Immutable value: relay bookkeeping produces a new instance. The sequence number is
 * assigned on append and orders entries by transition completion.
 */
@Value
public class LoggedEvent {
    long sequenceNumber;
    UUID eventId;
    long productId;
    String eventType;
    String payload;            // JSON
    Instant occurredAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;

    static LoggedEvent create(long sequenceNumber, UUID eventId, long productId,
                              String eventType, String payload, Instant occurredAt) {
        return new LoggedEvent(sequenceNumber, eventId, productId, eventType, payload,
            occurredAt, null, 0, null);
    }

    @JsonIgnore
    public boolean isPublished() {
        return publishedAt != null;
    }

    LoggedEvent markPublished() {
        return new LoggedEvent(sequenceNumber, eventId, productId, eventType, payload,
            occurredAt, Instant.now(), retryCount, null);
    }

    LoggedEvent markRetry(String errorMessage) {
        return new LoggedEvent(sequenceNumber, eventId, productId, eventType, payload,
            occurredAt, publishedAt, retryCount + 1, errorMessage);
    }
}
