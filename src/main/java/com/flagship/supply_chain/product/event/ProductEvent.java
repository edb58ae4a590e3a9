package com.flagship.supply_chain.product.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for product lifecycle events.
 *
 * Exactly one event is emitted per successful transition. Events carry no secret
 * data and can be read by any observer.
 */
public interface ProductEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * The product this event is about.
     */
    long getProductId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
