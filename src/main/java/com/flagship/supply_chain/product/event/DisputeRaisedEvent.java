package com.flagship.supply_chain.product.event;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.LifecycleStage;
import com.flagship.supply_chain.product.Product;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The producer or the bound buyer opened a dispute.
 * Shipment and receipt are blocked until an admin resolves it.
 */
@Value
public class DisputeRaisedEvent implements ProductEvent {
    UUID eventId;
    long productId;
    Principal raisedBy;
    LifecycleStage stage;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DisputeRaised";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DisputeRaisedEvent fromProduct(Product product, Principal raisedBy) {
        return new DisputeRaisedEvent(
            UUID.randomUUID(),
            product.getId(),
            raisedBy,
            product.getStage(),
            Instant.now()
        );
    }
}
