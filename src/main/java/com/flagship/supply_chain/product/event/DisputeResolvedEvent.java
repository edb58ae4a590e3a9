package com.flagship.supply_chain.product.event;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.LifecycleStage;
import com.flagship.supply_chain.product.Product;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class DisputeResolvedEvent implements ProductEvent {
    UUID eventId;
    long productId;
    Principal resolvedBy;
    LifecycleStage stage;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DisputeResolved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DisputeResolvedEvent fromProduct(Product product, Principal resolvedBy) {
        return new DisputeResolvedEvent(
            UUID.randomUUID(),
            product.getId(),
            resolvedBy,
            product.getStage(),
            Instant.now()
        );
    }
}
