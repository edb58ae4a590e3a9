package com.flagship.supply_chain.product.event;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.Product;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ProductReceivedEvent implements ProductEvent {
    UUID eventId;
    long productId;
    Principal buyer;
    String location;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProductReceived";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ProductReceivedEvent fromProduct(Product product) {
        return new ProductReceivedEvent(
            UUID.randomUUID(),
            product.getId(),
            product.getBuyer(),
            product.getLocation(),
            Instant.now()
        );
    }
}
