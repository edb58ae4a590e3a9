package com.flagship.supply_chain.product.event;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.Product;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A producer registered a new product.
 */
@Value
public class ProductCreatedEvent implements ProductEvent {
    UUID eventId;
    long productId;
    String name;
    String origin;
    BigDecimal price;
    Principal producer;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProductCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ProductCreatedEvent fromProduct(Product product) {
        return new ProductCreatedEvent(
            UUID.randomUUID(),
            product.getId(),
            product.getName(),
            product.getOrigin(),
            product.getPrice(),
            product.getProducer(),
            Instant.now()
        );
    }
}
