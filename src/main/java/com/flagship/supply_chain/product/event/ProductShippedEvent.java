package com.flagship.supply_chain.product.event;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.Product;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ProductShippedEvent implements ProductEvent {
    UUID eventId;
    long productId;
    Principal shipper;
    String location;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ProductShipped";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ProductShippedEvent fromProduct(Product product) {
        return new ProductShippedEvent(
            UUID.randomUUID(),
            product.getId(),
            product.getShipper(),
            product.getLocation(),
            Instant.now()
        );
    }
}
