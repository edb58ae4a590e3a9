package com.flagship.supply_chain.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.LifecycleStage;
import com.flagship.supply_chain.product.Product;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for product operations. Unbound shipper and buyer are null.
 */
@Value
@Builder
public class ProductResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("origin")
    String origin;

    @JsonProperty("producer")
    String producer;

    @JsonProperty("shipper")
    String shipper;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("location")
    String location;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("is_paid")
    boolean paid;

    @JsonProperty("is_received")
    boolean received;

    @JsonProperty("is_disputed")
    boolean disputed;

    @JsonProperty("stage")
    LifecycleStage stage;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ProductResponse from(Product product) {
        return ProductResponse.builder()
            .id(product.getId())
            .name(product.getName())
            .origin(product.getOrigin())
            .producer(product.getProducer().getAddress())
            .shipper(product.shipperIfBound().map(Principal::getAddress).orElse(null))
            .buyer(product.buyerIfBound().map(Principal::getAddress).orElse(null))
            .location(product.getLocation())
            .price(product.getPrice())
            .paid(product.isPaid())
            .received(product.isReceived())
            .disputed(product.isDisputed())
            .stage(product.getStage())
            .createdAt(product.getCreatedAt())
            .updatedAt(product.getUpdatedAt())
            .build();
    }
}
