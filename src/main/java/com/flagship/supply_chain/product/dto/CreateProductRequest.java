package com.flagship.supply_chain.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateProductRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Origin is required")
    @JsonProperty("origin")
    String origin;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price must not be negative")
    @JsonProperty("price")
    BigDecimal price;
}
