package com.flagship.supply_chain.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ShipProductRequest {

    @NotBlank(message = "Location is required")
    @JsonProperty("location")
    String location;
}
