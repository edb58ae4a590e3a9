package com.flagship.supply_chain.access;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * An authenticated caller identity (account address).
 *
 * Addresses are compared case-insensitively and stored lower-cased.
 */
@Value
public class Principal {
    @JsonValue
    String address;

    private Principal(String address) {
        this.address = address;
    }

    public static Principal of(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Principal address is required");
        }
        return new Principal(address.trim().toLowerCase());
    }

    @Override
    public String toString() {
        return address;
    }
}
