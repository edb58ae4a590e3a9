package com.flagship.supply_chain.access;

/**
 * Named capability grants a principal may hold.
 *
 * Membership is independent per role: one principal may be both a SHIPPER and a BUYER.
 * Role membership alone is not enough for custody actions, the principal must also be verified.
 */
public enum Role {
    /**
     * Administers roles and verification, clears disputes.
     */
    ADMIN,

    /**
     * Registers new products.
     */
    PRODUCER,

    /**
     * Moves paid products between locations.
     */
    SHIPPER,

    /**
     * Takes custody of paid products.
     */
    BUYER
}
