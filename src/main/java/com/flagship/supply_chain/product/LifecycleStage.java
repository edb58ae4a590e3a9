package com.flagship.supply_chain.product;

/**
 * Position of a product on the main custody axis.
 *
 * Derived from the product flags, never stored. The dispute flag is orthogonal
 * and does not change the stage.
 *
 * CREATED → PAID → SHIPPED → RECEIVED
 */
public enum LifecycleStage {
    /**
     * Registered by a producer, not yet paid.
     */
    CREATED,

    /**
     * Paid, no shipper has taken it yet.
     */
    PAID,

    /**
     * Paid and handed to a shipper.
     */
    SHIPPED,

    /**
     * Custody taken by a buyer. Terminal.
     */
    RECEIVED
}
