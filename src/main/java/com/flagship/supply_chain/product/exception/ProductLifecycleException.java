package com.flagship.supply_chain.product.exception;

import lombok.Getter;

/**
 * Rejection of a single transition request.
 *
 * Thrown before any state is written, so a caller catching it can assume the
 * product, the ledger and the event log are exactly as they were before the call.
 */
@Getter
public class ProductLifecycleException extends RuntimeException {

    private final FailureReason reason;
    private final Long productId;

    public ProductLifecycleException(FailureReason reason, Long productId, String message) {
        super(message);
        this.reason = reason;
        this.productId = productId;
    }

    public ProductLifecycleException(FailureReason reason, Long productId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.productId = productId;
    }

    public static ProductLifecycleException notFound(long productId) {
        return new ProductLifecycleException(FailureReason.NOT_FOUND, productId,
            "Product not found: " + productId);
    }

    public static ProductLifecycleException invalidState(long productId, String message) {
        return new ProductLifecycleException(FailureReason.INVALID_STATE, productId, message);
    }

    public static ProductLifecycleException unauthorized(Long productId, String message) {
        return new ProductLifecycleException(FailureReason.UNAUTHORIZED, productId, message);
    }
}
