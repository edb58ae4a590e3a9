package com.flagship.supply_chain.product.exception;

import org.springframework.http.HttpStatus;

/**
 * Why a requested transition was rejected.
 *
 * Each reason maps to one HTTP status so clients can tell them apart without parsing messages.
 */
public enum FailureReason {
    /**
     * Caller lacks the required role, or is neither producer nor buyer of the product.
     */
    UNAUTHORIZED(HttpStatus.FORBIDDEN),

    /**
     * Caller holds the role but has not been verified by an admin.
     */
    NOT_VERIFIED(HttpStatus.FORBIDDEN),

    /**
     * No product exists under the requested id.
     */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /**
     * The product is not in a state that allows the transition.
     */
    INVALID_STATE(HttpStatus.CONFLICT),

    /**
     * Payer balance is below the product price.
     */
    INSUFFICIENT_FUNDS(HttpStatus.PAYMENT_REQUIRED),

    /**
     * The ledger refused the transfer despite a sufficient balance.
     */
    TRANSFER_FAILED(HttpStatus.BAD_GATEWAY);

    private final HttpStatus httpStatus;

    FailureReason(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
