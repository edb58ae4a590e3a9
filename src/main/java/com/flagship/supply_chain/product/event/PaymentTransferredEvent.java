package com.flagship.supply_chain.product.event;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.Product;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The product price moved from the payer to the producer.
 *
 * The payer is whoever settled; it need not be the eventual buyer.
 */
@Value
public class PaymentTransferredEvent implements ProductEvent {
    UUID eventId;
    long productId;
    Principal payer;
    Principal payee;
    BigDecimal amount;
    UUID ledgerTransactionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentTransferred";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentTransferredEvent fromProduct(Product product, Principal payer, UUID ledgerTransactionId) {
        return new PaymentTransferredEvent(
            UUID.randomUUID(),
            product.getId(),
            payer,
            product.getProducer(),
            product.getPrice(),
            ledgerTransactionId,
            Instant.now()
        );
    }
}
