package com.flagship.supply_chain.product;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.exception.ProductLifecycleException;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Product record: one per physical good.
 *
 * Immutable. Each transition method validates the state preconditions in a fixed
 * order and returns a new instance; the first violated precondition is reported.
 * Role and identity checks are not made here, see {@link ProductLifecycleService}.
 *
 * Shipper and buyer are absent until the corresponding transition binds them.
 */
@Value
public class Product {
    @With
    long id;
    String name;
    String origin;
    Principal producer;
    Principal shipper;
    Principal buyer;
    String location;
    BigDecimal price;
    boolean paid;
    boolean received;
    boolean disputed;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates an unsaved product. The store assigns the id.
     */
    public static Product register(String name, String origin, BigDecimal price, Principal producer) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Product name is required");
        }
        if (origin == null || origin.isBlank()) {
            throw new IllegalArgumentException("Product origin is required");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Product price must be non-negative");
        }
        if (producer == null) {
            throw new IllegalArgumentException("Producer is required");
        }
        Instant now = Instant.now();
        return new Product(0L, name, origin, producer, null, null, origin, price,
            false, false, false, now, now);
    }

    public Optional<Principal> shipperIfBound() {
        return Optional.ofNullable(shipper);
    }

    public Optional<Principal> buyerIfBound() {
        return Optional.ofNullable(buyer);
    }

    public boolean isShipped() {
        return shipper != null;
    }

    public LifecycleStage getStage() {
        if (received) {
            return LifecycleStage.RECEIVED;
        }
        if (isShipped()) {
            return LifecycleStage.SHIPPED;
        }
        return paid ? LifecycleStage.PAID : LifecycleStage.CREATED;
    }

    /**
     * Requires: not received, not paid.
     */
    public Product markPaid() {
        requireNotReceived("pay for");
        if (paid) {
            throw ProductLifecycleException.invalidState(id, "Product " + id + " is already paid");
        }
        return new Product(id, name, origin, producer, shipper, buyer, location, price,
            true, received, disputed, createdAt, Instant.now());
    }

    /**
     * Requires: not received, paid, not disputed.
     */
    public Product ship(Principal byShipper, String newLocation) {
        requireDeliverable("ship");
        return new Product(id, name, origin, producer, byShipper, buyer, newLocation, price,
            paid, received, disputed, createdAt, Instant.now());
    }

    /**
     * Requires: not received, paid, not disputed.
     */
    public Product receive(Principal byBuyer) {
        requireDeliverable("receive");
        return new Product(id, name, origin, producer, shipper, byBuyer, location, price,
            paid, true, disputed, createdAt, Instant.now());
    }

    /**
     * Requires: not received, not disputed. A received product is closed to disputes.
     */
    public Product raiseDispute() {
        requireNotReceived("dispute");
        if (disputed) {
            throw ProductLifecycleException.invalidState(id, "Product " + id + " is already disputed");
        }
        return new Product(id, name, origin, producer, shipper, buyer, location, price,
            paid, received, true, createdAt, Instant.now());
    }

    /**
     * Requires: disputed.
     */
    public Product resolveDispute() {
        if (!disputed) {
            throw ProductLifecycleException.invalidState(id, "Product " + id + " is not disputed");
        }
        return new Product(id, name, origin, producer, shipper, buyer, location, price,
            paid, received, false, createdAt, Instant.now());
    }

    /**
     * Validates the cross-field invariants. A violation here is a programming error,
     * not a rejected request.
     *
     * @throws IllegalStateException if any invariant does not hold
     */
    public Product checkInvariants() {
        if (id <= 0) {
            throw new IllegalStateException("Product id must be positive: " + id);
        }
        if (producer == null) {
            throw new IllegalStateException("Product " + id + " has no producer");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalStateException("Product " + id + " has a negative price");
        }
        if (received && !paid) {
            throw new IllegalStateException("Product " + id + " is received but not paid");
        }
        if (received && buyer == null) {
            throw new IllegalStateException("Product " + id + " is received without a buyer");
        }
        if (shipper != null && !paid) {
            throw new IllegalStateException("Product " + id + " is shipped but not paid");
        }
        return this;
    }

    /**
     * True if {@code next} does not undo any one-way flag of this record.
     */
    public boolean isProgressionTo(Product next) {
        return (!paid || next.paid)
            && (!received || next.received)
            && (!isShipped() || next.isShipped())
            && producer.equals(next.producer)
            && id == next.id;
    }

    private void requireNotReceived(String action) {
        if (received) {
            throw ProductLifecycleException.invalidState(id,
                String.format("Cannot %s product %s: already received", action, id));
        }
    }

    private void requireDeliverable(String action) {
        requireNotReceived(action);
        if (!paid) {
            throw ProductLifecycleException.invalidState(id,
                String.format("Cannot %s product %s: not paid", action, id));
        }
        if (disputed) {
            throw ProductLifecycleException.invalidState(id,
                String.format("Cannot %s product %s: dispute is open", action, id));
        }
    }
}
