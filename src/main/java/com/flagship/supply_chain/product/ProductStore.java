package com.flagship.supply_chain.product;

import com.flagship.supply_chain.product.exception.ProductLifecycleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Authoritative mapping from product id to product record.
 *
 * Ids are assigned sequentially from 1 and never reused. Created records are never removed;
 * {@link #put} only overwrites an existing key.
 *
 * Each record lives in its own slot with its own lock. {@link #withLock} serializes
 * read-modify-write sequences on one id; different ids never contend. An id that
 * has no record never gets a lock.
 */
@Component
@Slf4j
public class ProductStore {

    private final ConcurrentHashMap<Long, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Assigns the next id and inserts the record.
     *
     * @return the stored record, carrying its id
     */
    public Product create(Product unsaved) {
        return create(unsaved, stored -> { });
    }

    /**
     * Assigns the next id, inserts the record and runs {@code afterInsert} while still
     * holding the new record's lock, so no other transition on the id can run before it.
     *
     * If {@code afterInsert} throws, the record is removed before the lock is released and
     * the exception propagates. The id stays consumed.
     *
     * @return the stored record, carrying its id
     */
    public Product create(Product unsaved, Consumer<Product> afterInsert) {
        Product stored = unsaved.withId(sequence.incrementAndGet()).checkInvariants();
        Slot slot = new Slot(stored);
        slot.lock.lock();
        try {
            slots.put(stored.getId(), slot);
            log.debug("Stored new product {}", stored.getId());
            try {
                afterInsert.accept(stored);
            } catch (RuntimeException e) {
                slots.remove(stored.getId(), slot);
                log.warn("Rolled back new product {}: {}", stored.getId(), e.getMessage());
                throw e;
            }
        } finally {
            slot.lock.unlock();
        }
        return stored;
    }

    public Optional<Product> get(long id) {
        Slot slot = slots.get(id);
        return slot == null ? Optional.empty() : Optional.of(slot.product);
    }

    /**
     * Overwrites an existing record. Must be called while holding the record's lock.
     *
     * @throws ProductLifecycleException with NOT_FOUND if no record exists under the id
     */
    public void put(Product product) {
        Slot slot = slots.get(product.getId());
        if (slot == null) {
            throw ProductLifecycleException.notFound(product.getId());
        }
        if (!slot.lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Product " + product.getId() + " written without holding its lock");
        }
        slot.product = product;
    }

    /**
     * Runs {@code action} while holding the exclusive lock of one record.
     *
     * @throws ProductLifecycleException with NOT_FOUND if no record exists under the id
     */
    public <T> T withLock(long id, Supplier<T> action) {
        Slot slot = slots.get(id);
        if (slot == null) {
            throw ProductLifecycleException.notFound(id);
        }
        slot.lock.lock();
        try {
            return action.get();
        } finally {
            slot.lock.unlock();
        }
    }

    public List<Product> findAll() {
        return slots.values().stream()
            .map(slot -> slot.product)
            .sorted(Comparator.comparingLong(Product::getId))
            .toList();
    }

    public long count() {
        return slots.size();
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Product product;

        private Slot(Product product) {
            this.product = product;
        }
    }
}
