package com.flagship.supply_chain.product;

import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.product.exception.FailureReason;
import com.flagship.supply_chain.product.exception.ProductLifecycleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProductStoreTest {

    private static final Principal PRODUCER = Principal.of("0xproducer");

    private ProductStore store;

    @BeforeEach
    void setUp() {
        store = new ProductStore();
    }

    private Product unsaved(String name) {
        return Product.register(name, "Factory-A", BigDecimal.TEN, PRODUCER);
    }

    @Test
    @DisplayName("Ids are assigned sequentially starting at 1")
    void testSequentialIds() {
        assertEquals(1L, store.create(unsaved("a")).getId());
        assertEquals(2L, store.create(unsaved("b")).getId());
        assertEquals(3L, store.create(unsaved("c")).getId());
        assertEquals(3, store.count());
        assertEquals(List.of(1L, 2L, 3L), store.findAll().stream().map(Product::getId).toList());
    }

    @Test
    @DisplayName("Absent ids are reported as empty or NOT_FOUND")
    void testAbsent() {
        assertTrue(store.get(42L).isEmpty());

        ProductLifecycleException e = assertThrows(ProductLifecycleException.class,
            () -> store.withLock(42L, () -> "unreachable"));
        assertEquals(FailureReason.NOT_FOUND, e.getReason());
        assertEquals(42L, e.getProductId());
    }

    @Test
    @DisplayName("put overwrites an existing record only while holding its lock")
    void testPutRequiresLock() {
        Product created = store.create(unsaved("a"));
        Product paid = created.markPaid();

        assertThrows(IllegalStateException.class, () -> store.put(paid));
        assertFalse(store.get(created.getId()).orElseThrow().isPaid());

        store.withLock(created.getId(), () -> {
            store.put(paid);
            return null;
        });
        assertTrue(store.get(created.getId()).orElseThrow().isPaid());
    }

    @Test
    @DisplayName("Failing post-insert hook removes the new record and keeps its id consumed")
    void testCreateRollsBackOnHookFailure() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> store.create(unsaved("a"), stored -> {
                throw new IllegalStateException("event log unavailable");
            }));
        assertEquals("event log unavailable", e.getMessage());

        assertTrue(store.get(1L).isEmpty());
        assertEquals(0, store.count());
        assertThrows(ProductLifecycleException.class, () -> store.withLock(1L, () -> "unreachable"));

        assertEquals(2L, store.create(unsaved("b")).getId());
        assertEquals(1, store.count());
    }

    @Test
    @DisplayName("put on an unknown id is NOT_FOUND")
    void testPutUnknown() {
        Product ghost = unsaved("ghost").withId(99L);

        ProductLifecycleException e = assertThrows(ProductLifecycleException.class, () -> store.put(ghost));
        assertEquals(FailureReason.NOT_FOUND, e.getReason());
    }

    @Test
    @DisplayName("Creation callback runs before any other transition can lock the new id")
    void testCreateCallback() {
        List<Long> seen = new ArrayList<>();
        Product created = store.create(unsaved("a"), stored -> seen.add(stored.getId()));

        assertEquals(List.of(created.getId()), seen);
    }

    @Test
    @DisplayName("withLock never lets two actions on the same id overlap")
    void testSameIdIsSerialized() throws InterruptedException {
        long id = store.create(unsaved("a")).getId();
        int threads = 8;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    store.withLock(id, () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.onSpinWait();
                        inside.decrementAndGet();
                        return null;
                    });
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, maxInside.get());
    }

    @Test
    @DisplayName("Locks on different ids are independent")
    void testDifferentIdsDoNotContend() throws InterruptedException {
        long first = store.create(unsaved("a")).getId();
        long second = store.create(unsaved("b")).getId();
        CountDownLatch holdingFirst = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> store.withLock(first, () -> {
            holdingFirst.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertTrue(holdingFirst.await(5, TimeUnit.SECONDS));

        // Must not block while the first id is held
        String result = store.withLock(second, () -> "second");
        assertEquals("second", result);

        release.countDown();
        holder.join(5000);
    }
}
