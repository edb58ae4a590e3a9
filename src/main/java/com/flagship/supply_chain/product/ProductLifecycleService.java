package com.flagship.supply_chain.product;

import com.flagship.supply_chain.access.AccessService;
import com.flagship.supply_chain.access.Principal;
import com.flagship.supply_chain.access.Role;
import com.flagship.supply_chain.events.EventLog;
import com.flagship.supply_chain.events.LoggedEvent;
import com.flagship.supply_chain.ledger.InsufficientBalanceException;
import com.flagship.supply_chain.ledger.LedgerTransferException;
import com.flagship.supply_chain.ledger.TokenLedger;
import com.flagship.supply_chain.observability.CorrelationContext;
import com.flagship.supply_chain.observability.LifecycleMetrics;
import com.flagship.supply_chain.product.event.DisputeRaisedEvent;
import com.flagship.supply_chain.product.event.DisputeResolvedEvent;
import com.flagship.supply_chain.product.event.PaymentTransferredEvent;
import com.flagship.supply_chain.product.event.ProductCreatedEvent;
import com.flagship.supply_chain.product.event.ProductEvent;
import com.flagship.supply_chain.product.event.ProductReceivedEvent;
import com.flagship.supply_chain.product.event.ProductShippedEvent;
import com.flagship.supply_chain.product.exception.FailureReason;
import com.flagship.supply_chain.product.exception.ProductLifecycleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Validates and applies product lifecycle transitions.
 *
 * Each transition:
 * 1. Checks caller role, then verification (role-gated transitions only)
 * 2. Takes the product's lock and loads the current record (NOT_FOUND if absent)
 * 3. Checks state preconditions in a fixed order (INVALID_STATE)
 * 4. Performs the ledger interaction, if any (INSUFFICIENT_FUNDS, TRANSFER_FAILED)
 * 5. Writes the new record back and appends exactly one event, still under the lock
 *
 * The first failed check aborts the transition with a {@link ProductLifecycleException};
 * nothing is written and no event is appended. Role, verification and balance are read
 * fresh on every call.
 *
 * Payment is open to any principal: who pays and who takes custody are bound separately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductLifecycleService {

    private final ProductStore productStore;
    private final AccessService accessService;
    private final TokenLedger tokenLedger;
    private final EventLog eventLog;
    private final LifecycleMetrics lifecycleMetrics;

    /**
     * Registers a new product owned by the calling producer.
     * Requires PRODUCER role and verification.
     */
    public Product createProduct(Principal caller, String name, String origin, BigDecimal price) {
        return execute("create", caller, null, () -> {
            accessService.requireVerifiedRole(caller, Role.PRODUCER);

            Product product = productStore.create(Product.register(name, origin, price, caller),
                stored -> eventLog.append(ProductCreatedEvent.fromProduct(stored)));

            CorrelationContext.bindProduct(product.getId());
            log.info("Product created: name={}, origin={}, price={}", name, origin, price);
            return product;
        });
    }

    /**
     * Pays the product price from the caller to the producer.
     * No role or verification is needed.
     */
    public Product payForProduct(Principal caller, long productId) {
        return execute("pay", caller, productId, () -> productStore.withLock(productId, () -> {
            Product product = load(productId);
            Product paid = checked(product, product.markPaid());

            BigDecimal balance = tokenLedger.balanceOf(caller);
            if (balance.compareTo(product.getPrice()) < 0) {
                throw insufficientFunds(productId, caller, balance, product.getPrice());
            }

            UUID ledgerTransactionId;
            try {
                ledgerTransactionId = tokenLedger.transfer(caller, product.getProducer(), product.getPrice());
            } catch (InsufficientBalanceException e) {
                // Balance was spent elsewhere between the read and the transfer
                throw insufficientFunds(productId, caller, e.getBalance(), product.getPrice());
            } catch (LedgerTransferException e) {
                throw new ProductLifecycleException(FailureReason.TRANSFER_FAILED, productId,
                    "Ledger transfer failed: " + e.getMessage(), e);
            }

            commit(paid, PaymentTransferredEvent.fromProduct(paid, caller, ledgerTransactionId));
            log.info("Payment transferred: payer={}, payee={}, amount={}, ledgerTxId={}",
                caller, product.getProducer(), product.getPrice(), ledgerTransactionId);
            return paid;
        }));
    }

    /**
     * Hands a paid, undisputed product to the calling shipper at a new location.
     * Requires SHIPPER role and verification.
     */
    public Product shipProduct(Principal caller, long productId, String location) {
        return execute("ship", caller, productId, () -> {
            accessService.requireVerifiedRole(caller, Role.SHIPPER);
            if (location == null || location.isBlank()) {
                throw new IllegalArgumentException("Shipment location is required");
            }

            return productStore.withLock(productId, () -> {
                Product product = load(productId);
                Product shipped = checked(product, product.ship(caller, location));

                commit(shipped, ProductShippedEvent.fromProduct(shipped));
                log.info("Product shipped: location={}", location);
                return shipped;
            });
        });
    }

    /**
     * Binds the calling buyer and marks the product received.
     * Requires BUYER role and verification.
     */
    public Product receiveProduct(Principal caller, long productId) {
        return execute("receive", caller, productId, () -> {
            accessService.requireVerifiedRole(caller, Role.BUYER);

            return productStore.withLock(productId, () -> {
                Product product = load(productId);
                Product received = checked(product, product.receive(caller));

                commit(received, ProductReceivedEvent.fromProduct(received));
                log.info("Product received: location={}", received.getLocation());
                return received;
            });
        });
    }

    /**
     * Opens a dispute. Only the producer or the currently bound buyer may do so.
     *
     * The buyer is bound at receipt and a received product cannot be disputed, so in
     * practice only the producer can raise one.
     */
    public Product raiseDispute(Principal caller, long productId) {
        return execute("raise_dispute", caller, productId, () -> productStore.withLock(productId, () -> {
            Product product = load(productId);

            boolean isProducer = product.getProducer().equals(caller);
            boolean isBuyer = product.buyerIfBound().map(caller::equals).orElse(false);
            if (!isProducer && !isBuyer) {
                throw ProductLifecycleException.unauthorized(productId,
                    String.format("Principal %s is neither producer nor buyer of product %s", caller, productId));
            }

            Product disputed = checked(product, product.raiseDispute());
            commit(disputed, DisputeRaisedEvent.fromProduct(disputed, caller));
            log.info("Dispute raised: stage={}", disputed.getStage());
            return disputed;
        }));
    }

    /**
     * Clears an open dispute. Requires ADMIN role.
     */
    public Product resolveDispute(Principal caller, long productId) {
        return execute("resolve_dispute", caller, productId, () -> {
            accessService.requireRole(caller, Role.ADMIN);

            return productStore.withLock(productId, () -> {
                Product product = load(productId);
                Product resolved = checked(product, product.resolveDispute());

                commit(resolved, DisputeResolvedEvent.fromProduct(resolved, caller));
                log.info("Dispute resolved: stage={}", resolved.getStage());
                return resolved;
            });
        });
    }

    /**
     * Marks a principal verified. Requires ADMIN role. Emits no event.
     */
    public void verifyUser(Principal caller, Principal principal) {
        execute("verify_user", caller, null, () -> {
            accessService.verifyUser(caller, principal);
            return null;
        });
    }

    public Product getProduct(long productId) {
        return load(productId);
    }

    public List<Product> listProducts() {
        return productStore.findAll();
    }

    public List<LoggedEvent> eventsFor(long productId) {
        load(productId);
        return eventLog.forProduct(productId);
    }

    private Product load(long productId) {
        return productStore.get(productId)
            .orElseThrow(() -> ProductLifecycleException.notFound(productId));
    }

    private ProductLifecycleException insufficientFunds(long productId, Principal payer,
                                                        BigDecimal balance, BigDecimal price) {
        return new ProductLifecycleException(FailureReason.INSUFFICIENT_FUNDS, productId,
            String.format("Balance %s of %s is below price %s", balance, payer, price));
    }

    /**
     * Checks the candidate record before anything outside the store is touched.
     */
    private Product checked(Product before, Product after) {
        after.checkInvariants();
        if (!before.isProgressionTo(after)) {
            throw new IllegalStateException("Transition would regress product " + before.getId());
        }
        return after;
    }

    private void commit(Product after, ProductEvent event) {
        productStore.put(after);
        eventLog.append(event);
    }

    private <T> T execute(String transition, Principal caller, Long productId, Supplier<T> body) {
        long startTime = System.currentTimeMillis();

        try {
            if (caller == null) {
                throw new IllegalArgumentException("Caller principal is required");
            }
            CorrelationContext.bindTransition(caller, productId);

            T result = body.get();
            lifecycleMetrics.recordSuccess(transition, System.currentTimeMillis() - startTime);
            return result;

        } catch (ProductLifecycleException e) {
            lifecycleMetrics.recordRejection(transition, e.getReason().name(),
                System.currentTimeMillis() - startTime);
            log.warn("Transition {} rejected: reason={}, message={}", transition, e.getReason(), e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            lifecycleMetrics.recordRejection(transition, "INVALID_ARGUMENT",
                System.currentTimeMillis() - startTime);
            log.warn("Transition {} rejected: invalid argument: {}", transition, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            lifecycleMetrics.recordRejection(transition, "error", System.currentTimeMillis() - startTime);
            log.error("Transition {} failed unexpectedly", transition, e);
            throw e;
        } finally {
            CorrelationContext.clearTransition();
        }
    }
}
