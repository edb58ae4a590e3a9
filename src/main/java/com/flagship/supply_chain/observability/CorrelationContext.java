package com.flagship.supply_chain.observability;

import com.flagship.supply_chain.access.Principal;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys used across the service and the helpers that bind them.
 *
 * Two scopes exist:
 * - request scope: {@code correlationId}, bound by {@link CorrelationIdFilter} for HTTP calls
 *   and per pass by the event relay
 * - transition scope: {@code principal} and {@code productId}, bound by the lifecycle service
 *   for the duration of one transition
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PRODUCT_ID_MDC_KEY = "productId";
    public static final String PRINCIPAL_MDC_KEY = "principal";

    private CorrelationContext() {
    }

    /**
     * Binds the inbound correlation id, or a generated one when the caller sent none.
     *
     * @return the bound id
     */
    public static String bindCorrelationId(String inbound) {
        String correlationId = inbound == null || inbound.isBlank()
            ? generateCorrelationId()
            : inbound.trim();
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        return correlationId;
    }

    /**
     * The bound correlation id, or null outside a request or relay pass.
     */
    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void bindTransition(Principal caller, Long productId) {
        MDC.put(PRINCIPAL_MDC_KEY, caller.getAddress());
        if (productId != null) {
            bindProduct(productId);
        }
    }

    /**
     * Binds a product id learned mid-transition, e.g. the id assigned at creation.
     */
    public static void bindProduct(long productId) {
        MDC.put(PRODUCT_ID_MDC_KEY, Long.toString(productId));
    }

    public static void clearTransition() {
        MDC.remove(PRINCIPAL_MDC_KEY);
        MDC.remove(PRODUCT_ID_MDC_KEY);
    }

    public static void clearAll() {
        clearTransition();
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Short random id, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
