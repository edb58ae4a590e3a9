package com.flagship.supply_chain.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for product lifecycle transitions.
 *
 * Metrics exposed:
 * - product.transitions{transition, outcome}: counter, outcome is "success" or the failure reason
 * - product.transition.latency{transition}: timer
 */
@Component
public class LifecycleMetrics {

    private final MeterRegistry registry;

    public LifecycleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSuccess(String transition, long durationMs) {
        record(transition, "success", durationMs);
    }

    public void recordRejection(String transition, String reason, long durationMs) {
        record(transition, reason, durationMs);
    }

    public double count(String transition, String outcome) {
        var counter = registry.find("product.transitions")
            .tags("transition", sanitizeTag(transition), "outcome", sanitizeTag(outcome))
            .counter();
        return counter == null ? 0 : counter.count();
    }

    private void record(String transition, String outcome, long durationMs) {
        registry.counter("product.transitions",
            "transition", sanitizeTag(transition),
            "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("product.transition.latency",
            "transition", sanitizeTag(transition)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
