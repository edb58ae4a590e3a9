package com.flagship.supply_chain.observability;

import com.flagship.supply_chain.events.EventLog;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Metrics for the event log and its Kafka relay.
 *
 * - events.log.size: total entries
 * - events.relay.backlog: entries not yet relayed
 * - events.relay.dead_lettered: entries that reached the retry limit
 * - events.relayed{event_type, status}: relay attempts
 */
@Component
@Slf4j
public class EventLogMetrics {

    private final EventLog eventLog;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;

    public EventLogMetrics(EventLog eventLog, MeterRegistry meterRegistry,
                           @Value("${events.relay.max-retries:5}") int maxRetries) {
        this.eventLog = eventLog;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("events.log.size", eventLog, EventLog::size)
            .description("Number of entries in the event log")
            .register(meterRegistry);

        Gauge.builder("events.relay.backlog", eventLog, EventLog::countUnpublished)
            .description("Number of event log entries not yet relayed")
            .register(meterRegistry);

        Gauge.builder("events.relay.dead_lettered", eventLog, events -> events.countDeadLettered(maxRetries))
            .description("Number of entries that exceeded the relay retry limit")
            .register(meterRegistry);

        log.info("Event log metrics registered with Micrometer");
    }

    public void recordEventRelayed(String eventType) {
        meterRegistry.counter("events.relayed",
            "event_type", eventType,
            "status", "success"
        ).increment();
    }

    public void recordEventRelayFailed(String eventType) {
        meterRegistry.counter("events.relayed",
            "event_type", eventType,
            "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("events.relay.dead_lettered.total",
            "event_type", eventType
        ).increment();
    }
}
