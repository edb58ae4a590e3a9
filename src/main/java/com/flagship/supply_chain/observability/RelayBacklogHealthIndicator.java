package com.flagship.supply_chain.observability;

import com.flagship.supply_chain.events.EventLog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the event relay backlog. Only meaningful when the relay is enabled;
 * otherwise the backlog simply grows and the indicator reports that fact as UP.
 */
@Component("eventRelayHealth")
public class RelayBacklogHealthIndicator implements HealthIndicator {

    private static final long BACKLOG_WARNING_THRESHOLD = 1000;
    private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

    private final EventLog eventLog;
    private final boolean relayEnabled;

    public RelayBacklogHealthIndicator(EventLog eventLog,
                                       @Value("${events.relay.enabled:false}") boolean relayEnabled) {
        this.eventLog = eventLog;
        this.relayEnabled = relayEnabled;
    }

    @Override
    public Health health() {
        long backlogSize = eventLog.countUnpublished();

        Health.Builder builder;
        if (!relayEnabled || backlogSize < BACKLOG_WARNING_THRESHOLD) {
            builder = Health.up();
        } else if (backlogSize < BACKLOG_CRITICAL_THRESHOLD) {
            builder = Health.status("WARNING");
        } else {
            builder = Health.down();
        }

        return builder
            .withDetail("relayEnabled", relayEnabled)
            .withDetail("backlogSize", backlogSize)
            .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
            .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
            .build();
    }
}
