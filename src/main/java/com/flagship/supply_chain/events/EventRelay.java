package com.flagship.supply_chain.events;

import com.flagship.supply_chain.observability.CorrelationContext;
import com.flagship.supply_chain.observability.EventLogMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background relay that copies event log entries to Kafka.
 *
 * Polls the log for unpublished entries, sends each one keyed by product id (so all
 * events of one product land on one partition, in order) and marks it published once
 * the broker acknowledges. A failed send increments the entry's retry count; entries
 * at the retry limit are left in the log as dead letters.
 *
 * Disabled unless events.relay.enabled=true.
 */
@Component
@ConditionalOnProperty(name = "events.relay.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class EventRelay {

    private final EventLog eventLog;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final EventLogMetrics eventLogMetrics;

    @Value("${events.relay.topic:product-events}")
    private String topic;

    @Value("${events.relay.batch-size:100}")
    private int batchSize;

    @Value("${events.relay.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${events.relay.poll-interval-ms:1000}")
    public void relayPendingEvents() {
        List<LoggedEvent> pending = eventLog.findUnpublished(batchSize, maxRetries);
        if (pending.isEmpty()) {
            return;
        }

        CorrelationContext.bindCorrelationId(null);
        try {
            log.debug("Relaying {} unpublished events to {}", pending.size(), topic);
            for (LoggedEvent entry : pending) {
                relay(entry);
            }
        } catch (Exception e) {
            log.error("Event relay pass aborted", e);
        } finally {
            CorrelationContext.clearAll();
        }
    }

    private void relay(LoggedEvent entry) {
        String key = Long.toString(entry.getProductId());

        try {
            // Synchronous send keeps per-product ordering
            CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(topic, key, entry.getPayload());
            SendResult<String, String> result = future.get();

            log.debug("Relayed event: seq={}, topic={}, partition={}, offset={}, eventType={}",
                entry.getSequenceNumber(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                entry.getEventType());

            eventLog.markPublished(entry.getSequenceNumber());
            eventLogMetrics.recordEventRelayed(entry.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            eventLog.markFailed(entry.getSequenceNumber(), "interrupted");
            eventLogMetrics.recordEventRelayFailed(entry.getEventType());
        } catch (Exception e) {
            log.error("Failed to relay event: seq={}, eventType={}, error={}",
                entry.getSequenceNumber(), entry.getEventType(), e.getMessage());
            eventLog.markFailed(entry.getSequenceNumber(), e.getMessage());
            eventLogMetrics.recordEventRelayFailed(entry.getEventType());

            if (entry.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), left as dead letter. eventType={}, productId={}",
                    entry.getSequenceNumber(), maxRetries, entry.getEventType(), entry.getProductId());
                eventLogMetrics.recordEventDeadLettered(entry.getEventType());
            }
        }
    }

    /**
     * Runs one relay pass immediately.
     */
    public void triggerRelay() {
        relayPendingEvents();
    }
}
