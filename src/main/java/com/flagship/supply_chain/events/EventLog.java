package com.flagship.supply_chain.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.supply_chain.product.event.ProductEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, ordered record of every product state change.
 *
 * The lifecycle service appends while still holding the product's lock and after the
 * record has been written back, so sequence order is completion order. Reading needs
 * no authorization.
 *
 * Publication to Kafka is done separately by {@link EventRelay}; the log itself only
 * tracks which entries have been relayed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLog {

    private final ObjectMapper objectMapper;

    private final List<LoggedEvent> entries = new ArrayList<>();

    /**
     * Appends an event and assigns its sequence number.
     *
     * @return the stored entry
     */
    public synchronized LoggedEvent append(ProductEvent event) {
        String payload = serializePayload(event);
        LoggedEvent entry = LoggedEvent.create(entries.size() + 1L, event.getEventId(),
            event.getProductId(), event.getEventType(), payload, event.getOccurredAt());
        entries.add(entry);

        log.debug("Appended event: seq={}, type={}, productId={}",
            entry.getSequenceNumber(), entry.getEventType(), entry.getProductId());
        return entry;
    }

    public synchronized List<LoggedEvent> all() {
        return List.copyOf(entries);
    }

    /**
     * Entries with a sequence number greater than {@code afterSequence}, oldest first.
     */
    public synchronized List<LoggedEvent> after(long afterSequence, int limit) {
        int from = (int) Math.max(0, Math.min(afterSequence, entries.size()));
        int to = (int) Math.min(entries.size(), (long) from + Math.max(0, limit));
        return List.copyOf(entries.subList(from, to));
    }

    public synchronized List<LoggedEvent> forProduct(long productId) {
        return entries.stream()
            .filter(entry -> entry.getProductId() == productId)
            .toList();
    }

    public synchronized Optional<LoggedEvent> find(long sequenceNumber) {
        if (sequenceNumber < 1 || sequenceNumber > entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get((int) sequenceNumber - 1));
    }

    public synchronized long size() {
        return entries.size();
    }

    /**
     * Unpublished entries still under the retry limit, oldest first.
     */
    public synchronized List<LoggedEvent> findUnpublished(int limit, int maxRetries) {
        List<LoggedEvent> pending = new ArrayList<>();
        for (LoggedEvent entry : entries) {
            if (pending.size() >= limit) {
                break;
            }
            if (!entry.isPublished() && entry.getRetryCount() < maxRetries) {
                pending.add(entry);
            }
        }
        return pending;
    }

    public synchronized long countUnpublished() {
        return entries.stream().filter(entry -> !entry.isPublished()).count();
    }

    public synchronized long countDeadLettered(int maxRetries) {
        return entries.stream()
            .filter(entry -> !entry.isPublished() && entry.getRetryCount() >= maxRetries)
            .count();
    }

    public synchronized void markPublished(long sequenceNumber) {
        find(sequenceNumber).ifPresent(entry -> {
            entries.set((int) sequenceNumber - 1, entry.markPublished());
            log.debug("Marked event {} as published", sequenceNumber);
        });
    }

    public synchronized void markFailed(long sequenceNumber, String errorMessage) {
        find(sequenceNumber).ifPresent(entry -> {
            LoggedEvent retried = entry.markRetry(errorMessage);
            entries.set((int) sequenceNumber - 1, retried);
            log.warn("Marked event {} as failed (retry #{}): {}",
                sequenceNumber, retried.getRetryCount(), errorMessage);
        });
    }

    private String serializePayload(ProductEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
