package com.ai.handoff.service;

import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.AggregationDecision;
import com.ai.handoff.store.CoordinationStore;
import com.ai.handoff.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Coalesces bursts of messages from one session into a single unit of work.
 *
 * <p>The first message of a burst wins a test-and-set lock and becomes the owner; it
 * drains the buffer once the window has passed. Every other message only appends.
 * Lock, marker and buffer all outlive the window so the owner cannot lose them
 * mid-wait.
 */
@Service
public class MessageAggregator {

    private static final Logger log = LoggerFactory.getLogger(MessageAggregator.class);

    public static final String SEPARATOR = " ";

    private static final Duration LOCK_MARGIN = Duration.ofSeconds(5);
    private static final Duration MARKER_MARGIN = Duration.ofSeconds(10);
    private static final Duration BUFFER_MARGIN = Duration.ofSeconds(60);

    private final CoordinationStore store;
    private final SessionKeyspace keyspace;
    private final Duration window;

    public MessageAggregator(CoordinationStore store,
                             SessionKeyspace keyspace,
                             @Value("${handoff.aggregation.window:30s}") Duration window) {
        this.store = store;
        this.keyspace = keyspace;
        this.window = window;
    }

    public Duration getWindow() {
        return window;
    }

    public AggregationDecision offer(SessionRef ref, String text) {
        boolean ownsLock = false;
        try {
            if (store.exists(keyspace.processingKey(ref))) {
                long count = store.append(keyspace.bufferKey(ref), text, bufferTtl());
                log.debug("[{}] Buffered behind active aggregation ({} messages)", ref, count);
                return AggregationDecision.follower(count);
            }

            String token = UUID.randomUUID().toString();
            if (!store.setIfAbsent(keyspace.lockKey(ref), token, window.plus(LOCK_MARGIN))) {
                long count = store.append(keyspace.bufferKey(ref), text, bufferTtl());
                log.debug("[{}] Lost aggregation lock race ({} messages)", ref, count);
                return AggregationDecision.follower(count);
            }
            ownsLock = true;

            store.set(keyspace.processingKey(ref), token, window.plus(MARKER_MARGIN));
            long count = store.append(keyspace.bufferKey(ref), text, bufferTtl());
            log.info("[{}] Aggregation started, draining in {}", ref, window);
            return AggregationDecision.owner(count, window);
        } catch (StoreUnavailableException e) {
            log.warn("[{}] Store unavailable, processing without aggregation: {}", ref, e.getMessage());
            if (ownsLock) {
                // no drain will be scheduled for this burst
                clear(ref);
            }
            return AggregationDecision.immediate(text);
        }
    }

    /**
     * Reads the buffer in arrival order and releases buffer, lock and marker in one
     * multi-key delete. A message appended between the read and the delete is lost.
     *
     * @return the messages joined with a single space, empty if nothing was buffered
     */
    public Optional<String> drain(SessionRef ref) {
        try {
            List<String> messages = store.range(keyspace.bufferKey(ref));
            store.delete(keyspace.bufferKey(ref), keyspace.lockKey(ref), keyspace.processingKey(ref));
            if (messages.isEmpty()) {
                log.warn("[{}] Drained an empty buffer", ref);
                return Optional.empty();
            }
            log.info("[{}] Drained {} message(s)", ref, messages.size());
            return Optional.of(String.join(SEPARATOR, messages));
        } catch (StoreUnavailableException e) {
            log.error("[{}] Store unavailable while draining: {}", ref, e.getMessage());
            clear(ref);
            return Optional.empty();
        }
    }

    /**
     * Drops buffer, lock and marker. Failures are logged.
     */
    public void clear(SessionRef ref) {
        try {
            store.delete(keyspace.bufferKey(ref), keyspace.lockKey(ref), keyspace.processingKey(ref));
        } catch (StoreUnavailableException e) {
            log.error("[{}] Could not clear aggregation keys: {}", ref, e.getMessage());
        }
    }

    private Duration bufferTtl() {
        return window.plus(BUFFER_MARGIN);
    }
}
