package com.ai.handoff.dto;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * What the caller should do with an inbound message.
 *
 * <ul>
 *   <li>owner: {@code shouldProcess} and {@code aggregating}; drain after {@code delay}</li>
 *   <li>follower: neither; the message sits in another worker's buffer</li>
 *   <li>degraded: {@code shouldProcess} with {@code combinedText} set; process now</li>
 * </ul>
 */
public record AggregationDecision(
        boolean shouldProcess,
        boolean aggregating,
        long bufferCount,
        @Nullable String combinedText,
        Duration delay
) {

    public static AggregationDecision owner(long bufferCount, Duration window) {
        return new AggregationDecision(true, true, bufferCount, null, window);
    }

    public static AggregationDecision follower(long bufferCount) {
        return new AggregationDecision(false, true, bufferCount, null, Duration.ZERO);
    }

    public static AggregationDecision immediate(String text) {
        return new AggregationDecision(true, false, 1, text, Duration.ZERO);
    }

    public boolean isImmediate() {
        return shouldProcess && !aggregating;
    }
}
