package com.ai.handoff.dto;

import org.springframework.lang.Nullable;

/**
 * Answer to the transport adapter for one inbound message.
 *
 * @param shouldRespond this message starts a unit of work (now or after the window)
 * @param deferred      the unit of work runs after the aggregation window
 * @param combinedText  text processed right away; null when deferred or buffered
 */
public record InboundResult(
        boolean shouldRespond,
        boolean deferred,
        @Nullable String combinedText,
        String identity,
        String channel,
        long bufferCount
) {
}
