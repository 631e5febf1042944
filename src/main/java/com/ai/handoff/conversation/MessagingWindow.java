package com.ai.handoff.conversation;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Free-form messaging window of the messaging provider. Outside it only approved
 * templates can be sent.
 */
public record MessagingWindow(boolean open, @Nullable Instant lastClientMessageAt, Duration remaining) {

    public static MessagingWindow closed(@Nullable Instant lastClientMessageAt) {
        return new MessagingWindow(false, lastClientMessageAt, Duration.ZERO);
    }

    public boolean requiresTemplate() {
        return !open;
    }
}
