package com.ai.handoff.conversation;

import java.util.Arrays;
import java.util.Optional;

public enum ConversationStatus {
    BOT_ACTIVE,
    PENDING_HANDOFF,
    HUMAN_ACTIVE,
    IN_CONVERSATION,
    CLOSED;

    /** Operator owns the conversation and the timeout detector applies. */
    public boolean isHumanOwned() {
        return this == HUMAN_ACTIVE || this == IN_CONVERSATION;
    }

    public static Optional<ConversationStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
