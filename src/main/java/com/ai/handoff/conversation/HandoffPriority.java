package com.ai.handoff.conversation;

import java.util.Locale;

public enum HandoffPriority {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    IMMEDIATE;

    public boolean requiresHandoff() {
        return this == HIGH || this == IMMEDIATE;
    }

    public static HandoffPriority fromValue(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (HandoffPriority priority : values()) {
            if (priority.name().equals(normalized)) {
                return priority;
            }
        }
        return NONE;
    }
}
