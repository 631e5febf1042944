package com.ai.handoff.conversation;

/**
 * Result of the dual-timeout check on a human-owned conversation.
 */
public enum TimeoutSignal {
    NONE,
    /** Client went silent after the operator's last message. */
    CLIENT_TIMEOUT,
    /** Operator never answered the client's last message. */
    ADVISOR_TIMEOUT;

    public boolean reclaims() {
        return this != NONE;
    }
}
