package com.ai.handoff.conversation;

/**
 * Structured part of an assistant reply. The coordinator acts on this, never on the text.
 */
public record AssistantSignal(HandoffPriority handoffPriority, boolean visitIntent, int sentimentScore) {

    public static AssistantSignal none() {
        return new AssistantSignal(HandoffPriority.NONE, false, 0);
    }
}
