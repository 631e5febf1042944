package com.ai.handoff.dto;

import com.ai.handoff.conversation.ConversationStatus;
import com.ai.handoff.conversation.TimeoutSignal;
import org.springframework.lang.Nullable;

/**
 * Context handed to the assistant together with the combined message text.
 */
public record AssistantRequest(
        String identity,
        String channel,
        String text,
        ConversationStatus status,
        TimeoutSignal timeoutSignal,
        @Nullable String displayName,
        int messageCount
) {
}
