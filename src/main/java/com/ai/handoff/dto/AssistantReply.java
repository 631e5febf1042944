package com.ai.handoff.dto;

import com.ai.handoff.conversation.AssistantSignal;
import org.apache.commons.lang3.StringUtils;

public record AssistantReply(String text, AssistantSignal signal) {

    public static AssistantReply empty() {
        return new AssistantReply("", AssistantSignal.none());
    }

    public boolean hasText() {
        return StringUtils.isNotBlank(text);
    }
}
