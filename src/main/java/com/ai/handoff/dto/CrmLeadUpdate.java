package com.ai.handoff.dto;

import org.springframework.lang.Nullable;

public record CrmLeadUpdate(
        String identity,
        @Nullable String ownerId,
        @Nullable String handoffReason,
        String channel
) {
}
