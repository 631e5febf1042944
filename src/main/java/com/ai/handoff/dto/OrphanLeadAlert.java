package com.ai.handoff.dto;

import org.springframework.lang.Nullable;

import java.time.Instant;

public record OrphanLeadAlert(
        @Nullable String contactId,
        String identity,
        String channel,
        String reason,
        Instant timestamp
) {
}
