package com.ai.handoff.dto;

import org.springframework.lang.Nullable;

/**
 * Result of a round-robin pick. {@code unassigned} means the team had no active owner.
 */
public record OwnerAssignment(
        @Nullable String ownerId,
        @Nullable String ownerName,
        String team,
        String channel,
        boolean unassigned
) {

    public static OwnerAssignment assigned(String ownerId, String ownerName, String team, String channel) {
        return new OwnerAssignment(ownerId, ownerName, team, channel, false);
    }

    public static OwnerAssignment unassigned(String team, String channel) {
        return new OwnerAssignment(null, null, team, channel, true);
    }
}
