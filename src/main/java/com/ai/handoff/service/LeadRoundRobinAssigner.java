package com.ai.handoff.service;

import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.config.TeamRoster;
import com.ai.handoff.config.TeamRoster.Owner;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.OwnerAssignment;
import com.ai.handoff.store.CoordinationStore;
import com.ai.handoff.store.StoreUnavailableException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Channel -> team -> owner resolution with a persisted rotation counter per team.
 *
 * <p>The counter grows without bound and is reduced modulo the current number of active
 * owners on every pick. Concurrent picks may occasionally hand out the same slot twice;
 * fairness is approximate.
 */
@Service
public class LeadRoundRobinAssigner {

    private static final Logger log = LoggerFactory.getLogger(LeadRoundRobinAssigner.class);

    public static final String UNKNOWN_OWNER = "Unknown";

    private static final String[] EXPLICIT_CHANNEL_FIELDS = {"canal_origen", "source", "utm_source", "channel"};

    private final TeamRoster roster;
    private final CoordinationStore store;
    private final SessionKeyspace keyspace;

    public LeadRoundRobinAssigner(TeamRoster roster, CoordinationStore store, SessionKeyspace keyspace) {
        this.roster = roster;
        this.store = store;
        this.keyspace = keyspace;
    }

    public OwnerAssignment getNextOwner(@Nullable String channel) {
        String origin = StringUtils.isBlank(channel) ? roster.getDefaultChannel() : channel;
        String team = roster.teamFor(origin);
        List<Owner> active = roster.activeOwnersOf(team);

        if (active.isEmpty()) {
            log.error("[{}] No active owners for team '{}'", origin, team);
            return OwnerAssignment.unassigned(team, origin);
        }
        if (active.size() == 1) {
            Owner only = active.get(0);
            log.info("[{}] Single active owner {} ({}) for team '{}'", origin, only.getName(), only.getId(), team);
            return OwnerAssignment.assigned(only.getId(), only.getName(), team, origin);
        }

        long counter = readCounter(team);
        int index = (int) Math.floorMod(counter, (long) active.size());
        Owner owner = active.get(index);
        writeCounter(team, counter + 1);

        log.info("[{}] Round robin: {} ({}), team '{}', index {}", origin, owner.getName(), owner.getId(), team, index);
        return OwnerAssignment.assigned(owner.getId(), owner.getName(), team, origin);
    }

    public OwnerAssignment getNextOwner(SessionRef ref) {
        return getNextOwner(ref.channel());
    }

    /**
     * Best-effort origin detection: explicit field, then referrer keywords, then the
     * default channel. Misclassification is tolerated.
     */
    public String detectChannelOrigin(@Nullable Map<String, ?> metadata, @Nullable String hint) {
        Map<String, ?> fields = metadata != null ? metadata : Map.of();

        for (String field : EXPLICIT_CHANNEL_FIELDS) {
            Object value = fields.get(field);
            if (value != null && StringUtils.isNotBlank(value.toString())) {
                String candidate = value.toString().trim().toLowerCase(Locale.ROOT).replace(' ', '_');
                if (roster.getChannels().containsKey(candidate)) {
                    return candidate;
                }
            }
        }

        Object referrerValue = fields.get("referrer");
        String referrer = (referrerValue != null ? referrerValue.toString() : "")
                + " " + (hint != null ? hint : "");
        referrer = referrer.toLowerCase(Locale.ROOT);

        if (referrer.contains("fincaraiz") || referrer.contains("finca raiz")) {
            return "finca_raiz";
        } else if (referrer.contains("metrocuadrado")) {
            return "metrocuadrado";
        } else if (referrer.contains("facebook") || referrer.contains("fb.com")) {
            return "facebook";
        } else if (referrer.contains("instagram")) {
            return "instagram";
        } else if (referrer.contains("google")) {
            return "google_ads";
        }
        return roster.getDefaultChannel();
    }

    public String ownerName(String ownerId) {
        for (List<Owner> owners : roster.getTeams().values()) {
            for (Owner owner : owners) {
                if (owner.getId().equals(ownerId)) {
                    return owner.getName();
                }
            }
        }
        return UNKNOWN_OWNER;
    }

    public void resetCounter(String team) {
        store.set(keyspace.rotationKey(team), "0", null);
        log.info("Rotation counter reset for team '{}'", team);
    }

    public Map<String, TeamStats> assignmentStats() {
        Map<String, TeamStats> stats = new LinkedHashMap<>();
        for (String team : roster.getTeams().keySet()) {
            List<Owner> active = roster.activeOwnersOf(team);
            long counter = readCounter(team);
            String next = active.isEmpty() ? null : active.get((int) Math.floorMod(counter, (long) active.size())).getName();
            stats.put(team, new TeamStats(active.size(), counter, next));
        }
        return stats;
    }

    private long readCounter(String team) {
        String key = keyspace.rotationKey(team);
        try {
            String stored = store.get(key).orElse(null);
            if (stored == null) {
                return 0;
            }
            if (!StringUtils.isNumeric(stored.trim())) {
                log.warn("Rotation counter {} holds '{}', restarting at 0", key, stored);
                return 0;
            }
            return Long.parseLong(stored.trim());
        } catch (StoreUnavailableException e) {
            log.warn("Could not read rotation counter {}: {}. Using 0", key, e.getMessage());
            return 0;
        }
    }

    private void writeCounter(String team, long value) {
        String key = keyspace.rotationKey(team);
        try {
            store.set(key, Long.toString(value), null);
        } catch (StoreUnavailableException e) {
            log.warn("Could not persist rotation counter {}: {}", key, e.getMessage());
        }
    }

    public record TeamStats(int activeOwners, long counter, @Nullable String nextOwner) {
    }
}
