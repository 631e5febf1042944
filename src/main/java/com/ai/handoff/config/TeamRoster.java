package com.ai.handoff.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Channel to team mapping and the owners of each team.
 * Keys with underscores need bracket notation in properties files,
 * e.g. {@code handoff.assignment.channels[finca_raiz]=equipo_trabajador2}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "handoff.assignment")
public class TeamRoster {

    private String fallbackTeam = "default";

    private String defaultChannel = "whatsapp_direct";

    private Map<String, String> channels = new LinkedHashMap<>();

    private Map<String, List<Owner>> teams = new LinkedHashMap<>();

    public String teamFor(String channel) {
        return channels.getOrDefault(channel, fallbackTeam);
    }

    /** Unknown teams fall back to the fallback team's roster. */
    public List<Owner> ownersOf(String team) {
        List<Owner> owners = teams.get(team);
        if (owners == null) {
            owners = teams.getOrDefault(fallbackTeam, List.of());
        }
        return owners;
    }

    public List<Owner> activeOwnersOf(String team) {
        List<Owner> active = new ArrayList<>();
        for (Owner owner : ownersOf(team)) {
            if (owner.isActive()) {
                active.add(owner);
            }
        }
        return active;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Owner {
        private String id;
        private String name;
        private boolean active = true;
    }
}
