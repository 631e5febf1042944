package com.ai.handoff.service;

import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.dto.OrphanLeadAlert;
import com.ai.handoff.dto.StoreDocuments;
import com.ai.handoff.store.CoordinationStore;
import com.ai.handoff.store.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Leads nobody could be assigned to. Kept as a capped list for manual review and
 * forwarded to the alert channel. Best effort: nothing here throws.
 */
@Service
public class OrphanLeadAlerts {

    private static final Logger log = LoggerFactory.getLogger(OrphanLeadAlerts.class);

    public static final int MAX_ALERTS = 100;

    private final CoordinationStore store;
    private final AlertNotifier notifier;
    private final Clock clock;
    private final ObjectMapper mapper = StoreDocuments.newMapper();

    public OrphanLeadAlerts(CoordinationStore store, AlertNotifier notifier, Clock clock) {
        this.store = store;
        this.notifier = notifier;
        this.clock = clock;
    }

    public OrphanLeadAlert raise(@Nullable String contactId, String identity, String channel, String reason) {
        OrphanLeadAlert alert = new OrphanLeadAlert(contactId, identity, channel, reason, clock.instant());
        log.warn("[{}:{}] Orphan lead, contact={} reason={}", identity, channel, contactId, reason);

        try {
            store.append(SessionKeyspace.ORPHAN_ALERTS, mapper.writeValueAsString(alert), null);
            store.trimToLast(SessionKeyspace.ORPHAN_ALERTS, MAX_ALERTS);
        } catch (JsonProcessingException | StoreUnavailableException e) {
            log.error("[{}:{}] Could not store orphan alert: {}", identity, channel, e.getMessage());
        }

        try {
            notifier.orphanLead(alert);
        } catch (RuntimeException e) {
            log.error("[{}:{}] Alert notifier failed: {}", identity, channel, e.getMessage(), e);
        }
        return alert;
    }

    /**
     * Most recent alerts first.
     */
    public List<OrphanLeadAlert> recent(int limit) {
        List<String> raw;
        try {
            raw = store.range(SessionKeyspace.ORPHAN_ALERTS);
        } catch (StoreUnavailableException e) {
            log.error("Could not read orphan alerts: {}", e.getMessage());
            return List.of();
        }
        List<OrphanLeadAlert> alerts = new ArrayList<>();
        for (int i = raw.size() - 1; i >= 0 && alerts.size() < limit; i--) {
            try {
                alerts.add(mapper.readValue(raw.get(i), OrphanLeadAlert.class));
            } catch (JsonProcessingException e) {
                log.error("Skipping undecodable orphan alert: {}", e.getOriginalMessage());
            }
        }
        return Collections.unmodifiableList(alerts);
    }
}
