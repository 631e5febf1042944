package com.ai.handoff.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes expired keys in the background. Reads already ignore expired data, so this
 * only reclaims space.
 */
@Component
public class StoreJanitor {

    private static final Logger log = LoggerFactory.getLogger(StoreJanitor.class);

    private final CoordinationStore store;

    public StoreJanitor(CoordinationStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${handoff.store.purge-interval-ms:300000}",
               initialDelayString = "${handoff.store.purge-interval-ms:300000}")
    public void purge() {
        try {
            int removed = store.purgeExpired();
            if (removed > 0) {
                log.info("Purged {} expired coordination keys", removed);
            }
        } catch (StoreUnavailableException e) {
            log.warn("Skipping purge, store unavailable: {}", e.getMessage());
        }
    }
}
