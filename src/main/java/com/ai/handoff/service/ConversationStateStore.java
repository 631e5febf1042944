package com.ai.handoff.service;

import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.conversation.ConversationStatus;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.ConversationMeta;
import com.ai.handoff.dto.StoreDocuments;
import com.ai.handoff.store.CoordinationStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Status and metadata per session. The only class that touches session keys.
 *
 * <p>Reads resolve the channel-qualified key first and fall back to the legacy
 * identity-only key; writes always go to the qualified key. Store failures propagate
 * as {@link com.ai.handoff.store.StoreUnavailableException}: a failed read must never
 * be mistaken for "no record, bot active".
 */
@Service
public class ConversationStateStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStateStore.class);

    private final CoordinationStore store;
    private final SessionKeyspace keyspace;
    private final Duration defaultTtl;
    private final ObjectMapper mapper = StoreDocuments.newMapper();

    public ConversationStateStore(CoordinationStore store,
                                  SessionKeyspace keyspace,
                                  @Value("${handoff.session.default-ttl:7d}") Duration defaultTtl) {
        this.store = store;
        this.keyspace = keyspace;
        this.defaultTtl = defaultTtl;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /**
     * Current status; {@code BOT_ACTIVE} when no record exists. Never writes.
     */
    public ConversationStatus getStatus(SessionRef ref) {
        for (String key : keyspace.stateReadOrder(ref)) {
            Optional<String> raw = store.get(key);
            if (raw.isPresent()) {
                return ConversationStatus.parse(raw.get()).orElseGet(() -> {
                    log.warn("[{}] Unknown stored status '{}' under {}, treating as BOT_ACTIVE", ref, raw.get(), key);
                    return ConversationStatus.BOT_ACTIVE;
                });
            }
        }
        return ConversationStatus.BOT_ACTIVE;
    }

    public void setStatus(SessionRef ref, ConversationStatus status, @Nullable Duration ttl) {
        store.set(keyspace.stateKey(ref), status.name(), ttl != null ? ttl : defaultTtl);
        log.debug("[{}] Status set to {}", ref, status);
    }

    public Optional<ConversationMeta> getMeta(SessionRef ref) {
        for (String key : keyspace.metaReadOrder(ref)) {
            Optional<String> raw = store.get(key);
            if (raw.isPresent()) {
                return decode(ref, key, raw.get());
            }
        }
        return Optional.empty();
    }

    public void setMeta(SessionRef ref, ConversationMeta meta, @Nullable Duration ttl) {
        String json;
        try {
            json = mapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize metadata for " + ref, e);
        }
        store.set(keyspace.metaKey(ref), json, ttl != null ? ttl : defaultTtl);
    }

    /**
     * Writes status and metadata together with the same TTL.
     */
    public void save(SessionRef ref, ConversationStatus status, ConversationMeta meta, @Nullable Duration ttl) {
        meta.setStatus(status);
        setStatus(ref, status, ttl);
        setMeta(ref, meta, ttl);
    }

    /**
     * Extends status and metadata expiry. Returns false when there is no qualified status key.
     */
    public boolean refreshTtl(SessionRef ref, Duration ttl) {
        boolean refreshed = store.expire(keyspace.stateKey(ref), ttl);
        store.expire(keyspace.metaKey(ref), ttl);
        return refreshed;
    }

    public Optional<Duration> remainingTtl(SessionRef ref) {
        return store.ttl(keyspace.stateKey(ref));
    }

    /**
     * Removes status, metadata and any legacy remnants in one multi-key delete.
     */
    public long delete(SessionRef ref) {
        long removed = store.delete(
                keyspace.stateKey(ref),
                keyspace.metaKey(ref),
                keyspace.legacyStateKey(ref),
                keyspace.legacyMetaKey(ref));
        log.info("[{}] Session record deleted ({} keys)", ref, removed);
        return removed;
    }

    private Optional<ConversationMeta> decode(SessionRef ref, String key, String json) {
        ConversationMeta meta;
        try {
            meta = mapper.readValue(json, ConversationMeta.class);
        } catch (JsonProcessingException e) {
            log.error("[{}] Undecodable metadata under {}: {}", ref, key, e.getOriginalMessage());
            return Optional.empty();
        }
        return Optional.of(migrate(ref, meta));
    }

    /**
     * Fills in what older documents lack.
     */
    private ConversationMeta migrate(SessionRef ref, ConversationMeta meta) {
        if (meta.getIdentity() == null) {
            meta.setIdentity(ref.identity());
        }
        if (meta.getChannel() == null) {
            meta.setChannel(ref.channel());
        }
        if (meta.getStatus() == null) {
            meta.setStatus(getStatus(ref));
        }
        if (meta.getCreatedAt() == null) {
            meta.setCreatedAt(meta.getLastActivity());
        }
        if (meta.getMessageCount() < 0) {
            meta.setMessageCount(0);
        }
        return meta;
    }
}
