package com.ai.handoff.service;

import com.ai.handoff.conversation.ConversationStatus;
import com.ai.handoff.conversation.MessagingWindow;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.conversation.TimeoutSignal;
import com.ai.handoff.dto.ConversationMeta;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Bot/human arbitration state machine.
 *
 * <pre>
 * BOT_ACTIVE -> PENDING_HANDOFF -> HUMAN_ACTIVE (72h, refreshable) -> BOT_ACTIVE
 *                                  IN_CONVERSATION (same reclaim rules)
 * any -> CLOSED (record deleted)
 * </pre>
 *
 * Transitions are plain writes, not compare-and-swap; callers serialize per session
 * through the message aggregator.
 */
@Service
public class HandoffCoordinator {

    private static final Logger log = LoggerFactory.getLogger(HandoffCoordinator.class);

    public static final String DEFAULT_HANDOFF_REASON = "Client request";

    private final ConversationStateStore stateStore;
    private final Clock clock;
    private final Duration humanTtl;
    private final Duration clientTimeout;
    private final Duration advisorTimeout;
    private final Duration messagingWindow;

    public HandoffCoordinator(ConversationStateStore stateStore,
                              Clock clock,
                              @Value("${handoff.session.human-ttl:72h}") Duration humanTtl,
                              @Value("${handoff.timeout.client:24h}") Duration clientTimeout,
                              @Value("${handoff.timeout.advisor:72h}") Duration advisorTimeout,
                              @Value("${handoff.messaging-window:24h}") Duration messagingWindow) {
        this.stateStore = stateStore;
        this.clock = clock;
        this.humanTtl = humanTtl;
        this.clientTimeout = clientTimeout;
        this.advisorTimeout = advisorTimeout;
        this.messagingWindow = messagingWindow;
    }

    public ConversationStatus getStatus(SessionRef ref) {
        return stateStore.getStatus(ref);
    }

    public Optional<ConversationMeta> getMeta(SessionRef ref) {
        return stateStore.getMeta(ref);
    }

    public boolean isBotActive(SessionRef ref) {
        return getStatus(ref) == ConversationStatus.BOT_ACTIVE;
    }

    public void requestHandoff(SessionRef ref, @Nullable String reason) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setHandoffReason(reason != null ? reason : DEFAULT_HANDOFF_REASON);
        meta.setLastActivity(now);
        stateStore.save(ref, ConversationStatus.PENDING_HANDOFF, meta, stateStore.getDefaultTtl());
        log.info("[{}] Handoff requested: {}", ref, meta.getHandoffReason());
    }

    public void activateHuman(SessionRef ref, @Nullable String ownerId, @Nullable String reason) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setAssignedOwnerId(ownerId);
        if (reason != null) {
            meta.setHandoffReason(reason);
        }
        meta.setHumanActivatedAt(now);
        meta.setLastActivity(now);
        stateStore.save(ref, ConversationStatus.HUMAN_ACTIVE, meta, humanTtl);
        log.info("[{}] Human active (owner: {})", ref, ownerId != null ? ownerId : "unassigned");
    }

    /**
     * Operator-visible sub-state of HUMAN_ACTIVE with the same TTL and reclaim rules.
     */
    public void markInConversation(SessionRef ref) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setLastActivity(now);
        stateStore.save(ref, ConversationStatus.IN_CONVERSATION, meta, humanTtl);
        log.info("[{}] In conversation with operator", ref);
    }

    public void activateBot(SessionRef ref) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setHandoffReason(null);
        meta.setLastActivity(now);
        stateStore.save(ref, ConversationStatus.BOT_ACTIVE, meta, stateStore.getDefaultTtl());
        log.info("[{}] Bot reactivated", ref);
    }

    /**
     * Gives a HUMAN_ACTIVE session a fresh human TTL. Any other status is left untouched.
     *
     * @return whether the session was refreshed
     */
    public boolean refreshHumanTtl(SessionRef ref) {
        if (getStatus(ref) != ConversationStatus.HUMAN_ACTIVE) {
            return false;
        }
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setLastActivity(now);
        stateStore.save(ref, ConversationStatus.HUMAN_ACTIVE, meta, humanTtl);
        log.debug("[{}] Human TTL refreshed", ref);
        return true;
    }

    public void updateClientMessageTimestamp(SessionRef ref) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setLastClientMessageAt(now);
        meta.setLastActivity(now);
        writeMeta(ref, meta);
    }

    public void updateOperatorMessageTimestamp(SessionRef ref) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setLastOperatorMessageAt(now);
        meta.setLastActivity(now);
        writeMeta(ref, meta);
    }

    public void updateBotMessageTimestamp(SessionRef ref) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setLastBotMessageAt(now);
        meta.setLastActivity(now);
        writeMeta(ref, meta);
    }

    /**
     * Counts an inbound message, creating the metadata on first contact.
     */
    public ConversationMeta recordActivity(SessionRef ref, @Nullable String displayName) {
        Instant now = clock.instant();
        ConversationMeta meta = metaOrFresh(ref, now);
        meta.setLastActivity(now);
        meta.setMessageCount(meta.getMessageCount() + 1);
        if (StringUtils.isNotBlank(displayName)) {
            meta.setDisplayName(displayName.trim());
        }
        writeMeta(ref, meta);
        return meta;
    }

    /**
     * Dual-timeout check for human-owned sessions. The client timeout is checked first
     * and wins when both conditions hold. The advisor window always runs from the
     * client's last message.
     */
    public TimeoutSignal checkConversationTimeout(SessionRef ref) {
        ConversationStatus status = getStatus(ref);
        if (!status.isHumanOwned()) {
            return TimeoutSignal.NONE;
        }
        Optional<ConversationMeta> meta = stateStore.getMeta(ref);
        if (meta.isEmpty()) {
            return TimeoutSignal.NONE;
        }
        Instant now = clock.instant();
        Instant client = meta.get().getLastClientMessageAt();
        Instant operator = meta.get().getLastOperatorMessageAt();

        if (operator != null && (client == null || operator.isAfter(client))
                && !Duration.between(operator, now).minus(clientTimeout).isNegative()) {
            log.info("[{}] Client timeout: no reply for {} since operator message", ref, Duration.between(operator, now));
            return TimeoutSignal.CLIENT_TIMEOUT;
        }
        if (client != null && (operator == null || client.isAfter(operator))
                && !Duration.between(client, now).minus(advisorTimeout).isNegative()) {
            log.info("[{}] Advisor timeout: client waiting {} without operator reply", ref, Duration.between(client, now));
            return TimeoutSignal.ADVISOR_TIMEOUT;
        }
        return TimeoutSignal.NONE;
    }

    public MessagingWindow messagingWindow(SessionRef ref) {
        Instant lastClient = stateStore.getMeta(ref)
                .map(ConversationMeta::getLastClientMessageAt)
                .orElse(null);
        if (lastClient == null) {
            return MessagingWindow.closed(null);
        }
        Duration elapsed = Duration.between(lastClient, clock.instant());
        if (elapsed.compareTo(messagingWindow) >= 0) {
            return MessagingWindow.closed(lastClient);
        }
        return new MessagingWindow(true, lastClient, messagingWindow.minus(elapsed));
    }

    public void closeConversation(SessionRef ref) {
        stateStore.delete(ref);
        log.info("[{}] Conversation closed", ref);
    }

    private ConversationMeta metaOrFresh(SessionRef ref, Instant now) {
        return stateStore.getMeta(ref).orElseGet(() -> ConversationMeta.fresh(ref.identity(), ref.channel(), now));
    }

    /**
     * Metadata-only write that follows the status key's remaining lifetime.
     */
    private void writeMeta(SessionRef ref, ConversationMeta meta) {
        ConversationStatus status = stateStore.getStatus(ref);
        meta.setStatus(status);
        Duration ttl = stateStore.remainingTtl(ref)
                .filter(d -> !d.isNegative() && !d.isZero())
                .orElse(status.isHumanOwned() ? humanTtl : stateStore.getDefaultTtl());
        stateStore.setMeta(ref, meta, ttl);
    }
}
