package com.ai.handoff.service;

import com.ai.handoff.component.BusinessHours;
import com.ai.handoff.conversation.ConversationStatus;
import com.ai.handoff.conversation.HandoffPriority;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.conversation.TimeoutSignal;
import com.ai.handoff.dto.AssistantReply;
import com.ai.handoff.dto.AssistantRequest;
import com.ai.handoff.dto.ConversationMeta;
import com.ai.handoff.dto.CrmLeadUpdate;
import com.ai.handoff.dto.OwnerAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * One unit of work for a session: decides who answers the combined text and acts on
 * the assistant's signal. Collaborator failures are logged and never abort the unit.
 */
@Service
public class ConversationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConversationPipeline.class);

    private final HandoffCoordinator coordinator;
    private final LeadRoundRobinAssigner assigner;
    private final OrphanLeadAlerts orphanAlerts;
    private final AssistantClient assistant;
    private final CrmClient crm;
    private final AlertNotifier notifier;
    private final OutboundMessenger messenger;
    private final BusinessHours businessHours;
    private final String waitingText;

    public ConversationPipeline(HandoffCoordinator coordinator,
                                LeadRoundRobinAssigner assigner,
                                OrphanLeadAlerts orphanAlerts,
                                AssistantClient assistant,
                                CrmClient crm,
                                AlertNotifier notifier,
                                OutboundMessenger messenger,
                                BusinessHours businessHours,
                                @Value("${handoff.pipeline.waiting-text:Ya le avisamos a un asesor, en breve te atenderá. ¡Gracias por tu paciencia!}")
                                String waitingText) {
        this.coordinator = coordinator;
        this.assigner = assigner;
        this.orphanAlerts = orphanAlerts;
        this.assistant = assistant;
        this.crm = crm;
        this.notifier = notifier;
        this.messenger = messenger;
        this.businessHours = businessHours;
        this.waitingText = waitingText;
    }

    public Outcome process(SessionRef ref, String combinedText, @Nullable String displayName) {
        ConversationStatus before = coordinator.getStatus(ref);

        if (before.isHumanOwned()) {
            // timeout check must see the previous client timestamp
            TimeoutSignal signal = coordinator.checkConversationTimeout(ref);
            ConversationMeta meta = recordInbound(ref, displayName);
            if (!signal.reclaims()) {
                coordinator.refreshHumanTtl(ref);
                log.info("[{}] Operator owns the conversation; message mirrored only", ref);
                return new Outcome(before, before, signal, null, null);
            }
            log.info("[{}] {} on {}, bot takes over", ref, signal, before);
            coordinator.activateBot(ref);
            return answerWithBot(ref, combinedText, before, signal, meta);
        }

        ConversationMeta meta = recordInbound(ref, displayName);

        if (before == ConversationStatus.PENDING_HANDOFF) {
            send(ref, waitingText);
            return new Outcome(before, before, TimeoutSignal.NONE, waitingText, null);
        }
        if (before == ConversationStatus.CLOSED) {
            coordinator.activateBot(ref);
        }
        return answerWithBot(ref, combinedText, before, TimeoutSignal.NONE, meta);
    }

    private Outcome answerWithBot(SessionRef ref, String text, ConversationStatus before,
                                  TimeoutSignal signal, ConversationMeta meta) {
        AssistantRequest request = new AssistantRequest(ref.identity(), ref.channel(), text,
                ConversationStatus.BOT_ACTIVE, signal, meta.getDisplayName(), meta.getMessageCount());
        AssistantReply reply = askAssistant(request);
        String sent = null;
        if (reply.hasText()) {
            send(ref, reply.text());
            sent = reply.text();
        }

        HandoffPriority priority = reply.signal().handoffPriority();
        if (!priority.requiresHandoff()) {
            return new Outcome(before, ConversationStatus.BOT_ACTIVE, signal, sent, null);
        }

        String reason = "Assistant requested handoff (" + priority.name().toLowerCase(Locale.ROOT) + ")";
        coordinator.requestHandoff(ref, reason);

        OwnerAssignment assignment = assigner.getNextOwner(ref.channel());
        if (assignment.unassigned()) {
            orphanAlerts.raise(meta.getContactId(), ref.identity(), ref.channel(),
                    "No active owners for team " + assignment.team());
        }
        syncCrm(new CrmLeadUpdate(ref.identity(), assignment.ownerId(), reason, ref.channel()));

        if (!businessHours.isOpen()) {
            try {
                notifier.outOfHours(ref, priority);
            } catch (RuntimeException e) {
                log.error("[{}] Out-of-hours alert failed", ref, e);
            }
        }
        return new Outcome(before, ConversationStatus.PENDING_HANDOFF, signal, sent, assignment);
    }

    private ConversationMeta recordInbound(SessionRef ref, @Nullable String displayName) {
        coordinator.updateClientMessageTimestamp(ref);
        return coordinator.recordActivity(ref, displayName);
    }

    private AssistantReply askAssistant(AssistantRequest request) {
        try {
            return assistant.reply(request);
        } catch (RuntimeException e) {
            log.error("[{}:{}] Assistant failed", request.identity(), request.channel(), e);
            return AssistantReply.empty();
        }
    }

    private void syncCrm(CrmLeadUpdate update) {
        try {
            crm.syncLead(update);
        } catch (RuntimeException e) {
            log.error("[{}:{}] CRM sync failed", update.identity(), update.channel(), e);
        }
    }

    /**
     * Sends a bot-authored message and stamps it on the session when delivery did not fail.
     */
    private void send(SessionRef ref, String text) {
        try {
            messenger.send(ref, text);
        } catch (RuntimeException e) {
            log.error("[{}] Outbound send failed", ref, e);
            return;
        }
        coordinator.updateBotMessageTimestamp(ref);
    }

    /**
     * What a unit of work did. {@code reply} is null when nothing was sent.
     */
    public record Outcome(
            ConversationStatus statusBefore,
            ConversationStatus statusAfter,
            TimeoutSignal timeoutSignal,
            @Nullable String reply,
            @Nullable OwnerAssignment assignment
    ) {
    }
}
