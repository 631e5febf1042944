package com.ai.handoff.service;

import com.ai.handoff.component.IdentityNormalizer;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.AggregationDecision;
import com.ai.handoff.dto.InboundResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Entry point for the transport adapter. Buffers the message and returns at once;
 * the owner of a burst gets a drain scheduled for the end of the aggregation window.
 */
@Service
public class InboundMessageService {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageService.class);

    private final IdentityNormalizer normalizer;
    private final MessageAggregator aggregator;
    private final ConversationPipeline pipeline;
    private final TaskScheduler scheduler;
    private final Clock clock;

    public InboundMessageService(IdentityNormalizer normalizer,
                                 MessageAggregator aggregator,
                                 ConversationPipeline pipeline,
                                 TaskScheduler scheduler,
                                 Clock clock) {
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.pipeline = pipeline;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * @throws com.ai.handoff.component.InvalidIdentityException when the sender id is not a
     *         valid mobile number; nothing is stored in that case
     */
    public InboundResult handleInbound(String rawIdentity, @Nullable String channelHint,
                                       String text, @Nullable String displayName) {
        String identity = normalizer.requireValid(rawIdentity);
        SessionRef ref = SessionRef.of(identity, channelHint);

        AggregationDecision decision = aggregator.offer(ref, text);

        if (decision.isImmediate()) {
            log.info("[{}] Processing immediately", ref);
            pipeline.process(ref, text, displayName);
            return new InboundResult(true, false, text, ref.identity(), ref.channel(), 1);
        }
        if (!decision.shouldProcess()) {
            return new InboundResult(false, false, null, ref.identity(), ref.channel(), decision.bufferCount());
        }

        scheduler.schedule(() -> drainAndProcess(ref, displayName), clock.instant().plus(decision.delay()));
        log.debug("[{}] Drain scheduled in {}", ref, decision.delay());
        return new InboundResult(true, true, null, ref.identity(), ref.channel(), decision.bufferCount());
    }

    /**
     * Deferred half of the aggregation protocol. Runs on the scheduler thread, so
     * every failure ends here.
     */
    void drainAndProcess(SessionRef ref, @Nullable String displayName) {
        try {
            aggregator.drain(ref).ifPresent(combined -> pipeline.process(ref, combined, displayName));
        } catch (RuntimeException e) {
            log.error("[{}] Deferred processing failed", ref, e);
        }
    }
}
