package com.ai.handoff.service;

import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.AggregationDecision;
import com.ai.handoff.store.CoordinationStore;
import com.ai.handoff.store.InMemoryCoordinationStore;
import com.ai.handoff.store.StoreUnavailableException;
import com.ai.handoff.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

class MessageAggregatorTest {

    private static final SessionRef ANA = SessionRef.of("+573001234567", "whatsapp");
    private static final SessionRef LUIS = SessionRef.of("+573109876543", "whatsapp");

    private final MutableClock clock = MutableClock.at("2024-06-03T15:00:00Z");
    private final InMemoryCoordinationStore store = new InMemoryCoordinationStore(clock);
    private final SessionKeyspace keyspace = new SessionKeyspace();
    private final MessageAggregator aggregator = new MessageAggregator(store, keyspace, Duration.ofSeconds(30));

    @Test
    void first_message_owns_the_burst_and_the_rest_only_buffer() {
        AggregationDecision first = aggregator.offer(ANA, "Hola");
        clock.advance(Duration.ofSeconds(5));
        AggregationDecision second = aggregator.offer(ANA, "quiero ver");
        clock.advance(Duration.ofSeconds(5));
        AggregationDecision third = aggregator.offer(ANA, "el apartamento");

        assertThat(first.shouldProcess()).isTrue();
        assertThat(first.aggregating()).isTrue();
        assertThat(first.delay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(second.shouldProcess()).isFalse();
        assertThat(third.shouldProcess()).isFalse();
        assertThat(third.bufferCount()).isEqualTo(3);

        clock.advance(Duration.ofSeconds(20));

        assertThat(aggregator.drain(ANA)).contains("Hola quiero ver el apartamento");
    }

    @Test
    void drain_releases_every_key() {
        aggregator.offer(ANA, "Hola");

        aggregator.drain(ANA);

        assertThat(store.exists(keyspace.lockKey(ANA))).isFalse();
        assertThat(store.exists(keyspace.processingKey(ANA))).isFalse();
        assertThat(store.range(keyspace.bufferKey(ANA))).isEmpty();
        assertThat(aggregator.offer(ANA, "otra vez").shouldProcess()).isTrue();
    }

    @Test
    void sessions_never_share_buffers() {
        aggregator.offer(ANA, "ana 1");
        aggregator.offer(LUIS, "luis 1");
        aggregator.offer(ANA, "ana 2");
        aggregator.offer(SessionRef.of("+573001234567", "instagram"), "ana en instagram");

        assertThat(aggregator.drain(ANA)).contains("ana 1 ana 2");
        assertThat(aggregator.drain(LUIS)).contains("luis 1");
        assertThat(aggregator.drain(SessionRef.of("+573001234567", "instagram"))).contains("ana en instagram");
    }

    @Test
    void losing_the_lock_race_still_buffers_the_message() {
        store.setIfAbsent(keyspace.lockKey(ANA), "someone-else", Duration.ofSeconds(35));

        AggregationDecision decision = aggregator.offer(ANA, "perdí la carrera");

        assertThat(decision.shouldProcess()).isFalse();
        assertThat(store.range(keyspace.bufferKey(ANA))).containsExactly("perdí la carrera");
    }

    @Test
    void lock_and_marker_outlive_the_window() {
        aggregator.offer(ANA, "Hola");

        assertThat(store.ttl(keyspace.lockKey(ANA))).hasValue(Duration.ofSeconds(35));
        assertThat(store.ttl(keyspace.processingKey(ANA))).hasValue(Duration.ofSeconds(40));
        assertThat(store.ttl(keyspace.bufferKey(ANA))).hasValue(Duration.ofSeconds(90));
    }

    @Test
    void abandoned_aggregation_expires_and_a_new_owner_takes_over() {
        aggregator.offer(ANA, "Hola");
        clock.advance(Duration.ofSeconds(91));

        AggregationDecision decision = aggregator.offer(ANA, "sigo aquí");

        assertThat(decision.shouldProcess()).isTrue();
        assertThat(aggregator.drain(ANA)).contains("sigo aquí");
    }

    @Test
    void empty_buffer_drains_to_nothing() {
        assertThat(aggregator.drain(ANA)).isEmpty();
    }

    @Test
    void store_outage_processes_immediately() {
        CoordinationStore broken = mock(CoordinationStore.class);
        when(broken.exists(anyString())).thenThrow(new StoreUnavailableException("down", null));
        when(broken.range(anyString())).thenThrow(new StoreUnavailableException("down", null));
        MessageAggregator degraded = new MessageAggregator(broken, keyspace, Duration.ofSeconds(30));

        AggregationDecision decision = degraded.offer(ANA, "Hola");

        assertThat(decision.isImmediate()).isTrue();
        assertThat(decision.combinedText()).isEqualTo("Hola");
        assertThat(degraded.drain(ANA)).isEmpty();
    }

    @Test
    void failure_after_winning_the_lock_releases_it() {
        InMemoryCoordinationStore flaky = spy(new InMemoryCoordinationStore(clock));
        doThrow(new StoreUnavailableException("down", null))
                .when(flaky).set(eq(keyspace.processingKey(ANA)), anyString(), any());
        MessageAggregator withFlakyStore = new MessageAggregator(flaky, keyspace, Duration.ofSeconds(30));

        AggregationDecision decision = withFlakyStore.offer(ANA, "Hola");

        assertThat(decision.isImmediate()).isTrue();
        assertThat(flaky.exists(keyspace.lockKey(ANA))).isFalse();
        assertThat(flaky.range(keyspace.bufferKey(ANA))).isEmpty();
    }

    @Test
    void failure_before_the_lock_leaves_keys_alone() {
        CoordinationStore broken = mock(CoordinationStore.class);
        when(broken.exists(anyString())).thenThrow(new StoreUnavailableException("down", null));
        MessageAggregator degraded = new MessageAggregator(broken, keyspace, Duration.ofSeconds(30));

        degraded.offer(ANA, "Hola");

        verify(broken).exists(keyspace.processingKey(ANA));
        verifyNoMoreInteractions(broken);
    }
}
