package com.ai.handoff.service;

import com.ai.handoff.component.SessionKeyspace;
import com.ai.handoff.conversation.SessionRef;
import com.ai.handoff.dto.AggregationDecision;
import com.ai.handoff.repository.StoreEntryRepository;
import com.ai.handoff.repository.StoreIndexEntryRepository;
import com.ai.handoff.repository.StoreListItemRepository;
import com.ai.handoff.store.JpaCoordinationStore;
import com.ai.handoff.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Bursts offered from several threads at once against the database store.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class MessageAggregatorJpaTest {

    @Autowired
    private StoreEntryRepository entryRepository;

    @Autowired
    private StoreListItemRepository listRepository;

    @Autowired
    private StoreIndexEntryRepository indexRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private MessageAggregator aggregator;

    @BeforeEach
    void setUp() {
        entryRepository.deleteAllInBatch();
        listRepository.deleteAllInBatch();
        indexRepository.deleteAllInBatch();
        MutableClock clock = MutableClock.at("2024-06-03T15:00:00Z");
        JpaCoordinationStore store = new JpaCoordinationStore(
                entryRepository, listRepository, indexRepository, transactionManager, clock);
        aggregator = new MessageAggregator(store, new SessionKeyspace(), Duration.ofSeconds(30));
    }

    @Test
    void concurrent_burst_has_one_owner_and_drains_every_message() throws Exception {
        List<String> texts = List.of("Hola", "quiero", "visitar");
        ExecutorService pool = Executors.newFixedThreadPool(texts.size());
        try {
            for (int i = 0; i < 30; i++) {
                SessionRef ref = SessionRef.of("+57300123" + String.format("%04d", i), "whatsapp");
                CyclicBarrier start = new CyclicBarrier(texts.size());
                List<Future<AggregationDecision>> offers = new ArrayList<>();
                for (String text : texts) {
                    offers.add(pool.submit(() -> {
                        start.await(10, TimeUnit.SECONDS);
                        return aggregator.offer(ref, text);
                    }));
                }
                int owners = 0;
                for (Future<AggregationDecision> offer : offers) {
                    AggregationDecision decision = offer.get(30, TimeUnit.SECONDS);
                    assertThat(decision.isImmediate()).isFalse();
                    if (decision.shouldProcess()) {
                        owners++;
                    }
                }

                assertThat(owners).isEqualTo(1);
                String combined = aggregator.drain(ref).orElseThrow();
                assertThat(combined.split(MessageAggregator.SEPARATOR)).containsExactlyInAnyOrderElementsOf(texts);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
