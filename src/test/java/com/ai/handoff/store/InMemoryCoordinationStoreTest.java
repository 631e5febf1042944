package com.ai.handoff.store;

import com.ai.handoff.support.MutableClock;

class InMemoryCoordinationStoreTest extends CoordinationStoreContract {

    private final MutableClock clock = MutableClock.at("2024-06-03T15:00:00Z");
    private final InMemoryCoordinationStore store = new InMemoryCoordinationStore(clock);

    @Override
    protected CoordinationStore store() {
        return store;
    }

    @Override
    protected MutableClock clock() {
        return clock;
    }
}
