package com.ai.handoff.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single-process store for local runs and tests. Every operation holds the instance
 * monitor, so multi-key operations are atomic within the process.
 */
@Component
@ConditionalOnProperty(prefix = "handoff.store", name = "type", havingValue = "memory")
public class InMemoryCoordinationStore implements CoordinationStore {

    private final Map<String, Value> values = new HashMap<>();
    private final Map<String, ListValue> lists = new HashMap<>();
    private final Map<String, Map<String, Double>> indexes = new HashMap<>();
    private final Clock clock;

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return liveValue(key).map(v -> v.value);
    }

    @Override
    public synchronized void set(String key, String value, @Nullable Duration ttl) {
        values.put(key, new Value(value, expiry(ttl)));
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        if (liveValue(key).isPresent()) {
            return false;
        }
        values.put(key, new Value(value, expiry(ttl)));
        return true;
    }

    @Override
    public synchronized boolean exists(String key) {
        return liveValue(key).isPresent();
    }

    @Override
    public synchronized boolean expire(String key, Duration ttl) {
        Optional<Value> value = liveValue(key);
        if (value.isPresent()) {
            values.put(key, new Value(value.get().value, expiry(ttl)));
            return true;
        }
        Optional<ListValue> list = liveList(key);
        if (list.isPresent()) {
            list.get().expiresAt = expiry(ttl);
            return true;
        }
        return false;
    }

    @Override
    public synchronized Optional<Duration> ttl(String key) {
        Instant now = clock.instant();
        Optional<Value> value = liveValue(key);
        if (value.isPresent()) {
            return Optional.ofNullable(value.get().expiresAt).map(exp -> Duration.between(now, exp));
        }
        return liveList(key)
                .map(l -> l.expiresAt)
                .map(exp -> Duration.between(now, exp));
    }

    @Override
    public synchronized long delete(String... keys) {
        long existed = 0;
        for (String key : keys) {
            if (liveValue(key).isPresent() || liveList(key).isPresent()) {
                existed++;
            }
            values.remove(key);
            lists.remove(key);
        }
        return existed;
    }

    @Override
    public synchronized long append(String key, String value, @Nullable Duration ttl) {
        ListValue list = liveList(key).orElseGet(() -> {
            ListValue fresh = new ListValue();
            lists.put(key, fresh);
            return fresh;
        });
        list.items.add(value);
        if (ttl != null) {
            list.expiresAt = expiry(ttl);
        }
        return list.items.size();
    }

    @Override
    public synchronized List<String> range(String key) {
        return liveList(key).map(l -> List.copyOf(l.items)).orElse(List.of());
    }

    @Override
    public synchronized long size(String key) {
        return liveList(key).map(l -> l.items.size()).orElse(0);
    }

    @Override
    public synchronized void trimToLast(String key, int maxSize) {
        liveList(key).ifPresent(l -> {
            while (l.items.size() > maxSize) {
                l.items.remove(0);
            }
        });
    }

    @Override
    public synchronized void addToIndex(String index, String member, double score) {
        indexes.computeIfAbsent(index, k -> new HashMap<>()).put(member, score);
    }

    @Override
    public synchronized List<String> rangeByScore(String index, double min, double max, int limit) {
        Map<String, Double> members = indexes.getOrDefault(index, Map.of());
        return members.entrySet().stream()
                .filter(e -> e.getValue() >= min && e.getValue() <= max)
                .sorted(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(Math.max(limit, 0))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean removeFromIndex(String index, String member) {
        Map<String, Double> members = indexes.get(index);
        return members != null && members.remove(member) != null;
    }

    @Override
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int before = values.size() + lists.size();
        values.entrySet().removeIf(e -> !e.getValue().isLive(now));
        lists.entrySet().removeIf(e -> !e.getValue().isLive(now));
        return before - values.size() - lists.size();
    }

    private Optional<Value> liveValue(String key) {
        Value value = values.get(key);
        if (value == null) return Optional.empty();
        if (!value.isLive(clock.instant())) {
            values.remove(key);
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private Optional<ListValue> liveList(String key) {
        ListValue list = lists.get(key);
        if (list == null) return Optional.empty();
        if (!list.isLive(clock.instant())) {
            lists.remove(key);
            return Optional.empty();
        }
        return Optional.of(list);
    }

    private Instant expiry(@Nullable Duration ttl) {
        return ttl != null ? clock.instant().plus(ttl) : null;
    }

    private static final class Value {
        final String value;
        final Instant expiresAt;

        Value(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isLive(Instant now) {
            return expiresAt == null || expiresAt.isAfter(now);
        }
    }

    private static final class ListValue {
        final List<String> items = new ArrayList<>();
        Instant expiresAt;

        boolean isLive(Instant now) {
            return expiresAt == null || expiresAt.isAfter(now);
        }
    }
}
