package com.ai.handoff.store;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Shared TTL-capable key-value store every component coordinates through.
 * Scalar keys, list keys and score-ordered indexes live in separate namespaces.
 * Implementations throw {@link StoreUnavailableException} when the backend cannot be reached.
 */
public interface CoordinationStore {

    Optional<String> get(String key);

    /**
     * Writes a scalar value. A {@code null} ttl stores the value without expiry.
     */
    void set(String key, String value, @Nullable Duration ttl);

    /**
     * Test-and-set: writes only if no live value exists for the key.
     *
     * @return true if this call created the value
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    boolean exists(String key);

    /**
     * Resets the expiry of a scalar or list key. Returns false if the key does not exist.
     */
    boolean expire(String key, Duration ttl);

    /**
     * Remaining time to live of a scalar or list key; empty when the key is absent or persistent.
     */
    Optional<Duration> ttl(String key);

    /**
     * Deletes scalar and list keys in one atomic operation.
     *
     * @return number of keys that existed
     */
    long delete(String... keys);

    /**
     * Appends to the tail of a list. A non-null ttl resets the expiry of the whole list,
     * a {@code null} ttl keeps the current one.
     *
     * @return list length after the append
     */
    long append(String key, String value, @Nullable Duration ttl);

    /**
     * All live list elements in insertion order.
     */
    List<String> range(String key);

    long size(String key);

    /**
     * Keeps only the newest {@code maxSize} elements of a list.
     */
    void trimToLast(String key, int maxSize);

    void addToIndex(String index, String member, double score);

    /**
     * Members whose score lies in [min, max], ascending by score, at most {@code limit} of them.
     */
    List<String> rangeByScore(String index, double min, double max, int limit);

    boolean removeFromIndex(String index, String member);

    /**
     * Physically removes expired scalars and list elements.
     *
     * @return number of removed rows or entries
     */
    int purgeExpired();
}
