package com.ai.handoff.store;

import com.ai.handoff.entity.StoreEntry;
import com.ai.handoff.entity.StoreIndexEntry;
import com.ai.handoff.entity.StoreListItem;
import com.ai.handoff.repository.StoreEntryRepository;
import com.ai.handoff.repository.StoreIndexEntryRepository;
import com.ai.handoff.repository.StoreListItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Database-backed coordination store. Expired rows are invisible to reads and removed
 * by {@link StoreJanitor}. Test-and-set relies on a row lock for existing keys and on
 * the unique key index for concurrent inserts.
 */
@Component
@ConditionalOnProperty(prefix = "handoff.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaCoordinationStore implements CoordinationStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCoordinationStore.class);

    private final StoreEntryRepository entryRepository;
    private final StoreListItemRepository listRepository;
    private final StoreIndexEntryRepository indexRepository;
    private final TransactionTemplate tx;
    private final Clock clock;

    public JpaCoordinationStore(StoreEntryRepository entryRepository,
                                StoreListItemRepository listRepository,
                                StoreIndexEntryRepository indexRepository,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.entryRepository = entryRepository;
        this.listRepository = listRepository;
        this.indexRepository = indexRepository;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return call("get " + key, () -> {
            Instant now = clock.instant();
            return entryRepository.findByStoreKey(key)
                    .filter(e -> e.isLive(now))
                    .map(StoreEntry::getStoreValue);
        });
    }

    /**
     * Last write wins. Two writers creating the same key collide on the unique index;
     * the loser retries once, finds the committed row and overwrites it under its lock.
     */
    @Override
    public void set(String key, String value, @Nullable Duration ttl) {
        upsert("set " + key, () -> {
            Instant now = clock.instant();
            StoreEntry entry = entryRepository.findByStoreKeyForUpdate(key)
                    .orElseGet(() -> StoreEntry.builder().storeKey(key).build());
            entry.setStoreValue(value);
            entry.setExpiresAt(ttl != null ? now.plus(ttl) : null);
            entry.setUpdatedAt(now);
            entryRepository.saveAndFlush(entry);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        try {
            Boolean created = tx.execute(status -> {
                Instant now = clock.instant();
                Optional<StoreEntry> existing = entryRepository.findByStoreKeyForUpdate(key);
                if (existing.isPresent() && existing.get().isLive(now)) {
                    return false;
                }
                StoreEntry entry = existing.orElseGet(() -> StoreEntry.builder().storeKey(key).build());
                entry.setStoreValue(value);
                entry.setExpiresAt(now.plus(ttl));
                entry.setUpdatedAt(now);
                entryRepository.saveAndFlush(entry);
                return true;
            });
            return Boolean.TRUE.equals(created);
        } catch (DataIntegrityViolationException e) {
            // another writer inserted the same key between our lookup and insert
            log.debug("setIfAbsent lost insert race for {}", key);
            return false;
        } catch (DataAccessException | TransactionException e) {
            throw unavailable("setIfAbsent " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return call("expire " + key, () -> {
            Instant now = clock.instant();
            Optional<StoreEntry> entry = entryRepository.findByStoreKeyForUpdate(key).filter(e -> e.isLive(now));
            if (entry.isPresent()) {
                entry.get().setExpiresAt(now.plus(ttl));
                entry.get().setUpdatedAt(now);
                entryRepository.save(entry.get());
                return true;
            }
            if (!liveItems(key, now).isEmpty()) {
                listRepository.updateExpiry(key, now.plus(ttl), now);
                return true;
            }
            return false;
        });
    }

    @Override
    public Optional<Duration> ttl(String key) {
        return call("ttl " + key, () -> {
            Instant now = clock.instant();
            Optional<StoreEntry> entry = entryRepository.findByStoreKey(key).filter(e -> e.isLive(now));
            if (entry.isPresent()) {
                return Optional.ofNullable(entry.get().getExpiresAt()).map(exp -> Duration.between(now, exp));
            }
            List<StoreListItem> items = liveItems(key, now);
            if (items.isEmpty() || items.get(0).getExpiresAt() == null) {
                return Optional.empty();
            }
            return Optional.of(Duration.between(now, items.get(0).getExpiresAt()));
        });
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) return 0;
        List<String> keyList = Arrays.asList(keys);
        return call("delete " + keyList, () -> {
            Instant now = clock.instant();
            long existed = entryRepository.deleteLive(keyList, now);
            for (String key : keyList) {
                if (!liveItems(key, now).isEmpty()) existed++;
            }
            entryRepository.deleteByStoreKeyIn(keyList);
            listRepository.deleteByListKeyIn(keyList);
            return existed;
        });
    }

    /**
     * Inserts one row and never deletes live ones, so concurrent appends to the same
     * list cannot lose each other's items. Expired leftovers are removed first so they
     * do not come back under the new expiry.
     */
    @Override
    public long append(String key, String value, @Nullable Duration ttl) {
        return call("append " + key, () -> {
            Instant now = clock.instant();
            listRepository.deleteExpiredItems(key, now);
            List<StoreListItem> items = liveItems(key, now);
            Instant expiresAt = ttl != null
                    ? now.plus(ttl)
                    : (items.isEmpty() ? null : items.get(items.size() - 1).getExpiresAt());
            if (ttl != null && !items.isEmpty()) {
                listRepository.updateExpiry(key, expiresAt, now);
            }
            listRepository.save(StoreListItem.builder()
                    .listKey(key)
                    .itemValue(value)
                    .expiresAt(expiresAt)
                    .build());
            return (long) items.size() + 1;
        });
    }

    @Override
    public List<String> range(String key) {
        return call("range " + key, () -> liveItems(key, clock.instant()).stream()
                .map(StoreListItem::getItemValue)
                .collect(Collectors.toList()));
    }

    @Override
    public long size(String key) {
        return range(key).size();
    }

    @Override
    public void trimToLast(String key, int maxSize) {
        call("trim " + key, () -> {
            List<StoreListItem> items = listRepository.findByListKeyOrderByIdAsc(key);
            if (items.size() > maxSize) {
                List<Long> stale = items.subList(0, items.size() - maxSize).stream()
                        .map(StoreListItem::getId)
                        .collect(Collectors.toList());
                listRepository.deleteAllByIdInBatch(stale);
            }
            return null;
        });
    }

    @Override
    public void addToIndex(String index, String member, double score) {
        upsert("addToIndex " + index, () -> {
            StoreIndexEntry entry = indexRepository.findByIndexNameAndMemberKey(index, member)
                    .orElseGet(() -> StoreIndexEntry.builder().indexName(index).memberKey(member).build());
            entry.setScore(score);
            indexRepository.saveAndFlush(entry);
            return null;
        });
    }

    @Override
    public List<String> rangeByScore(String index, double min, double max, int limit) {
        if (limit <= 0) return List.of();
        return call("rangeByScore " + index, () -> indexRepository
                .findRange(index, min, max, PageRequest.of(0, limit)).stream()
                .map(StoreIndexEntry::getMemberKey)
                .collect(Collectors.toList()));
    }

    @Override
    public boolean removeFromIndex(String index, String member) {
        return call("removeFromIndex " + index, () -> indexRepository.deleteMember(index, member) > 0);
    }

    @Override
    public int purgeExpired() {
        return call("purgeExpired", () -> {
            Instant now = clock.instant();
            return entryRepository.deleteExpired(now) + listRepository.deleteExpired(now);
        });
    }

    private List<StoreListItem> liveItems(String key, Instant now) {
        return listRepository.findByListKeyOrderByIdAsc(key).stream()
                .filter(item -> item.isLive(now))
                .collect(Collectors.toList());
    }

    /**
     * Runs an insert-or-update. A unique-key collision means a concurrent writer created
     * the row first; the retry then updates that row.
     */
    private <T> T upsert(String operation, Supplier<T> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (DataIntegrityViolationException e) {
            log.debug("{} lost insert race, retrying as update", operation);
            return call(operation, work);
        } catch (DataAccessException | TransactionException e) {
            throw unavailable(operation, e);
        }
    }

    private <T> T call(String operation, Supplier<T> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            throw unavailable(operation, e);
        }
    }

    private StoreUnavailableException unavailable(String operation, RuntimeException cause) {
        log.error("Coordination store failure during {}", operation, cause);
        return new StoreUnavailableException("Coordination store failure during " + operation, cause);
    }
}
