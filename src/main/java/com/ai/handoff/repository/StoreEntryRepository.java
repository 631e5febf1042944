package com.ai.handoff.repository;

import com.ai.handoff.entity.StoreEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

@Repository
public interface StoreEntryRepository extends JpaRepository<StoreEntry, Long> {

    Optional<StoreEntry> findByStoreKey(String storeKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM StoreEntry e WHERE e.storeKey = :key")
    Optional<StoreEntry> findByStoreKeyForUpdate(@Param("key") String key);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoreEntry e WHERE e.storeKey IN :keys AND (e.expiresAt IS NULL OR e.expiresAt > :now)")
    int deleteLive(@Param("keys") Collection<String> keys, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoreEntry e WHERE e.storeKey IN :keys")
    int deleteByStoreKeyIn(@Param("keys") Collection<String> keys);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoreEntry e WHERE e.expiresAt IS NOT NULL AND e.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
