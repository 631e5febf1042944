package com.ai.handoff.repository;

import com.ai.handoff.entity.StoreListItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface StoreListItemRepository extends JpaRepository<StoreListItem, Long> {

    List<StoreListItem> findByListKeyOrderByIdAsc(String listKey);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StoreListItem i SET i.expiresAt = :expiresAt "
            + "WHERE i.listKey = :key AND (i.expiresAt IS NULL OR i.expiresAt > :now)")
    int updateExpiry(@Param("key") String key, @Param("expiresAt") Instant expiresAt, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoreListItem i WHERE i.listKey = :key AND i.expiresAt IS NOT NULL AND i.expiresAt <= :now")
    int deleteExpiredItems(@Param("key") String key, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoreListItem i WHERE i.listKey IN :keys")
    int deleteByListKeyIn(@Param("keys") Collection<String> keys);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoreListItem i WHERE i.expiresAt IS NOT NULL AND i.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
