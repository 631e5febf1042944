package com.ai.handoff.repository;

import com.ai.handoff.entity.StoreIndexEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StoreIndexEntryRepository extends JpaRepository<StoreIndexEntry, Long> {

    Optional<StoreIndexEntry> findByIndexNameAndMemberKey(String indexName, String memberKey);

    @Query("SELECT e FROM StoreIndexEntry e WHERE e.indexName = :index AND e.score >= :min AND e.score <= :max ORDER BY e.score ASC, e.id ASC")
    List<StoreIndexEntry> findRange(@Param("index") String index,
                                    @Param("min") double min,
                                    @Param("max") double max,
                                    Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoreIndexEntry e WHERE e.indexName = :index AND e.memberKey = :member")
    int deleteMember(@Param("index") String index, @Param("member") String member);
}
