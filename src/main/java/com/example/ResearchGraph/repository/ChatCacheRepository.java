package com.example.ResearchGraph.repository;

import com.example.ResearchGraph.model.ChatCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChatCacheRepository extends JpaRepository<ChatCacheEntry, UUID> {

    /**
     * Oldest entry for the key. Concurrent writers may have left more than one.
     */
    Optional<ChatCacheEntry> findFirstByPaperIdAndQuestionHashOrderByCreatedAtAsc(UUID paperId, String questionHash);

    @Transactional
    @Modifying
    @Query("update ChatCacheEntry c "
            + "set c.hitCount = c.hitCount + 1, c.lastAccessedAt = :accessedAt "
            + "where c.id = :id")
    int incrementHit(@Param("id") UUID id, @Param("accessedAt") Instant accessedAt);
}
