package com.example.ResearchGraph.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import lombok.Getter;
import lombok.Setter;

@Entity
@Table(
        name = "chat_cache",
        uniqueConstraints = @UniqueConstraint(
                name = "idx_chat_cache_lookup",
                columnNames = {"paper_id", "question_hash"}
        )
)
@Getter
@Setter
public class ChatCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "paper_id", nullable = false)
    private UUID paperId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String question;

    @Column(name = "question_hash", length = 64, nullable = false)
    private String questionHash;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String answer;

    // Passage ids by value; they may outlive the passages they point to.
    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "context_chunk_ids", columnDefinition = "TEXT")
    private List<String> contextChunkIds = new ArrayList<>();

    @Column(name = "model_used", length = 64)
    private String modelUsed;

    @Column(name = "tokens_used")
    private Integer tokensUsed;

    @Column(name = "hit_count", nullable = false)
    private int hitCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @PrePersist
    public void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (lastAccessedAt == null) {
            lastAccessedAt = now;
        }
    }
}
