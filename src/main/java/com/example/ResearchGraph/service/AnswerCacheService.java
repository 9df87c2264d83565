package com.example.ResearchGraph.service;

import com.example.ResearchGraph.common.convention.exception.CachePersistenceException;
import com.example.ResearchGraph.model.ChatCacheEntry;
import com.example.ResearchGraph.repository.ChatCacheRepository;
import com.example.ResearchGraph.repository.PassageRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent answer cache keyed by (paper id, question fingerprint).
 *
 * <p>Entries are append-only apart from the hit counter. Two identical questions
 * that miss at the same time may both generate; the second insert then either
 * coexists or is rejected by the unique key, and a rejected insert is answered
 * with the entry that won.</p>
 */
@Service
@RequiredArgsConstructor
public class AnswerCacheService {

    private static final Logger log = LoggerFactory.getLogger(AnswerCacheService.class);

    private final ChatCacheRepository chatCacheRepository;
    private final PassageRepository passageRepository;

    /**
     * A failed read is treated as a miss; the question is then answered from scratch.
     */
    public Optional<ChatCacheEntry> lookup(UUID paperId, String fingerprint) {
        try {
            Optional<ChatCacheEntry> entry =
                    chatCacheRepository.findFirstByPaperIdAndQuestionHashOrderByCreatedAtAsc(paperId, fingerprint);
            log.debug("Answer cache {} for paper={}, hash={}",
                    entry.isPresent() ? "HIT" : "MISS", paperId, fingerprint.substring(0, 8));
            return entry;
        } catch (DataAccessException ex) {
            log.warn("Answer cache lookup failed for paper={}, treating as miss: {}", paperId, ex.getMessage());
            return Optional.empty();
        }
    }

    public void recordHit(UUID entryId) {
        try {
            int updated = chatCacheRepository.incrementHit(entryId, Instant.now());
            if (updated == 0) {
                log.warn("Hit counter update matched no cache entry id={}", entryId);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to record cache hit for entry id={}", entryId, ex);
        }
    }

    /**
     * Fire-and-forget {@link #recordHit(UUID)} on a bounded elastic worker.
     */
    public void recordHitAsync(UUID entryId) {
        Mono.fromRunnable(() -> recordHit(entryId))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> { },
                        error -> log.warn("Cache hit task failed for entry id={}", entryId, error)
                );
    }

    /**
     * Insert a freshly generated answer.
     *
     * @return the stored entry, or the entry a concurrent writer stored first
     * @throws CachePersistenceException when the entry could not be written
     */
    public ChatCacheEntry store(UUID paperId,
                                String question,
                                String fingerprint,
                                String answer,
                                List<String> passageIds,
                                String model,
                                int tokensUsed) {
        ChatCacheEntry entry = new ChatCacheEntry();
        entry.setPaperId(paperId);
        entry.setQuestion(question);
        entry.setQuestionHash(fingerprint);
        entry.setAnswer(answer);
        entry.setContextChunkIds(new ArrayList<>(passageIds));
        entry.setModelUsed(model);
        entry.setTokensUsed(tokensUsed);

        try {
            ChatCacheEntry saved = chatCacheRepository.saveAndFlush(entry);
            log.debug("Stored answer cache entry id={} for paper={}", saved.getId(), paperId);
            return saved;
        } catch (DataIntegrityViolationException ex) {
            // Lost the race against an identical question; its entry is as good as ours.
            log.debug("Answer cache entry for paper={} already written concurrently", paperId);
            return existingAfterConflict(paperId, fingerprint, ex);
        } catch (RuntimeException ex) {
            throw new CachePersistenceException("Failed to store answer for paper " + paperId, ex);
        }
    }

    private ChatCacheEntry existingAfterConflict(UUID paperId, String fingerprint, DataIntegrityViolationException conflict) {
        try {
            return chatCacheRepository.findFirstByPaperIdAndQuestionHashOrderByCreatedAtAsc(paperId, fingerprint)
                    .orElseThrow(() -> new CachePersistenceException(
                            "Cache insert rejected but no existing entry for paper " + paperId, conflict));
        } catch (DataAccessException ex) {
            throw new CachePersistenceException("Failed to read back cache entry for paper " + paperId, ex);
        }
    }

    /**
     * Current content of the recorded passages, in recorded order. Passages that
     * were deleted since the answer was cached are left out.
     */
    public List<String> resolveContext(List<String> passageIds) {
        if (passageIds == null || passageIds.isEmpty()) {
            return List.of();
        }
        Map<String, String> contentById;
        try {
            contentById = passageRepository.findContentByIds(passageIds);
        } catch (DataAccessException ex) {
            log.warn("Failed to resolve {} cached passage ids: {}", passageIds.size(), ex.getMessage());
            return List.of();
        }
        return passageIds.stream()
                .map(id -> contentById.get(id.trim().toLowerCase(Locale.ROOT)))
                .filter(Objects::nonNull)
                .toList();
    }
}
