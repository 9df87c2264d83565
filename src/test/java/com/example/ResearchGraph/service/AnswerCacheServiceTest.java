package com.example.ResearchGraph.service;

import com.example.ResearchGraph.common.convention.exception.CachePersistenceException;
import com.example.ResearchGraph.model.ChatCacheEntry;
import com.example.ResearchGraph.repository.ChatCacheRepository;
import com.example.ResearchGraph.repository.PassageRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerCacheServiceTest {

    private static final String HASH = "a".repeat(64);

    @Mock
    private ChatCacheRepository chatCacheRepository;

    @Mock
    private PassageRepository passageRepository;

    @InjectMocks
    private AnswerCacheService answerCache;

    @Test
    void lookupFailureIsAMiss() {
        UUID paperId = UUID.randomUUID();
        when(chatCacheRepository.findFirstByPaperIdAndQuestionHashOrderByCreatedAtAsc(paperId, HASH))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertTrue(answerCache.lookup(paperId, HASH).isEmpty());
    }

    @Test
    void storeCopiesEverythingIntoTheEntry() {
        UUID paperId = UUID.randomUUID();
        when(chatCacheRepository.saveAndFlush(any(ChatCacheEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        answerCache.store(paperId, "What is X?", HASH, "X is Y.", List.of("p1", "p2"), "gpt-4o-mini", 321);

        ArgumentCaptor<ChatCacheEntry> captor = ArgumentCaptor.forClass(ChatCacheEntry.class);
        verify(chatCacheRepository).saveAndFlush(captor.capture());
        ChatCacheEntry saved = captor.getValue();
        assertEquals(paperId, saved.getPaperId());
        assertEquals("What is X?", saved.getQuestion());
        assertEquals(HASH, saved.getQuestionHash());
        assertEquals("X is Y.", saved.getAnswer());
        assertEquals(List.of("p1", "p2"), saved.getContextChunkIds());
        assertEquals("gpt-4o-mini", saved.getModelUsed());
        assertEquals(321, saved.getTokensUsed());
        assertEquals(0, saved.getHitCount());
    }

    @Test
    void duplicateInsertReturnsTheWinningEntry() {
        UUID paperId = UUID.randomUUID();
        ChatCacheEntry winner = new ChatCacheEntry();
        winner.setAnswer("first answer");
        when(chatCacheRepository.saveAndFlush(any(ChatCacheEntry.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));
        when(chatCacheRepository.findFirstByPaperIdAndQuestionHashOrderByCreatedAtAsc(paperId, HASH))
                .thenReturn(Optional.of(winner));

        ChatCacheEntry stored = answerCache.store(paperId, "q", HASH, "second answer", List.of(), "m", 1);

        assertSame(winner, stored);
    }

    @Test
    void writeFailureIsReportedAsCachePersistence() {
        when(chatCacheRepository.saveAndFlush(any(ChatCacheEntry.class)))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        assertThrows(CachePersistenceException.class,
                () -> answerCache.store(UUID.randomUUID(), "q", HASH, "a", List.of(), "m", 1));
    }

    @Test
    void recordHitNeverThrows() {
        UUID entryId = UUID.randomUUID();
        when(chatCacheRepository.incrementHit(eq(entryId), any(Instant.class)))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertDoesNotThrow(() -> answerCache.recordHit(entryId));
    }

    @Test
    void recordHitAsyncIncrementsInBackground() {
        UUID entryId = UUID.randomUUID();
        when(chatCacheRepository.incrementHit(eq(entryId), any(Instant.class))).thenReturn(1);

        answerCache.recordHitAsync(entryId);

        verify(chatCacheRepository, timeout(2000)).incrementHit(eq(entryId), any(Instant.class));
    }

    @Test
    void resolveContextKeepsRecordedOrderAndSkipsDeletedPassages() {
        String first = UUID.randomUUID().toString();
        String deleted = UUID.randomUUID().toString();
        String third = UUID.randomUUID().toString();
        List<String> recorded = List.of(third, deleted, first);
        when(passageRepository.findContentByIds(recorded)).thenReturn(Map.of(
                first, "first passage",
                third, "third passage"
        ));

        List<String> context = answerCache.resolveContext(recorded);

        assertEquals(List.of("third passage", "first passage"), context);
    }

    @Test
    void resolveContextOfEmptyListSkipsTheDatabase() {
        assertTrue(answerCache.resolveContext(List.of()).isEmpty());
        assertTrue(answerCache.resolveContext(null).isEmpty());
        verifyNoInteractions(passageRepository);
    }

    @Test
    void resolveContextFailureYieldsEmptyContext() {
        List<String> recorded = List.of(UUID.randomUUID().toString());
        when(passageRepository.findContentByIds(recorded))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertTrue(answerCache.resolveContext(recorded).isEmpty());
    }
}
