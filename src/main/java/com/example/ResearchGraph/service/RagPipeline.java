package com.example.ResearchGraph.service;

import com.example.ResearchGraph.capability.AnswerGenerator;
import com.example.ResearchGraph.capability.GenerationResult;
import com.example.ResearchGraph.common.convention.errorcode.RagErrorCode;
import com.example.ResearchGraph.common.convention.exception.CachePersistenceException;
import com.example.ResearchGraph.common.convention.exception.ClientException;
import com.example.ResearchGraph.common.convention.exception.RateLimitedException;
import com.example.ResearchGraph.common.convention.exception.ServiceException;
import com.example.ResearchGraph.config.RagProperties;
import com.example.ResearchGraph.model.AnswerSource;
import com.example.ResearchGraph.model.AskResponse;
import com.example.ResearchGraph.model.AssembledContext;
import com.example.ResearchGraph.model.ChatCacheEntry;
import com.example.ResearchGraph.model.PaperMetadata;
import com.example.ResearchGraph.repository.PaperRepository;
import com.example.ResearchGraph.util.PaperIds;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Answers a question about one paper:
 * cache probe → paper lookup → context assembly → generation → cache write.
 *
 * <p>Cache hits never touch the paper store, the embedding model or the generator.
 * A failed cache write is logged and the generated answer is returned anyway.</p>
 */
@Service
@RequiredArgsConstructor
public class RagPipeline {

    private static final Logger log = LoggerFactory.getLogger(RagPipeline.class);

    private final QuestionNormalizer questionNormalizer;
    private final AnswerCacheService answerCache;
    private final PaperRepository paperRepository;
    private final ContextAssembler contextAssembler;
    private final AnswerGenerator answerGenerator;
    private final InFlightAnswers inFlightAnswers;
    private final RagProperties properties;

    /**
     * @param paperIdentifier internal UUID or arXiv id
     * @throws ClientException       unknown paper, paper without content, or blank input
     * @throws RateLimitedException  the generation provider is exhausted
     * @throws ServiceException      any other provider failure
     */
    public AskResponse ask(String paperIdentifier, String question) {
        if (paperIdentifier == null || paperIdentifier.isBlank()) {
            throw new ClientException("paper_id is required", RagErrorCode.PARAM_EMPTY);
        }
        if (question == null || question.isBlank()) {
            throw new ClientException(RagErrorCode.QUESTION_EMPTY);
        }

        String identifier = paperIdentifier.trim();
        String trimmedQuestion = question.trim();
        String fingerprint = questionNormalizer.normalize(trimmedQuestion);

        UUID probeId = PaperIds.parseUuid(identifier)
                .orElseGet(() -> PaperIds.fromArxivId(PaperIds.stripVersion(identifier)));
        Optional<AskResponse> hit = fromCache(probeId, fingerprint);
        if (hit.isPresent()) {
            return hit.get();
        }

        PaperMetadata paper = paperRepository.findByIdentifier(identifier)
                .orElseThrow(() -> new ClientException(
                        "Paper '" + identifier + "' not found", RagErrorCode.PAPER_NOT_FOUND));

        // Rows ingested with a non-derived id are cached under their real id.
        if (!paper.id().equals(probeId)) {
            hit = fromCache(paper.id(), fingerprint);
            if (hit.isPresent()) {
                return hit.get();
            }
        }

        if (properties.getCache().isSingleFlight()) {
            // A generation that finished just before this call took the lead has already been cached.
            return inFlightAnswers.join(
                    paper.id() + ":" + fingerprint,
                    () -> fromCache(paper.id(), fingerprint)
                            .orElseGet(() -> generateAndCache(paper, trimmedQuestion, fingerprint))
            );
        }
        return generateAndCache(paper, trimmedQuestion, fingerprint);
    }

    private Optional<AskResponse> fromCache(UUID paperId, String fingerprint) {
        Optional<ChatCacheEntry> cached = answerCache.lookup(paperId, fingerprint);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        ChatCacheEntry entry = cached.get();
        answerCache.recordHitAsync(entry.getId());
        return Optional.of(new AskResponse(
                entry.getAnswer(),
                AnswerSource.CACHE,
                answerCache.resolveContext(entry.getContextChunkIds())
        ));
    }

    private AskResponse generateAndCache(PaperMetadata paper, String question, String fingerprint) {
        AssembledContext context = contextAssembler.assemble(paper, question);

        GenerationResult result = answerGenerator.generate(question, context.context());
        if (result instanceof GenerationResult.RateLimited rateLimited) {
            throw new RateLimitedException(rateLimited.retryAfter());
        }
        if (result instanceof GenerationResult.Failed failed) {
            log.error("Answer generation failed for paper={}: {}", paper.id(), failed.detail());
            throw new ServiceException(null, failed.cause(), RagErrorCode.UPSTREAM_ERROR);
        }
        GenerationResult.Generated generated = (GenerationResult.Generated) result;
        log.info("Generated answer for paper={} with model={} tokens={} passages={}",
                paper.id(), generated.model(), generated.tokensUsed(), context.passageIds().size());

        try {
            answerCache.store(
                    paper.id(),
                    question,
                    fingerprint,
                    generated.answer(),
                    context.passageIds(),
                    generated.model(),
                    generated.tokensUsed()
            );
        } catch (CachePersistenceException ex) {
            log.warn("Cache persistence warning: answer for paper={} was not cached", paper.id(), ex);
        }

        return new AskResponse(generated.answer(), AnswerSource.LLM, context.context());
    }
}
