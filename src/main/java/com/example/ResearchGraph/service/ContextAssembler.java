package com.example.ResearchGraph.service;

import com.example.ResearchGraph.capability.EmbeddingProvider;
import com.example.ResearchGraph.capability.PassageIndex;
import com.example.ResearchGraph.common.convention.errorcode.RagErrorCode;
import com.example.ResearchGraph.common.convention.exception.ClientException;
import com.example.ResearchGraph.config.RagProperties;
import com.example.ResearchGraph.model.AssembledContext;
import com.example.ResearchGraph.model.PaperMetadata;
import com.example.ResearchGraph.model.ScoredPassage;
import com.example.ResearchGraph.repository.PassageRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the context for one question about one paper.
 *
 * <ol>
 *   <li>Paper has passages: embed the question, take the top-K most similar
 *       passages, and put the metadata block in front when rich metadata is on.</li>
 *   <li>No passages but an abstract: a single metadata-derived block, no passage ids.</li>
 *   <li>Neither: {@link RagErrorCode#NO_CONTENT_AVAILABLE}.</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private static final Comparator<ScoredPassage> BY_RELEVANCE =
            Comparator.comparingDouble(ScoredPassage::score).reversed()
                    .thenComparingInt(ScoredPassage::chunkIndex);

    private final PassageRepository passageRepository;
    private final EmbeddingProvider embeddingProvider;
    private final PassageIndex passageIndex;
    private final PaperContextFormatter formatter;
    private final RagProperties properties;

    public AssembledContext assemble(PaperMetadata paper, String question) {
        boolean richMetadata = properties.getContext().isRichMetadata();

        if (passageRepository.countByPaperId(paper.id()) > 0) {
            List<ScoredPassage> passages = retrieve(paper, question);
            if (!passages.isEmpty()) {
                List<String> context = new ArrayList<>(passages.size() + 1);
                if (richMetadata) {
                    context.add(formatter.metadataBlock(paper));
                }
                passages.forEach(p -> context.add(p.content()));

                List<String> passageIds = passages.stream()
                        .map(p -> p.id().toString())
                        .toList();
                return new AssembledContext(List.copyOf(context), passageIds);
            }
            log.debug("Paper {} has passages but none are searchable, falling back to metadata", paper.id());
        }

        if (paper.hasAbstract()) {
            String block = richMetadata ? formatter.metadataBlock(paper) : formatter.titleAndAbstract(paper);
            return new AssembledContext(List.of(block), List.of());
        }

        throw new ClientException(
                "No content found for paper '" + paper.id() + "'.",
                RagErrorCode.NO_CONTENT_AVAILABLE
        );
    }

    private List<ScoredPassage> retrieve(PaperMetadata paper, String question) {
        int topK = Math.max(1, properties.getRetrieval().getTopK());
        float[] queryVector = embeddingProvider.embed(question);

        List<ScoredPassage> ranked = passageIndex.topK(paper.id(), queryVector, topK).stream()
                .sorted(BY_RELEVANCE)
                .limit(topK)
                .toList();
        log.debug("Retrieved {} passages for paper {} (topK={})", ranked.size(), paper.id(), topK);
        return ranked;
    }
}
