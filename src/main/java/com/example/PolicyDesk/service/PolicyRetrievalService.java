package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.PolicyDeskProperties;
import com.example.PolicyDesk.exception.EmbeddingUnavailableException;
import com.example.PolicyDesk.exception.RetrievalUnavailableException;
import com.example.PolicyDesk.model.RetrievalResult;
import com.example.PolicyDesk.model.ScoredChunk;
import com.example.PolicyDesk.model.SourceChunk;
import com.example.PolicyDesk.repository.PolicyChunkVectorRepository;
import com.example.PolicyDesk.util.ChunkTextCleaner;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * RAG retrieval-only service:
 * - Embeds the query text
 * - Queries the vector index for the topK nearest chunks
 * - Keeps only chunks at or above the minimum score
 * - Strips document boilerplate from chunk text
 *
 * There is no fallback to an unfiltered query: when nothing clears the threshold
 * the result is empty and the answer is generated without context.
 */
@Service
@RequiredArgsConstructor
public class PolicyRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(PolicyRetrievalService.class);

    private final EmbeddingModel embeddingModel;
    private final PolicyChunkVectorRepository chunkRepository;
    private final PolicyDeskProperties properties;

    /**
     * @throws EmbeddingUnavailableException  if the query cannot be embedded
     * @throws RetrievalUnavailableException if the vector index cannot be queried
     */
    public RetrievalResult retrieve(String queryText) {
        PolicyDeskProperties.Retrieval settings = properties.getRetrieval();
        float[] queryEmbedding = embed(queryText);

        List<ScoredChunk> candidates;
        try {
            candidates = chunkRepository.search(queryEmbedding, settings.getTopK(), settings.getMinScore());
        } catch (DataAccessException e) {
            throw new RetrievalUnavailableException("Vector index query failed", e);
        }

        if (candidates == null || candidates.isEmpty()) {
            log.debug("Retrieval: no chunks above minScore={} for query='{}'", settings.getMinScore(), queryText);
            return RetrievalResult.empty(queryText);
        }

        List<ScoredChunk> filtered = candidates.stream()
                .filter(c -> c.score() >= settings.getMinScore())
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(settings.getTopK())
                .map(c -> c.withChunk(new SourceChunk(
                        ChunkTextCleaner.clean(c.chunk().text(), settings.getBoilerplate()),
                        c.chunk().page(),
                        c.chunk().documentId()
                )))
                .toList();

        log.debug("Retrieval: {} of {} candidates kept for query='{}'", filtered.size(), candidates.size(), queryText);
        return new RetrievalResult(queryText, filtered, false);
    }

    private float[] embed(String queryText) {
        float[] embedding;
        try {
            embedding = embeddingModel.embed(queryText);
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Embedding service call failed", e);
        }
        if (embedding == null || embedding.length == 0) {
            throw new EmbeddingUnavailableException("Embedding service returned an empty vector");
        }
        return embedding;
    }
}
