package com.example.PolicyDesk.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pure retrieval result:
 * - query: the text that was embedded
 * - chunks: scored chunks above the threshold, best first
 * - degraded: true when this result stands in for a failed retrieval
 */
public record RetrievalResult(
        String query,
        List<ScoredChunk> chunks,
        boolean degraded
) {
    public RetrievalResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static RetrievalResult empty(String query) {
        return new RetrievalResult(query, List.of(), false);
    }

    public static RetrievalResult unavailable(String query) {
        return new RetrievalResult(query, List.of(), true);
    }

    public List<SourceChunk> sources() {
        return chunks.stream().map(ScoredChunk::chunk).toList();
    }

    /**
     * Chunk texts joined by blank lines, in ranking order.
     */
    public String contextText() {
        return chunks.stream()
                .map(c -> c.chunk().text())
                .collect(Collectors.joining("\n\n"));
    }
}
