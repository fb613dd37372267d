package com.example.PolicyDesk.model;

/**
 * Chunk returned by the vector index together with its cosine similarity (1 - distance).
 */
public record ScoredChunk(
        SourceChunk chunk,
        double score
) {
    public ScoredChunk withChunk(SourceChunk replacement) {
        return new ScoredChunk(replacement, score);
    }
}
