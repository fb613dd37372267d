package com.example.PolicyDesk.repository;

import com.example.PolicyDesk.exception.RetrievalUnavailableException;
import com.example.PolicyDesk.model.ScoredChunk;
import com.example.PolicyDesk.model.SourceChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Read-only access to the embedded policy chunks written by the ingestion pipeline.
 */
@Repository
@RequiredArgsConstructor
public class PolicyChunkVectorRepository {

    private static final String SEARCH_SQL = """
            SELECT id,
                   document_id,
                   page,
                   content,
                   1 - (embedding <=> ?) AS score
            FROM policy_chunks
            WHERE 1 - (embedding <=> ?) >= ?
            ORDER BY embedding <=> ?
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Uses the pgvector cosine distance operator {@code <=>}; score = 1 - distance.
     * Rows below {@code minScore} never leave the database.
     */
    public List<ScoredChunk> search(float[] embedding, int limit, double minScore) {
        PGvector queryVector = new PGvector(embedding);

        return jdbcTemplate.query(SEARCH_SQL, ps -> {
            ps.setObject(1, queryVector); // score column
            ps.setObject(2, queryVector); // threshold
            ps.setDouble(3, minScore);
            ps.setObject(4, queryVector); // ordering
            ps.setInt(5, limit);
        }, new ScoredChunkRowMapper());
    }

    static class ScoredChunkRowMapper implements RowMapper<ScoredChunk> {
        @Override
        public ScoredChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            String content = rs.getString("content");
            if (content == null) {
                throw new RetrievalUnavailableException("Chunk " + rs.getLong("id") + " has no content");
            }
            int page = rs.getInt("page");
            Integer resolvedPage = rs.wasNull() ? null : page;

            SourceChunk chunk = new SourceChunk(content, resolvedPage, rs.getString("document_id"));
            return new ScoredChunk(chunk, rs.getDouble("score"));
        }
    }
}
