package com.example.ResearchGraph.repository;

import com.example.ResearchGraph.capability.PassageIndex;
import com.example.ResearchGraph.model.ScoredPassage;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class PassageVectorRepository implements PassageIndex {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Uses pgvector's cosine distance operator {@code <=>}; score = 1 - distance.
     * Equal distances fall back to chunk order.
     */
    @Override
    public List<ScoredPassage> topK(UUID paperId, float[] queryVector, int k) {
        PGvector vector = new PGvector(queryVector);

        String sql = """
                SELECT id,
                       content,
                       chunk_index,
                       1 - (embedding <=> ?) AS score
                FROM paper_chunks
                WHERE paper_id = ?
                  AND embedding IS NOT NULL
                ORDER BY embedding <=> ?, chunk_index
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, vector);
            ps.setObject(2, paperId);
            ps.setObject(3, vector);
            ps.setInt(4, k);
        }, new ScoredPassageRowMapper());
    }

    private static class ScoredPassageRowMapper implements RowMapper<ScoredPassage> {
        @Override
        public ScoredPassage mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ScoredPassage(
                    rs.getObject("id", UUID.class),
                    rs.getString("content"),
                    rs.getInt("chunk_index"),
                    rs.getDouble("score")
            );
        }
    }
}
