package com.example.ResearchGraph.repository;

import com.example.ResearchGraph.util.PaperIds;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Plain lookups on {@code paper_chunks}. Similarity search lives in {@link PassageVectorRepository}.
 */
@Repository
@RequiredArgsConstructor
public class PassageRepository {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public long countByPaperId(UUID paperId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM paper_chunks WHERE paper_id = ?",
                Long.class,
                paperId
        );
        return count == null ? 0L : count;
    }

    /**
     * Content of the given passages keyed by id. Ids that are malformed or no longer
     * exist are absent from the result.
     */
    public Map<String, String> findContentByIds(Collection<String> passageIds) {
        List<UUID> ids = passageIds.stream()
                .map(PaperIds::parseUuid)
                .flatMap(Optional::stream)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return Map.of();
        }

        Map<String, String> contentById = new HashMap<>();
        namedJdbcTemplate.query(
                "SELECT id, content FROM paper_chunks WHERE id IN (:ids)",
                new MapSqlParameterSource("ids", ids),
                rs -> {
                    contentById.put(rs.getObject("id", UUID.class).toString(), rs.getString("content"));
                }
        );
        return contentById;
    }
}
