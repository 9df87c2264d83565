package com.example.ResearchGraph.repository;

import com.example.ResearchGraph.model.PaperMetadata;
import com.example.ResearchGraph.util.PaperIds;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to {@code papers}. Rows are written by the ingestion jobs.
 */
@Repository
@RequiredArgsConstructor
public class PaperRepository {

    private static final Logger log = LoggerFactory.getLogger(PaperRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT id,
                   arxiv_id,
                   title,
                   abstract,
                   authors,
                   categories,
                   published_date,
                   pdf_url,
                   "references",
                   cited_by
            FROM papers
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Resolve a paper by internal UUID or by arXiv id (version suffix ignored).
     */
    public Optional<PaperMetadata> findByIdentifier(String identifier) {
        Optional<UUID> internalId = PaperIds.parseUuid(identifier);
        List<PaperMetadata> rows;
        if (internalId.isPresent()) {
            rows = jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", new PaperRowMapper(), internalId.get());
        } else {
            String arxivId = PaperIds.stripVersion(identifier);
            rows = jdbcTemplate.query(
                    SELECT_COLUMNS + "WHERE id = ? OR arxiv_id = ?",
                    new PaperRowMapper(),
                    PaperIds.fromArxivId(arxivId),
                    arxivId
            );
        }
        return rows.stream().findFirst();
    }

    private class PaperRowMapper implements RowMapper<PaperMetadata> {
        @Override
        public PaperMetadata mapRow(ResultSet rs, int rowNum) throws SQLException {
            UUID id = rs.getObject("id", UUID.class);
            return new PaperMetadata(
                    id,
                    rs.getString("arxiv_id"),
                    rs.getString("title"),
                    rs.getString("abstract"),
                    readStringList(rs.getString("authors"), id, "authors"),
                    readStringList(rs.getString("categories"), id, "categories"),
                    rs.getObject("published_date", OffsetDateTime.class),
                    rs.getString("pdf_url"),
                    readStringList(rs.getString("references"), id, "references"),
                    readStringList(rs.getString("cited_by"), id, "cited_by")
            );
        }
    }

    /**
     * JSON columns hold either an array of strings or, in older rows, a single plain string.
     */
    private List<String> readStringList(String json, UUID paperId, String column) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node.isArray()) {
                List<String> values = new ArrayList<>(node.size());
                node.forEach(element -> values.add(element.asText()));
                return values;
            }
            if (node.isTextual()) {
                return List.of(node.asText());
            }
        } catch (Exception e) {
            // Not JSON at all; keep the raw text as the single value.
            log.debug("Column {} of paper {} is not JSON, using raw value", column, paperId);
            return List.of(json);
        }
        return List.of();
    }
}
