package com.herzen.skillgap.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Raw JSON enrichment payloads keyed by course. Parsing stays with the enrichment service.
 */
@Repository
public class EnrichmentJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public EnrichmentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> loadPayload(String courseId) {
        return jdbcTemplate.queryForList(
                "SELECT payload FROM course_enrichments WHERE course_id=?", String.class, courseId)
                .stream().findFirst();
    }

    public void savePayload(String courseId, String payload) {
        jdbcTemplate.update(
                "MERGE INTO course_enrichments(course_id, payload, enriched_at) KEY(course_id) VALUES (?,?,?)",
                courseId, payload, Instant.now().toString());
    }

    public List<String> courseIdsWithoutEnrichment(int limit) {
        return jdbcTemplate.queryForList(
                "SELECT c.id FROM courses c LEFT JOIN course_enrichments e ON c.id = e.course_id " +
                        "WHERE e.course_id IS NULL ORDER BY c.id FETCH FIRST ? ROWS ONLY",
                String.class, limit);
    }
}
