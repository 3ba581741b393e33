package com.herzen.skillgap.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class RecommendationJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public RecommendationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveStatus(String userId, String courseId, String status) {
        jdbcTemplate.update(
                "MERGE INTO recommendation_status(user_id, course_id, status, updated_at) KEY(user_id, course_id) VALUES (?,?,?,?)",
                userId, courseId, status, Instant.now().toString());
    }

    public List<StatusRow> loadStatuses(String userId) {
        return jdbcTemplate.query(
                "SELECT user_id, course_id, status, updated_at FROM recommendation_status WHERE user_id=? ORDER BY course_id",
                (rs, n) -> new StatusRow(rs.getString(1), rs.getString(2), rs.getString(3), Instant.parse(rs.getString(4))),
                userId);
    }

    public record StatusRow(String userId, String courseId, String status, Instant updatedAt) {}
}
