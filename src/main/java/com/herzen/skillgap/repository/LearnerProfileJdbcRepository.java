package com.herzen.skillgap.repository;

import com.herzen.skillgap.profile.ProfileModels.LearnerPreferences;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.List;

@Repository
public class LearnerProfileJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public LearnerProfileJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void replacePreferences(LearnerPreferences preferences) {
        String userId = preferences.userId();
        jdbcTemplate.update("DELETE FROM learner_interests WHERE user_id=?", userId);
        jdbcTemplate.update("DELETE FROM learner_desired_domains WHERE user_id=?", userId);
        new LinkedHashSet<>(preferences.interests()).forEach(i -> jdbcTemplate.update(
                "INSERT INTO learner_interests(user_id, interest) VALUES (?,?)", userId, i));
        preferences.desiredDomainIds().forEach(d -> jdbcTemplate.update(
                "INSERT INTO learner_desired_domains(user_id, domain_id) VALUES (?,?)", userId, d));
    }

    public LearnerPreferences loadPreferences(String userId) {
        List<String> interests = jdbcTemplate.queryForList(
                "SELECT interest FROM learner_interests WHERE user_id=? ORDER BY interest", String.class, userId);
        List<String> domains = jdbcTemplate.queryForList(
                "SELECT domain_id FROM learner_desired_domains WHERE user_id=? ORDER BY domain_id", String.class, userId);
        return new LearnerPreferences(userId, interests, new LinkedHashSet<>(domains));
    }
}
