package com.herzen.skillgap.repository;

import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.domain.DomainModels.CourseSkillLink;
import com.herzen.skillgap.domain.DomainModels.Skill;
import com.herzen.skillgap.domain.DomainModels.TrainingDomain;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class CatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsertDomain(TrainingDomain d) {
        jdbcTemplate.update(
                "MERGE INTO training_domains(id, name_ar, name_en) KEY(id) VALUES (?,?,?)",
                d.id(), d.nameAr(), d.nameEn());
    }

    public List<TrainingDomain> loadDomains(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return List.of();
        return jdbcTemplate.query(
                "SELECT id, name_ar, name_en FROM training_domains ORDER BY id",
                (rs, n) -> new TrainingDomain(rs.getString(1), rs.getString(2), rs.getString(3)))
                .stream()
                .filter(d -> ids.contains(d.id()))
                .toList();
    }

    public void upsertSkill(Skill s) {
        jdbcTemplate.update(
                "MERGE INTO skills(id, name_ar, name_en, domain_id) KEY(id) VALUES (?,?,?,?)",
                s.id(), s.nameAr(), s.nameEn(), s.domainId());
    }

    public Map<String, Skill> loadSkills() {
        return jdbcTemplate.query(
                "SELECT id, name_ar, name_en, domain_id FROM skills ORDER BY id",
                (rs, n) -> new Skill(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)))
                .stream()
                .collect(Collectors.toMap(Skill::id, s -> s, (a, b) -> a, LinkedHashMap::new));
    }

    public void upsertCourse(Course c) {
        jdbcTemplate.update(
                "MERGE INTO courses(id, name_ar, name_en, description_ar, description_en, subject, difficulty_level) KEY(id) VALUES (?,?,?,?,?,?,?)",
                c.id(), c.nameAr(), c.nameEn(), c.descriptionAr(), c.descriptionEn(), c.subject(), c.difficultyLevel());
        jdbcTemplate.update("DELETE FROM course_skills WHERE course_id=?", c.id());
        c.skillLinks().forEach(l -> jdbcTemplate.update(
                "INSERT INTO course_skills(course_id, skill_id, relevance_score) VALUES (?,?,?)",
                c.id(), l.skillId(), l.relevanceScore()));
        replaceExtractedSkills(c.id(), c.extractedSkills());
    }

    public void replaceExtractedSkills(String courseId, List<String> skills) {
        jdbcTemplate.update("DELETE FROM course_extracted_skills WHERE course_id=?", courseId);
        new LinkedHashSet<>(skills).forEach(s -> jdbcTemplate.update(
                "INSERT INTO course_extracted_skills(course_id, skill_text) VALUES (?,?)",
                courseId, s));
    }

    /**
     * Whole catalog snapshot, course ids ascending. Link names come from the skill catalog.
     */
    public List<Course> loadCourses() {
        List<CourseRow> rows = jdbcTemplate.query(
                "SELECT id, name_ar, name_en, description_ar, description_en, subject, difficulty_level FROM courses ORDER BY id",
                (rs, n) -> new CourseRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getString(5), rs.getString(6), rs.getString(7)));

        Map<String, List<CourseSkillLink>> links = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT cs.course_id, cs.skill_id, s.name_ar, s.name_en, cs.relevance_score FROM course_skills cs " +
                        "LEFT JOIN skills s ON cs.skill_id = s.id ORDER BY cs.course_id, cs.skill_id",
                rs -> {
                    links.computeIfAbsent(rs.getString(1), k -> new ArrayList<>())
                            .add(new CourseSkillLink(rs.getString(2), rs.getString(3), rs.getString(4), rs.getDouble(5)));
                });

        Map<String, List<String>> extracted = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT course_id, skill_text FROM course_extracted_skills ORDER BY course_id, skill_text",
                rs -> {
                    extracted.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(rs.getString(2));
                });

        return rows.stream()
                .map(r -> new Course(r.id(), r.nameAr(), r.nameEn(), r.descriptionAr(), r.descriptionEn(), r.subject(),
                        r.difficultyLevel(), links.getOrDefault(r.id(), List.of()), extracted.getOrDefault(r.id(), List.of())))
                .toList();
    }

    public Optional<Course> loadCourse(String courseId) {
        return loadCourses().stream().filter(c -> c.id().equals(courseId)).findFirst();
    }

    public void replaceVisibleCourses(Set<String> courseIds) {
        jdbcTemplate.update("DELETE FROM visible_courses");
        String now = Instant.now().toString();
        courseIds.forEach(id -> jdbcTemplate.update(
                "INSERT INTO visible_courses(course_id, visible_at) VALUES (?,?)", id, now));
    }

    public Set<String> loadVisibleCourseIds() {
        return new LinkedHashSet<>(jdbcTemplate.queryForList("SELECT course_id FROM visible_courses ORDER BY course_id", String.class));
    }

    private record CourseRow(String id, String nameAr, String nameEn, String descriptionAr, String descriptionEn,
                             String subject, String difficultyLevel) {}
}
