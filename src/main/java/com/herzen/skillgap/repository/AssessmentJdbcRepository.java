package com.herzen.skillgap.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.skillgap.assessment.AssessmentModels.AnalysisRecord;
import com.herzen.skillgap.assessment.AssessmentModels.AssignmentRecord;
import com.herzen.skillgap.assessment.AssessmentModels.QuestionResponse;
import com.herzen.skillgap.assessment.AssessmentModels.ResponseRecord;
import com.herzen.skillgap.assessment.AssessmentModels.SkillLevel;
import com.herzen.skillgap.assessment.AssessmentModels.SkillResult;
import com.herzen.skillgap.domain.DomainModels.McqOption;
import com.herzen.skillgap.domain.DomainModels.Question;
import com.herzen.skillgap.domain.DomainModels.QuestionType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

@Repository
public class AssessmentJdbcRepository {
    private static final TypeReference<List<McqOption>> OPTION_LIST = new TypeReference<>() {};
    // fixed width so analyzed_at sorts as text
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AssessmentJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void saveTest(String testId, String titleAr, String titleEn) {
        jdbcTemplate.update(
                "MERGE INTO tests(id, title_ar, title_en) KEY(id) VALUES (?,?,?)",
                testId, titleAr, titleEn);
    }

    public void saveQuestion(Question q, int orderIndex) {
        jdbcTemplate.update(
                "MERGE INTO questions(id, test_id, question_type, weight, skill_id, options_json, order_index) KEY(id) VALUES (?,?,?,?,?,?,?)",
                q.id(), q.testId(), q.type().wireValue(), q.weight(), q.skillId(), writeOptions(q.options()), orderIndex);
    }

    public List<Question> loadQuestions(String testId) {
        return jdbcTemplate.query(
                "SELECT id, test_id, question_type, weight, skill_id, options_json FROM questions WHERE test_id=? ORDER BY order_index, id",
                questionMapper(), testId);
    }

    public Optional<Question> loadQuestion(String questionId) {
        return jdbcTemplate.query(
                "SELECT id, test_id, question_type, weight, skill_id, options_json FROM questions WHERE id=?",
                questionMapper(), questionId).stream().findFirst();
    }

    public void createAssignment(String assignmentId, String userId, String testId) {
        jdbcTemplate.update(
                "INSERT INTO test_assignments(id, user_id, test_id, status, started_at) VALUES (?,?,?,?,?)",
                assignmentId, userId, testId, "in_progress", Instant.now().toString());
    }

    public Optional<AssignmentRecord> loadAssignment(String assignmentId) {
        return jdbcTemplate.query(
                "SELECT a.id, a.user_id, a.test_id, a.status, t.title_ar, t.title_en FROM test_assignments a " +
                        "LEFT JOIN tests t ON a.test_id = t.id WHERE a.id=?",
                (rs, n) -> new AssignmentRecord(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5), rs.getString(6)),
                assignmentId).stream().findFirst();
    }

    /**
     * @return false when the assignment was not in progress
     */
    public boolean markCompleted(String assignmentId) {
        return jdbcTemplate.update(
                "UPDATE test_assignments SET status='completed', completed_at=? WHERE id=? AND status='in_progress'",
                Instant.now().toString(), assignmentId) == 1;
    }

    public void saveResponse(ResponseRecord r) {
        jdbcTemplate.update(
                "MERGE INTO responses(assignment_id, question_id, response_value, score, is_correct, answered_at) KEY(assignment_id, question_id) VALUES (?,?,?,?,?,?)",
                r.assignmentId(), r.questionId(), r.rawValue(), r.score(), r.correct(), Instant.now().toString());
    }

    public Optional<ResponseRecord> loadResponse(String assignmentId, String questionId) {
        return jdbcTemplate.query(
                "SELECT assignment_id, question_id, response_value, score, is_correct FROM responses WHERE assignment_id=? AND question_id=?",
                (rs, n) -> responseRow(rs, 1),
                assignmentId, questionId).stream().findFirst();
    }

    public List<QuestionResponse> loadQuestionResponses(String assignmentId) {
        RowMapper<Question> questions = questionMapper();
        return jdbcTemplate.query(
                "SELECT q.id, q.test_id, q.question_type, q.weight, q.skill_id, q.options_json, " +
                        "r.assignment_id, r.question_id, r.response_value, r.score, r.is_correct " +
                        "FROM responses r JOIN questions q ON r.question_id = q.id " +
                        "WHERE r.assignment_id=? ORDER BY q.order_index, q.id",
                (rs, n) -> new QuestionResponse(questions.mapRow(rs, n), responseRow(rs, 7)),
                assignmentId);
    }

    public void replaceSkillResults(String assignmentId, List<SkillResult> results) {
        jdbcTemplate.update("DELETE FROM skill_results WHERE assignment_id=?", assignmentId);
        results.forEach(r -> jdbcTemplate.update(
                "INSERT INTO skill_results(assignment_id, skill_id, score, skill_level, gap_percentage) VALUES (?,?,?,?,?)",
                assignmentId, r.skillId(), r.score(), r.level().name(), r.gapPercentage()));
    }

    public List<SkillResult> loadSkillResults(String assignmentId) {
        return jdbcTemplate.query(
                "SELECT skill_id, score, skill_level, gap_percentage FROM skill_results WHERE assignment_id=? ORDER BY skill_id",
                (rs, n) -> new SkillResult(rs.getString(1), rs.getInt(2), SkillLevel.valueOf(rs.getString(3)), rs.getInt(4)),
                assignmentId);
    }

    public void saveAnalysis(AnalysisRecord a) {
        jdbcTemplate.update(
                "MERGE INTO analysis_results(assignment_id, user_id, test_id, overall_score, analyzed_at) KEY(assignment_id) VALUES (?,?,?,?,?)",
                a.assignmentId(), a.userId(), a.testId(), a.overallScore(), TIMESTAMP.format(a.analyzedAt()));
    }

    public Optional<AnalysisRecord> loadAnalysis(String assignmentId) {
        return jdbcTemplate.query(
                "SELECT assignment_id, user_id, test_id, overall_score, analyzed_at FROM analysis_results WHERE assignment_id=?",
                (rs, n) -> analysisRow(rs),
                assignmentId).stream().findFirst();
    }

    public Optional<AnalysisRecord> latestAnalysisForUser(String userId) {
        return jdbcTemplate.query(
                "SELECT assignment_id, user_id, test_id, overall_score, analyzed_at FROM analysis_results WHERE user_id=? ORDER BY analyzed_at DESC FETCH FIRST 1 ROWS ONLY",
                (rs, n) -> analysisRow(rs),
                userId).stream().findFirst();
    }

    private AnalysisRecord analysisRow(ResultSet rs) throws SQLException {
        return new AnalysisRecord(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4), Instant.parse(rs.getString(5)));
    }

    private ResponseRecord responseRow(ResultSet rs, int offset) throws SQLException {
        double score = rs.getDouble(offset + 3);
        Double nullableScore = rs.wasNull() ? null : score;
        boolean correct = rs.getBoolean(offset + 4);
        Boolean nullableCorrect = rs.wasNull() ? null : correct;
        return new ResponseRecord(rs.getString(offset), rs.getString(offset + 1), rs.getString(offset + 2), nullableScore, nullableCorrect);
    }

    private RowMapper<Question> questionMapper() {
        return (rs, n) -> new Question(
                rs.getString(1),
                rs.getString(2),
                QuestionType.fromWire(rs.getString(3)),
                rs.getDouble(4),
                rs.getString(5),
                readOptions(rs.getString(6)));
    }

    private String writeOptions(List<McqOption> options) {
        try {
            return objectMapper.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize question options", e);
        }
    }

    private List<McqOption> readOptions(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, OPTION_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored question options are not valid JSON", e);
        }
    }
}
