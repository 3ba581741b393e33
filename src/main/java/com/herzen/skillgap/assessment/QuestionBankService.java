package com.herzen.skillgap.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.skillgap.assessment.AssessmentModels.QuestionIn;
import com.herzen.skillgap.assessment.AssessmentModels.QuestionIssue;
import com.herzen.skillgap.assessment.AssessmentModels.TestRegistration;
import com.herzen.skillgap.domain.DomainModels.McqOption;
import com.herzen.skillgap.domain.DomainModels.Question;
import com.herzen.skillgap.domain.DomainModels.QuestionType;
import com.herzen.skillgap.repository.AssessmentJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class QuestionBankService {
    private static final Logger log = LoggerFactory.getLogger(QuestionBankService.class);

    private final AssessmentJdbcRepository repository;
    private final ObjectMapper objectMapper;

    public QuestionBankService(AssessmentJdbcRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a test and its questions. Rows without an id, with an unknown type or a negative
     * weight are rejected; unreadable MCQ options are stored as an empty list. Every problem is reported.
     */
    @Transactional
    public TestRegistration registerTest(String testId, String titleAr, String titleEn, List<QuestionIn> questions) {
        if (testId == null || testId.isBlank()) {
            throw new IllegalArgumentException("testId is required");
        }
        repository.saveTest(testId, titleAr, titleEn);

        List<QuestionIssue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int order = 0;
        int accepted = 0;
        for (QuestionIn in : questions == null ? List.<QuestionIn>of() : questions) {
            if (in == null || in.id() == null || in.id().isBlank()) {
                issues.add(new QuestionIssue("MISSING_ID", "Question without id skipped", null));
                continue;
            }
            if (!seen.add(in.id())) {
                issues.add(new QuestionIssue("DUPLICATE_QUESTION", "Duplicate question id: " + in.id(), in.id()));
                continue;
            }
            QuestionType type = QuestionType.fromWire(in.type());
            if (type == null) {
                issues.add(new QuestionIssue("UNKNOWN_TYPE", "Unknown question type: " + in.type(), in.id()));
                continue;
            }
            double weight = in.weight() == null ? 1.0 : in.weight();
            if (weight < 0 || Double.isNaN(weight)) {
                issues.add(new QuestionIssue("NEGATIVE_WEIGHT", "Question weight must be >= 0: " + in.weight(), in.id()));
                continue;
            }
            if (in.skillId() == null || in.skillId().isBlank()) {
                issues.add(new QuestionIssue("MISSING_SKILL", "Question is not linked to a skill and will not be aggregated", in.id()));
            }

            List<McqOption> options = List.of();
            if (type == QuestionType.MCQ) {
                options = parseOptions(in, issues);
            }
            repository.saveQuestion(new Question(in.id(), testId, type, weight, blankToNull(in.skillId()), options), order++);
            accepted++;
        }
        log.info("Registered test {}: {} questions accepted, {} issues", testId, accepted, issues.size());
        return new TestRegistration(testId, accepted, issues);
    }

    private List<McqOption> parseOptions(QuestionIn in, List<QuestionIssue> issues) {
        if (in.optionsJson() == null || in.optionsJson().isBlank()) {
            issues.add(new QuestionIssue("MISSING_OPTIONS", "MCQ question has no options", in.id()));
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(in.optionsJson());
        } catch (JsonProcessingException e) {
            issues.add(new QuestionIssue("INVALID_OPTIONS", "Options are not valid JSON: " + e.getOriginalMessage(), in.id()));
            return List.of();
        }
        if (root == null || !root.isArray()) {
            issues.add(new QuestionIssue("INVALID_OPTIONS", "Options must be a JSON array", in.id()));
            return List.of();
        }

        List<McqOption> options = new ArrayList<>();
        for (JsonNode node : root) {
            JsonNode value = node.get("value");
            if (value == null || value.isNull()) {
                issues.add(new QuestionIssue("INVALID_OPTION", "Option without value skipped", in.id()));
                continue;
            }
            double score = numberOrZero(node.get("score"));
            if (!Double.isFinite(score)) {
                issues.add(new QuestionIssue("INVALID_OPTION", "Option '" + value.asText() + "' has a non-finite score, using 0", in.id()));
                score = 0.0;
            }
            options.add(new McqOption(value.asText(), score, flag(node)));
        }
        return options;
    }

    private double numberOrZero(JsonNode node) {
        if (node == null || node.isNull()) return 0.0;
        if (node.isNumber()) return node.asDouble();
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private boolean flag(JsonNode option) {
        JsonNode node = option.has("is_correct") ? option.get("is_correct") : option.get("correct");
        if (node == null || node.isNull()) return false;
        return node.isBoolean() ? node.asBoolean() : "true".equalsIgnoreCase(node.asText().trim());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
