package com.herzen.skillgap.assessment;

import com.herzen.skillgap.assessment.AssessmentModels.ScoredResponse;
import com.herzen.skillgap.domain.DomainModels.McqOption;
import com.herzen.skillgap.domain.DomainModels.Question;
import com.herzen.skillgap.domain.DomainModels.QuestionType;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Converts a raw answer into a score on the common 0-10 scale.
 * Never throws on malformed values: anything unparseable scores 0.
 */
@Component
public class ResponseScorer {
    static final double SCALE_MAX = 10.0;

    public ScoredResponse score(Question question, String rawValue) {
        if (question == null || question.type() == null) {
            return new ScoredResponse(0.0, false, SCALE_MAX);
        }
        return switch (question.type()) {
            case MCQ -> scoreMcq(question, rawValue);
            case LIKERT_SCALE -> scoreLikert(rawValue);
            case SELF_RATING -> scoreSelfRating(rawValue);
            case OPEN_TEXT -> new ScoredResponse(null, null, SCALE_MAX);
        };
    }

    /**
     * Manual grade for an open-text answer.
     */
    public ScoredResponse grade(double score, double percentage) {
        if (Double.isNaN(score) || score < 0 || score > SCALE_MAX) {
            throw new IllegalArgumentException("Open-text grade must be within 0-10: " + score);
        }
        return new ScoredResponse(score, percentage >= 50, SCALE_MAX);
    }

    public double maxScore(Question question) {
        if (question != null && question.type() == QuestionType.MCQ) {
            return question.options().stream().mapToDouble(McqOption::score).reduce(SCALE_MAX, Math::max);
        }
        return SCALE_MAX;
    }

    private ScoredResponse scoreMcq(Question question, String rawValue) {
        double max = maxScore(question);
        McqOption selected = rawValue == null ? null : question.options().stream()
                .filter(o -> Objects.equals(o.value(), rawValue))
                .findFirst()
                .orElse(null);
        if (selected == null) {
            return new ScoredResponse(0.0, false, max);
        }
        double score = Math.max(0.0, selected.score());
        return new ScoredResponse(score, selected.correct(), max);
    }

    private ScoredResponse scoreLikert(String rawValue) {
        Integer v = parseInt(rawValue);
        if (v == null || v < 1 || v > 5) {
            return new ScoredResponse(0.0, false, SCALE_MAX);
        }
        return new ScoredResponse((v - 1) / 4.0 * SCALE_MAX, v >= 3, SCALE_MAX);
    }

    private ScoredResponse scoreSelfRating(String rawValue) {
        Integer v = parseInt(rawValue);
        if (v == null || v < 1 || v > 10) {
            return new ScoredResponse(0.0, false, SCALE_MAX);
        }
        return new ScoredResponse((double) v, v >= 5, SCALE_MAX);
    }

    private Integer parseInt(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) return null;
        try {
            return Integer.parseInt(rawValue.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
