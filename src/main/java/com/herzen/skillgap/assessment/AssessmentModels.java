package com.herzen.skillgap.assessment;

import com.herzen.skillgap.domain.DomainModels.Question;
import com.herzen.skillgap.profile.ProfileModels.Gap;
import com.herzen.skillgap.profile.ProficiencyCategory;

import java.time.Instant;
import java.util.List;

public class AssessmentModels {
    /**
     * Outcome of scoring one raw answer. {@code score} is null only for open-text answers
     * that still wait for a human grade.
     */
    public record ScoredResponse(Double score, Boolean correct, double maxScore) {}

    public record ResponseRecord(String assignmentId, String questionId, String rawValue, Double score, Boolean correct) {}

    public record QuestionResponse(Question question, ResponseRecord response) {}

    public enum SkillLevel {
        LOW, MEDIUM, HIGH;

        public static SkillLevel forPercentage(int percentage) {
            if (percentage >= 70) return HIGH;
            if (percentage >= 40) return MEDIUM;
            return LOW;
        }
    }

    public record SkillResult(String skillId, int score, SkillLevel level, int gapPercentage) {}

    public record SkillAggregation(List<SkillResult> skillResults, int overallScore) {}

    public record QuestionBreakdown(String questionId,
                                    String questionType,
                                    String skillId,
                                    double weight,
                                    double rawScore,
                                    double maxScore,
                                    double weightedScore,
                                    double weightedMaxScore,
                                    int percentage,
                                    Boolean correct) {}

    public record WeightedTotals(double totalWeightedScore, double totalWeightedMaxScore, int weightedPercentage) {}

    public record AssignmentRecord(String id, String userId, String testId, String status, String testTitleAr, String testTitleEn) {}

    public record AnalysisRecord(String assignmentId, String userId, String testId, int overallScore, Instant analyzedAt) {}

    public record AssessmentResult(String assignmentId,
                                   String userId,
                                   String testId,
                                   int overallScore,
                                   ProficiencyCategory category,
                                   List<SkillResult> skillResults,
                                   List<SkillResult> strengths,
                                   List<Gap> gaps,
                                   List<QuestionBreakdown> breakdown,
                                   WeightedTotals weightedTotals,
                                   Instant analyzedAt) {}

    public record AssignmentStartResponse(String assignmentId, String testId, List<String> questionIds) {}

    public record QuestionIn(String id, String type, Double weight, String skillId, String optionsJson) {}

    public record TestRegistration(String testId, int accepted, List<QuestionIssue> issues) {}

    public record QuestionIssue(String code, String message, String questionId) {}
}
