package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.profile.ProficiencyCategory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

public class RecommendationModels {
    public enum Section {
        GAP_BASED, INTEREST_BASED, CAREER_BASED;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum RecommendationStatus {
        RECOMMENDED, ENROLLED, IN_PROGRESS, COMPLETED, SKIPPED;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static RecommendationStatus fromKey(String key) {
            if (key == null) return null;
            for (RecommendationStatus s : values()) {
                if (s.key().equalsIgnoreCase(key.trim())) return s;
            }
            return null;
        }
    }

    /**
     * Everything the matcher found for one course.
     *
     * @param matchedGapKeys       distinct gaps hit by any channel
     * @param matchingSkills       display names of those gaps, in gap order
     * @param relevanceSum         relevance summed over matched catalog links, each link once
     * @param gapWeightedRelevance sum of gapScore x relevance over matched (gap, link) pairs
     * @param aiMatchCount         distinct extracted-skill strings that matched a gap
     * @param graphMatch           course came back from the graph service
     */
    public record MatchInfo(String courseId,
                            List<String> matchedGapKeys,
                            List<String> matchingSkills,
                            List<String> linkMatches,
                            List<String> textMatches,
                            List<String> nameMatches,
                            double relevanceSum,
                            double gapWeightedRelevance,
                            int aiMatchCount,
                            boolean graphMatch) {
        public MatchInfo {
            matchedGapKeys = List.copyOf(matchedGapKeys);
            matchingSkills = List.copyOf(matchingSkills);
            linkMatches = List.copyOf(linkMatches);
            textMatches = List.copyOf(textMatches);
            nameMatches = List.copyOf(nameMatches);
        }

        public static MatchInfo graphOnly(String courseId) {
            return new MatchInfo(courseId, List.of(), List.of(), List.of(), List.of(), List.of(), 0.0, 0.0, 0, true);
        }

        public int skillCoverage() {
            return matchedGapKeys.size();
        }
    }

    public record ScoreBreakdown(double skillMatch,
                                 double relevance,
                                 double aiMatch,
                                 double difficultyAlignment,
                                 Double learningOutcomes,
                                 Double quality,
                                 Double careerRelevance) {
        public static ScoreBreakdown of(double skillMatch, double relevance, double aiMatch, double difficultyAlignment) {
            return new ScoreBreakdown(skillMatch, relevance, aiMatch, difficultyAlignment, null, null, null);
        }
    }

    public record ScoredCourse(Course course, MatchInfo match, ScoreBreakdown breakdown, double score) {}

    public record ExamContext(String examId, String examNameAr, String examNameEn, Instant analyzedAt) {}

    public record RecommendationReason(String reasonAr,
                                       String reasonEn,
                                       String examId,
                                       String examNameAr,
                                       String examNameEn,
                                       String categoryKey,
                                       List<String> matchingSkills) {}

    public record Recommendation(String courseId,
                                 String courseName,
                                 String difficultyLevel,
                                 List<String> matchingSkills,
                                 double recommendationScore,
                                 ScoreBreakdown scoreBreakdown,
                                 String source,
                                 Section section,
                                 RecommendationReason reason,
                                 int skillCoverage) {}

    public record SectionedRecommendations(String userId,
                                           String assignmentId,
                                           ProficiencyCategory category,
                                           ScoringPolicy scoringPolicy,
                                           List<Recommendation> gapBased,
                                           List<Recommendation> interestBased,
                                           List<Recommendation> careerBased) {}

    public record StatusEntry(String userId, String courseId, RecommendationStatus status, Instant updatedAt) {}
}
