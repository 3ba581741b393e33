package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.enrichment.EnrichmentModels.CourseEnrichment;
import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.profile.ProfileModels.Gap;
import com.herzen.skillgap.recommendation.RecommendationModels.MatchInfo;
import com.herzen.skillgap.recommendation.RecommendationModels.ScoreBreakdown;

import java.util.List;

/**
 * Named ways of turning a course match into a 0-100 recommendation score.
 * The active policy comes from {@code skillgap.recommendation.scoring-policy}.
 */
public enum ScoringPolicy {
    /**
     * 0.40 skill match + 0.30 relevance + 0.20 free-text match + 0.10 difficulty alignment.
     */
    SKILL_BASED_ONLY {
        @Override
        ScoreBreakdown breakdown(Input in) {
            return ScoreBreakdown.of(skillMatch(in), relevance(in), aiMatch(in), difficulty(in, false));
        }

        @Override
        double combine(ScoreBreakdown b, Input in) {
            return 0.40 * b.skillMatch() + 0.30 * b.relevance() + 0.20 * b.aiMatch() + 0.10 * b.difficultyAlignment();
        }
    },

    /**
     * Uses course enrichment: skill match, difficulty, learning outcomes, quality and career relevance.
     * Missing enrichment data scores neutral.
     */
    ENRICHED_FIVE_FACTOR {
        @Override
        ScoreBreakdown breakdown(Input in) {
            return new ScoreBreakdown(skillMatch(in), relevance(in), aiMatch(in), difficulty(in, true),
                    learningOutcomes(in), quality(in), careerRelevance(in));
        }

        @Override
        double combine(ScoreBreakdown b, Input in) {
            return 0.40 * b.skillMatch() + 0.20 * b.difficultyAlignment() + 0.20 * b.learningOutcomes()
                    + 0.10 * b.quality() + 0.10 * b.careerRelevance();
        }

        @Override
        public boolean usesEnrichment() {
            return true;
        }
    },

    /**
     * Gap-weighted link relevance boosted by coverage, normalised against the total gap score.
     */
    BASIC_WEIGHTED {
        @Override
        ScoreBreakdown breakdown(Input in) {
            return ScoreBreakdown.of(skillMatch(in), relevance(in), aiMatch(in), difficulty(in, false));
        }

        @Override
        double combine(ScoreBreakdown b, Input in) {
            double totalGap = in.gaps().stream().mapToInt(Gap::gapScore).sum();
            if (totalGap <= 0) return 0.0;
            int coverage = in.match().skillCoverage();
            double boosted = in.match().gapWeightedRelevance() * (1 + 0.15 * Math.max(0, coverage - 1));
            return Math.min(100.0, boosted / totalGap * 100.0);
        }
    };

    abstract ScoreBreakdown breakdown(Input in);

    abstract double combine(ScoreBreakdown breakdown, Input in);

    public boolean usesEnrichment() {
        return false;
    }

    public record Input(MatchInfo match, List<Gap> gaps, ProficiencyCategory category, Course course, CourseEnrichment enrichment) {
        public Input {
            gaps = gaps == null ? List.of() : gaps;
            enrichment = enrichment == null ? CourseEnrichment.empty() : enrichment;
        }
    }

    static double skillMatch(Input in) {
        if (in.gaps().isEmpty()) return 0.0;
        return Math.min(100.0, 100.0 * in.match().skillCoverage() / in.gaps().size());
    }

    static double relevance(Input in) {
        return Math.min(100.0, 50.0 * in.match().relevanceSum());
    }

    static double aiMatch(Input in) {
        return Math.min(100.0, 25.0 * in.match().aiMatchCount());
    }

    /**
     * 100 on the recommended difficulty, 50 when the course declares none we recognise. Lower allowed
     * levels get 80, or with {@code graded} 100 minus 15 per step down.
     */
    static double difficulty(Input in, boolean graded) {
        String level = TextSimilarity.normalize(in.course().difficultyLevel());
        if (ProficiencyCategory.difficultyRank(level) < 0 || in.category() == null) return 50.0;
        if (level.equals(in.category().recommendedDifficulty())) return 100.0;
        int index = in.category().allowedDifficulties().indexOf(level);
        if (index < 0) return 0.0;
        return graded ? 100.0 - 15.0 * index : 80.0;
    }

    static double learningOutcomes(Input in) {
        List<String> outcomes = in.enrichment().learningOutcomes();
        if (outcomes.isEmpty()) return 50.0;
        long matching = outcomes.stream()
                .map(TextSimilarity::normalize)
                .filter(o -> in.gaps().stream().flatMap(g -> g.normalizedNames().stream()).anyMatch(o::contains))
                .count();
        return Math.min(100.0, 100.0 * matching / outcomes.size() + 30.0);
    }

    static double quality(Input in) {
        if (in.enrichment().quality() == null) return 60.0;
        return in.enrichment().quality().mean() * 20.0;
    }

    static double careerRelevance(Input in) {
        int paths = in.enrichment().careerPaths().size();
        if (paths == 0) return 60.0;
        return 70.0 + Math.min(30.0, 10.0 * paths);
    }
}
