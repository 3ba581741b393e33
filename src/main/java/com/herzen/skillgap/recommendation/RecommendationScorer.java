package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.recommendation.RecommendationModels.ScoreBreakdown;
import com.herzen.skillgap.recommendation.RecommendationModels.ScoredCourse;
import org.springframework.stereotype.Component;

@Component
public class RecommendationScorer {

    public ScoredCourse score(ScoringPolicy policy, ScoringPolicy.Input input) {
        ScoreBreakdown raw = policy.breakdown(input);
        ScoreBreakdown breakdown = new ScoreBreakdown(
                round2(raw.skillMatch()),
                round2(raw.relevance()),
                round2(raw.aiMatch()),
                round2(raw.difficultyAlignment()),
                round2(raw.learningOutcomes()),
                round2(raw.quality()),
                round2(raw.careerRelevance()));
        double score = Math.max(0.0, Math.min(100.0, policy.combine(raw, input)));
        return new ScoredCourse(input.course(), input.match(), breakdown, round2(score));
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static Double round2(Double v) {
        return v == null ? null : round2(v.doubleValue());
    }
}
