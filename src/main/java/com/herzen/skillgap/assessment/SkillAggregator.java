package com.herzen.skillgap.assessment;

import com.herzen.skillgap.assessment.AssessmentModels.QuestionBreakdown;
import com.herzen.skillgap.assessment.AssessmentModels.QuestionResponse;
import com.herzen.skillgap.assessment.AssessmentModels.SkillAggregation;
import com.herzen.skillgap.assessment.AssessmentModels.SkillLevel;
import com.herzen.skillgap.assessment.AssessmentModels.SkillResult;
import com.herzen.skillgap.assessment.AssessmentModels.WeightedTotals;
import com.herzen.skillgap.domain.DomainModels.Question;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds scored responses into per-skill percentages.
 *
 * <p>Skill weights from the catalog are not applied here; only question weights are.
 * The overall score is the plain mean of the per-skill percentages, so a skill assessed by
 * many questions counts as much as a skill assessed by one.
 */
@Component
public class SkillAggregator {
    private final ResponseScorer scorer;

    public SkillAggregator(ResponseScorer scorer) {
        this.scorer = scorer;
    }

    public SkillAggregation aggregate(List<QuestionResponse> responses) {
        Map<String, SkillScoreAccumulator> bySkill = new TreeMap<>();
        for (QuestionResponse qr : responses) {
            Question q = qr.question();
            if (q == null || q.skillId() == null) continue;
            Double score = effectiveScore(qr);
            if (score == null) continue;
            double max = scorer.maxScore(q);
            bySkill.computeIfAbsent(q.skillId(), k -> new SkillScoreAccumulator()).add(score, max, q.weight());
        }

        List<SkillResult> results = new ArrayList<>();
        bySkill.forEach((skillId, acc) -> {
            int percentage = acc.percentage();
            results.add(new SkillResult(skillId, percentage, SkillLevel.forPercentage(percentage), 100 - percentage));
        });

        int overall = (int) Math.round(results.stream().mapToInt(SkillResult::score).average().orElse(0.0));
        return new SkillAggregation(List.copyOf(results), overall);
    }

    public List<QuestionBreakdown> breakdown(List<QuestionResponse> responses) {
        List<QuestionBreakdown> rows = new ArrayList<>();
        for (QuestionResponse qr : responses) {
            Question q = qr.question();
            if (q == null) continue;
            Double score = effectiveScore(qr);
            double raw = score == null ? 0.0 : score;
            double max = scorer.maxScore(q);
            double weight = q.weight();
            rows.add(new QuestionBreakdown(q.id(), q.type().wireValue(), q.skillId(), weight,
                    round1(raw), max, round1(raw * weight), round1(max * weight),
                    max > 0 ? (int) Math.round(raw / max * 100) : 0,
                    qr.response() == null ? null : qr.response().correct()));
        }
        return rows;
    }

    public WeightedTotals totals(List<QuestionBreakdown> breakdown) {
        double score = breakdown.stream().mapToDouble(QuestionBreakdown::weightedScore).sum();
        double max = breakdown.stream().mapToDouble(QuestionBreakdown::weightedMaxScore).sum();
        int pct = max > 0 ? (int) Math.round(score / max * 100) : 0;
        return new WeightedTotals(round1(score), round1(max), pct);
    }

    /**
     * Stored score when present, otherwise re-scored from the raw value. Open-text answers without a grade yield null.
     */
    private Double effectiveScore(QuestionResponse qr) {
        if (qr.response() == null) return null;
        if (qr.response().score() != null) return qr.response().score();
        return scorer.score(qr.question(), qr.response().rawValue()).score();
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    static final class SkillScoreAccumulator {
        private double totalWeightedScore;
        private double totalWeightedMax;
        private int sampleCount;

        void add(double score, double maxScore, double weight) {
            totalWeightedScore += score * weight;
            totalWeightedMax += maxScore * weight;
            sampleCount++;
        }

        int percentage() {
            if (sampleCount == 0 || totalWeightedMax <= 0) return 0;
            long pct = Math.round(100.0 * totalWeightedScore / totalWeightedMax);
            return (int) Math.max(0, Math.min(100, pct));
        }
    }
}
