package com.herzen.skillgap;

import com.herzen.skillgap.assessment.AssessmentModels.QuestionBreakdown;
import com.herzen.skillgap.assessment.AssessmentModels.QuestionResponse;
import com.herzen.skillgap.assessment.AssessmentModels.ResponseRecord;
import com.herzen.skillgap.assessment.AssessmentModels.SkillAggregation;
import com.herzen.skillgap.assessment.AssessmentModels.SkillLevel;
import com.herzen.skillgap.assessment.AssessmentModels.SkillResult;
import com.herzen.skillgap.assessment.AssessmentModels.WeightedTotals;
import com.herzen.skillgap.assessment.ResponseScorer;
import com.herzen.skillgap.assessment.SkillAggregator;
import com.herzen.skillgap.domain.DomainModels.McqOption;
import com.herzen.skillgap.domain.DomainModels.Question;
import com.herzen.skillgap.domain.DomainModels.QuestionType;
import com.herzen.skillgap.domain.DomainModels.Skill;
import com.herzen.skillgap.profile.GapPrioritizer;
import com.herzen.skillgap.profile.ProfileModels.Gap;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SkillAggregatorTest {
    private final ResponseScorer scorer = new ResponseScorer();
    private final SkillAggregator aggregator = new SkillAggregator(scorer);

    private QuestionResponse answer(Question q, String raw) {
        var scored = scorer.score(q, raw);
        return new QuestionResponse(q, new ResponseRecord("a1", q.id(), raw, scored.score(), scored.correct()));
    }

    private Question selfRating(String id, String skill, double weight) {
        return new Question(id, "t1", QuestionType.SELF_RATING, weight, skill, List.of());
    }

    @Test
    void mcqAndLikertAtFullMarksGiveHighSkill() {
        Question mcq = new Question("q1", "t1", QuestionType.MCQ, 1.0, "S", List.of(
                new McqOption("a", 0, false), new McqOption("b", 10, true),
                new McqOption("c", 3, false), new McqOption("d", 0, false)));
        Question likert = new Question("q2", "t1", QuestionType.LIKERT_SCALE, 1.0, "S", List.of());

        SkillAggregation result = aggregator.aggregate(List.of(answer(mcq, "b"), answer(likert, "5")));

        assertEquals(1, result.skillResults().size());
        SkillResult s = result.skillResults().get(0);
        assertEquals("S", s.skillId());
        assertEquals(100, s.score());
        assertEquals(SkillLevel.HIGH, s.level());
        assertEquals(0, s.gapPercentage());
        assertEquals(100, result.overallScore());
    }

    @Test
    void lowSelfRatingBecomesPriorityOneGap() {
        SkillAggregation result = aggregator.aggregate(List.of(answer(selfRating("q1", "S", 1.0), "3")));

        SkillResult s = result.skillResults().get(0);
        assertEquals(30, s.score());
        assertEquals(SkillLevel.LOW, s.level());
        assertEquals(70, s.gapPercentage());

        List<Gap> gaps = new GapPrioritizer().prioritize(result.skillResults(), Map.of("S", new Skill("S", "تحليل", "Analysis", null)));
        assertEquals(1, gaps.size());
        assertEquals(1, gaps.get(0).priority());
        assertEquals(70, gaps.get(0).gapScore());
        assertEquals("تحليل", gaps.get(0).displayName());
    }

    @Test
    void aggregationIsIdempotentAndComplementary() {
        List<QuestionResponse> responses = List.of(
                answer(selfRating("q1", "A", 2.0), "8"),
                answer(selfRating("q2", "A", 1.0), "2"),
                answer(selfRating("q3", "B", 1.0), "5"),
                answer(new Question("q4", "t1", QuestionType.LIKERT_SCALE, 0.5, "C", List.of()), "4"));

        SkillAggregation first = aggregator.aggregate(responses);
        SkillAggregation second = aggregator.aggregate(responses);
        assertEquals(first, second);

        first.skillResults().forEach(r -> assertEquals(100, r.score() + r.gapPercentage()));
        assertEquals(List.of("A", "B", "C"), first.skillResults().stream().map(SkillResult::skillId).toList());
        // A: (16 + 2) / (20 + 10) = 60%
        assertEquals(60, first.skillResults().get(0).score());
    }

    @Test
    void raisingOneAnswerNeverLowersTheSkill() {
        Question q1 = selfRating("q1", "A", 1.0);
        Question q2 = selfRating("q2", "A", 3.0);
        int previous = -1;
        for (int v = 1; v <= 10; v++) {
            int pct = aggregator.aggregate(List.of(answer(q1, "6"), answer(q2, String.valueOf(v)))).skillResults().get(0).score();
            assertTrue(pct >= previous);
            previous = pct;
        }
    }

    @Test
    void ungradedOpenTextAndUnlinkedQuestionsAreSkipped() {
        Question open = new Question("q1", "t1", QuestionType.OPEN_TEXT, 1.0, "A", List.of());
        Question unlinked = selfRating("q2", null, 1.0);

        SkillAggregation result = aggregator.aggregate(List.of(answer(open, "essay"), answer(unlinked, "9")));
        assertTrue(result.skillResults().isEmpty());
        assertEquals(0, result.overallScore());

        QuestionResponse graded = new QuestionResponse(open, new ResponseRecord("a1", "q1", "essay", 8.0, true));
        assertEquals(80, aggregator.aggregate(List.of(graded)).skillResults().get(0).score());
    }

    @Test
    void overallScoreIsMeanOfSkillPercentages() {
        // A has three questions at 100%, B one at 20%: the mean of skills is 60 regardless of question count
        List<QuestionResponse> responses = List.of(
                answer(selfRating("q1", "A", 1.0), "10"),
                answer(selfRating("q2", "A", 1.0), "10"),
                answer(selfRating("q3", "A", 1.0), "10"),
                answer(selfRating("q4", "B", 1.0), "2"));
        assertEquals(60, aggregator.aggregate(responses).overallScore());
    }

    @Test
    void breakdownReportsWeightedScores() {
        List<QuestionResponse> responses = List.of(
                answer(selfRating("q1", "A", 2.0), "8"),
                answer(new Question("q2", "t1", QuestionType.LIKERT_SCALE, 1.0, "B", List.of()), "3"));

        List<QuestionBreakdown> rows = aggregator.breakdown(responses);
        assertEquals(2, rows.size());
        assertEquals(16.0, rows.get(0).weightedScore());
        assertEquals(20.0, rows.get(0).weightedMaxScore());
        assertEquals(80, rows.get(0).percentage());
        assertEquals("likert_scale", rows.get(1).questionType());

        WeightedTotals totals = aggregator.totals(rows);
        assertEquals(21.0, totals.totalWeightedScore());
        assertEquals(30.0, totals.totalWeightedMaxScore());
        assertEquals(70, totals.weightedPercentage());
    }
}
