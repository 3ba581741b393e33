package com.herzen.skillgap;

import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.recommendation.ReasonComposer;
import com.herzen.skillgap.recommendation.RecommendationModels.ExamContext;
import com.herzen.skillgap.recommendation.RecommendationModels.RecommendationReason;
import com.herzen.skillgap.recommendation.RecommendationModels.Section;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReasonComposerTest {
    private final ReasonComposer composer = new ReasonComposer();
    private final ExamContext exam = new ExamContext("t-1", "اختبار المالية", "Finance Test", Instant.parse("2026-01-10T10:00:00Z"));

    @Test
    void gapReasonNamesExamTopSkillsAndMatchingLevel() {
        RecommendationReason reason = composer.compose(Section.GAP_BASED, exam, ProficiencyCategory.INTERMEDIATE,
                List.of("Budgeting", "Forecasting", "Reporting", "Auditing"), "intermediate");

        assertEquals("Recommended based on test results from \"Finance Test\" to develop skills: Budgeting, Forecasting, Reporting"
                + ". Course difficulty (intermediate) matches your level", reason.reasonEn());
        assertEquals("تم التوصية بهذه الدورة بناءً على نتائج اختبار \"اختبار المالية\" لتطوير مهارات: Budgeting، Forecasting، Reporting"
                + ". مستوى الدورة (متوسط) مناسب لمستواك", reason.reasonAr());
        assertEquals("t-1", reason.examId());
        assertEquals("intermediate", reason.categoryKey());
        assertEquals(4, reason.matchingSkills().size());
    }

    @Test
    void lowerDifficultyAndNoSkillsKeepOnlyTheLeadSentence() {
        RecommendationReason reason = composer.compose(Section.GAP_BASED, exam, ProficiencyCategory.ADVANCED, List.of(), "beginner");

        assertEquals("Recommended based on test results from \"Finance Test\"", reason.reasonEn());
        assertFalse(reason.reasonAr().contains("مستوى الدورة"));
    }

    @Test
    void interestAndCareerSectionsExplainTheirSource() {
        assertTrue(composer.compose(Section.INTEREST_BASED, null, ProficiencyCategory.BEGINNER, List.of("Python"), null)
                .reasonEn().startsWith("Recommended based on your interests to develop skills: Python"));
        RecommendationReason career = composer.compose(Section.CAREER_BASED, exam, ProficiencyCategory.BEGINNER, List.of(), "beginner");
        assertEquals("Recommended for your desired career domains. Course difficulty (beginner) matches your level", career.reasonEn());
    }
}
