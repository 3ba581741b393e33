package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.recommendation.RecommendationModels.ExamContext;
import com.herzen.skillgap.recommendation.RecommendationModels.RecommendationReason;
import com.herzen.skillgap.recommendation.RecommendationModels.Section;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bilingual explanation attached to every recommendation.
 */
@Component
public class ReasonComposer {
    static final int MAX_LISTED_SKILLS = 3;

    public RecommendationReason compose(Section section,
                                        ExamContext exam,
                                        ProficiencyCategory category,
                                        List<String> matchingSkills,
                                        String courseDifficulty) {
        List<String> skills = matchingSkills == null ? List.of() : matchingSkills;
        StringBuilder ar = new StringBuilder();
        StringBuilder en = new StringBuilder();

        if (section == Section.INTEREST_BASED) {
            ar.append("تم التوصية بهذه الدورة بناءً على اهتماماتك");
            en.append("Recommended based on your interests");
        } else if (section == Section.CAREER_BASED) {
            ar.append("تم التوصية بهذه الدورة بناءً على مجالاتك المهنية المرغوبة");
            en.append("Recommended for your desired career domains");
        } else {
            ar.append("تم التوصية بهذه الدورة بناءً على نتائج اختبار \"").append(exam == null ? "" : nullToEmpty(exam.examNameAr())).append('"');
            en.append("Recommended based on test results from \"").append(exam == null ? "" : nullToEmpty(exam.examNameEn())).append('"');
        }

        if (!skills.isEmpty()) {
            List<String> top = skills.subList(0, Math.min(MAX_LISTED_SKILLS, skills.size()));
            ar.append(" لتطوير مهارات: ").append(String.join("، ", top));
            en.append(" to develop skills: ").append(String.join(", ", top));
        }

        String difficulty = TextSimilarity.normalize(courseDifficulty);
        if (category != null && !difficulty.isEmpty() && difficulty.equals(category.recommendedDifficulty())) {
            ar.append(". مستوى الدورة (").append(category.labelAr()).append(") مناسب لمستواك");
            en.append(". Course difficulty (").append(difficulty).append(") matches your level");
        }

        return new RecommendationReason(
                ar.toString(),
                en.toString(),
                exam == null ? null : exam.examId(),
                exam == null ? null : exam.examNameAr(),
                exam == null ? null : exam.examNameEn(),
                category == null ? null : category.key(),
                List.copyOf(skills));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
