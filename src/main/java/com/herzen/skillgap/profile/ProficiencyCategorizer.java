package com.herzen.skillgap.profile;

import org.springframework.stereotype.Component;

@Component
public class ProficiencyCategorizer {

    public ProficiencyCategory categorize(double score) {
        double s = Double.isNaN(score) ? 0.0 : score;
        if (s >= ProficiencyCategory.ADVANCED.min()) return ProficiencyCategory.ADVANCED;
        if (s >= ProficiencyCategory.INTERMEDIATE.min()) return ProficiencyCategory.INTERMEDIATE;
        return ProficiencyCategory.BEGINNER;
    }

    /** Category of a single skill, from its proficiency {@code 100 - gap}. */
    public ProficiencyCategory categorizeGap(int gapScore) {
        return categorize(100 - gapScore);
    }
}
