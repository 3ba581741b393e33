package com.herzen.skillgap;

import com.herzen.skillgap.profile.ProficiencyCategorizer;
import com.herzen.skillgap.profile.ProficiencyCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProficiencyCategorizerTest {
    private final ProficiencyCategorizer categorizer = new ProficiencyCategorizer();

    @Test
    void bandsFollowThresholds() {
        assertEquals(ProficiencyCategory.BEGINNER, categorizer.categorize(0));
        assertEquals(ProficiencyCategory.BEGINNER, categorizer.categorize(39));
        assertEquals(ProficiencyCategory.INTERMEDIATE, categorizer.categorize(40));
        assertEquals(ProficiencyCategory.INTERMEDIATE, categorizer.categorize(69));
        assertEquals(ProficiencyCategory.ADVANCED, categorizer.categorize(70));
        assertEquals(ProficiencyCategory.ADVANCED, categorizer.categorize(100));
        assertEquals(ProficiencyCategory.BEGINNER, categorizer.categorize(Double.NaN));
    }

    @Test
    void categoryCarriesDifficultyCeiling() {
        assertEquals("intermediate", ProficiencyCategory.INTERMEDIATE.recommendedDifficulty());
        assertEquals(List.of("advanced", "intermediate", "beginner"), ProficiencyCategory.ADVANCED.allowedDifficulties());
        assertEquals(List.of("beginner"), ProficiencyCategory.BEGINNER.allowedDifficulties());
        assertEquals("متوسط", ProficiencyCategory.INTERMEDIATE.labelAr());
        assertEquals(-1, ProficiencyCategory.difficultyRank("expert"));
        assertEquals(2, ProficiencyCategory.difficultyRank(" Advanced "));
    }

    @Test
    void gapIsCategorizedByRemainingProficiency() {
        assertEquals(ProficiencyCategory.BEGINNER, categorizer.categorizeGap(70));
        assertEquals(ProficiencyCategory.INTERMEDIATE, categorizer.categorizeGap(45));
        assertEquals(ProficiencyCategory.ADVANCED, categorizer.categorizeGap(10));
    }
}
