package com.herzen.skillgap.profile;

import java.util.List;
import java.util.Locale;

/**
 * Proficiency bands over the 0-100 overall score. Each band allows its own difficulty and everything below it.
 */
public enum ProficiencyCategory {
    BEGINNER(0, 39, "مبتدئ", "Beginner", List.of("beginner")),
    INTERMEDIATE(40, 69, "متوسط", "Intermediate", List.of("intermediate", "beginner")),
    ADVANCED(70, 100, "متقدم", "Advanced", List.of("advanced", "intermediate", "beginner"));

    private final int min;
    private final int max;
    private final String labelAr;
    private final String labelEn;
    private final List<String> allowedDifficulties;

    ProficiencyCategory(int min, int max, String labelAr, String labelEn, List<String> allowedDifficulties) {
        this.min = min;
        this.max = max;
        this.labelAr = labelAr;
        this.labelEn = labelEn;
        this.allowedDifficulties = allowedDifficulties;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String recommendedDifficulty() {
        return key();
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public String labelAr() {
        return labelAr;
    }

    public String labelEn() {
        return labelEn;
    }

    /** Ordered from this level downwards. */
    public List<String> allowedDifficulties() {
        return allowedDifficulties;
    }

    /**
     * Difficulty rank of a course level string: 0 beginner, 1 intermediate, 2 advanced, -1 when unrecognised.
     */
    public static int difficultyRank(String difficulty) {
        if (difficulty == null) return -1;
        return switch (difficulty.trim().toLowerCase(Locale.ROOT)) {
            case "beginner" -> 0;
            case "intermediate" -> 1;
            case "advanced" -> 2;
            default -> -1;
        };
    }

    public int rank() {
        return ordinal();
    }
}
