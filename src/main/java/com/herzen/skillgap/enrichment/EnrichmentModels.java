package com.herzen.skillgap.enrichment;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public class EnrichmentModels {
    /**
     * Language-model metadata for one course. {@link #empty()} stands for "nothing known".
     */
    public record CourseEnrichment(List<String> extractedSkills,
                                   List<String> learningOutcomes,
                                   List<String> careerPaths,
                                   String targetLevel,
                                   QualityIndicators quality) {
        public CourseEnrichment {
            extractedSkills = extractedSkills == null ? List.of() : List.copyOf(extractedSkills);
            learningOutcomes = learningOutcomes == null ? List.of() : List.copyOf(learningOutcomes);
            careerPaths = careerPaths == null ? List.of() : List.copyOf(careerPaths);
        }

        public static CourseEnrichment empty() {
            return new CourseEnrichment(List.of(), List.of(), List.of(), null, null);
        }

        @JsonIgnore
        public boolean isEmpty() {
            return extractedSkills.isEmpty() && learningOutcomes.isEmpty() && careerPaths.isEmpty()
                    && targetLevel == null && quality == null;
        }
    }

    /** Indicators on a 1-5 scale. */
    public record QualityIndicators(int overall, int clarity, int practicalApplicability) {
        @JsonIgnore
        public double mean() {
            return (overall + clarity + practicalApplicability) / 3.0;
        }
    }
}
