package com.herzen.skillgap.domain;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

public class DomainModels {
    public record Question(String id, String testId, QuestionType type, double weight, String skillId, List<McqOption> options) {
        public Question {
            options = options == null ? List.of() : List.copyOf(options);
        }
    }

    public record McqOption(String value, double score, boolean correct) {}

    public record Skill(String id, String nameAr, String nameEn, String domainId) {
        public String displayName() {
            return nameAr != null && !nameAr.isBlank() ? nameAr : nameEn;
        }

        public List<String> normalizedNames() {
            return normalizedNames(nameAr, nameEn);
        }

        public static List<String> normalizedNames(String... names) {
            return Stream.of(names)
                    .filter(n -> n != null && !n.isBlank())
                    .map(n -> n.trim().toLowerCase(Locale.ROOT))
                    .distinct()
                    .toList();
        }
    }

    public record TrainingDomain(String id, String nameAr, String nameEn) {}

    public record CourseSkillLink(String skillId, String nameAr, String nameEn, double relevanceScore) {}

    public record Course(String id,
                         String nameAr,
                         String nameEn,
                         String descriptionAr,
                         String descriptionEn,
                         String subject,
                         String difficultyLevel,
                         List<CourseSkillLink> skillLinks,
                         List<String> extractedSkills) {
        public Course {
            skillLinks = skillLinks == null ? List.of() : List.copyOf(skillLinks);
            extractedSkills = extractedSkills == null ? List.of() : List.copyOf(extractedSkills);
        }

        public String displayName() {
            return nameAr != null && !nameAr.isBlank() ? nameAr : nameEn;
        }
    }

    public enum QuestionType {
        MCQ, LIKERT_SCALE, SELF_RATING, OPEN_TEXT;

        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static QuestionType fromWire(String value) {
            if (value == null) return null;
            for (QuestionType t : values()) {
                if (t.wireValue().equalsIgnoreCase(value.trim())) return t;
            }
            return null;
        }
    }

    public enum AssignmentStatus { IN_PROGRESS, COMPLETED }
}
