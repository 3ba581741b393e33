package com.herzen.skillgap.catalog;

import java.util.List;

/**
 * Loosely typed catalog payloads as they arrive over HTTP. Any field may be missing.
 */
public class CatalogModels {
    public record DomainIn(String id, String nameAr, String nameEn) {}

    public record SkillIn(String id, String nameAr, String nameEn, String domainId) {}

    /**
     * @param relevance number or numeric string; missing means 1
     */
    public record CourseSkillIn(String skillId, Object relevance) {}

    public record CourseIn(String id,
                           String nameAr,
                           String nameEn,
                           String descriptionAr,
                           String descriptionEn,
                           String subject,
                           String difficultyLevel,
                           List<CourseSkillIn> skills,
                           List<String> extractedSkills) {}

    public record LearnerProfileIn(List<String> interests, List<String> desiredDomainIds) {}

    public record CatalogIssue(String code, String message, String ref) {}

    public record ImportReport(int accepted, List<CatalogIssue> issues) {}
}
