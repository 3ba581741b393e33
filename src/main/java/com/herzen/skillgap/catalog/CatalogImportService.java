package com.herzen.skillgap.catalog;

import com.herzen.skillgap.catalog.CatalogModels.CatalogIssue;
import com.herzen.skillgap.catalog.CatalogModels.CourseIn;
import com.herzen.skillgap.catalog.CatalogModels.CourseSkillIn;
import com.herzen.skillgap.catalog.CatalogModels.DomainIn;
import com.herzen.skillgap.catalog.CatalogModels.ImportReport;
import com.herzen.skillgap.catalog.CatalogModels.LearnerProfileIn;
import com.herzen.skillgap.catalog.CatalogModels.SkillIn;
import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.domain.DomainModels.CourseSkillLink;
import com.herzen.skillgap.domain.DomainModels.Skill;
import com.herzen.skillgap.domain.DomainModels.TrainingDomain;
import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.profile.ProfileModels.LearnerPreferences;
import com.herzen.skillgap.repository.CatalogJdbcRepository;
import com.herzen.skillgap.repository.LearnerProfileJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates catalog payloads at the boundary. Invalid rows are reported and skipped, valid rows upserted.
 */
@Service
public class CatalogImportService {
    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final CatalogJdbcRepository repository;
    private final LearnerProfileJdbcRepository profileRepository;

    public CatalogImportService(CatalogJdbcRepository repository, LearnerProfileJdbcRepository profileRepository) {
        this.repository = repository;
        this.profileRepository = profileRepository;
    }

    @Transactional
    public ImportReport importDomains(List<DomainIn> domains) {
        List<CatalogIssue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int accepted = 0;
        for (DomainIn d : nullSafe(domains)) {
            String id = d == null ? null : trimToNull(d.id());
            if (!checkId(id, seen, "domain", issues)) continue;
            if (trimToNull(d.nameAr()) == null && trimToNull(d.nameEn()) == null) {
                issues.add(new CatalogIssue("MISSING_NAME", "Domain has neither Arabic nor English name", id));
                continue;
            }
            repository.upsertDomain(new TrainingDomain(id, trimToNull(d.nameAr()), trimToNull(d.nameEn())));
            accepted++;
        }
        return report("domains", accepted, issues);
    }

    @Transactional
    public ImportReport importSkills(List<SkillIn> skills) {
        List<CatalogIssue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int accepted = 0;
        for (SkillIn s : nullSafe(skills)) {
            String id = s == null ? null : trimToNull(s.id());
            if (!checkId(id, seen, "skill", issues)) continue;
            if (trimToNull(s.nameAr()) == null && trimToNull(s.nameEn()) == null) {
                issues.add(new CatalogIssue("MISSING_NAME", "Skill has neither Arabic nor English name", id));
                continue;
            }
            repository.upsertSkill(new Skill(id, trimToNull(s.nameAr()), trimToNull(s.nameEn()), trimToNull(s.domainId())));
            accepted++;
        }
        return report("skills", accepted, issues);
    }

    @Transactional
    public ImportReport importCourses(List<CourseIn> courses) {
        List<CatalogIssue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Map<String, Skill> skills = repository.loadSkills();
        int accepted = 0;
        for (CourseIn c : nullSafe(courses)) {
            String id = c == null ? null : trimToNull(c.id());
            if (!checkId(id, seen, "course", issues)) continue;
            if (trimToNull(c.nameAr()) == null && trimToNull(c.nameEn()) == null) {
                issues.add(new CatalogIssue("MISSING_NAME", "Course has neither Arabic nor English name", id));
                continue;
            }
            repository.upsertCourse(new Course(
                    id,
                    trimToNull(c.nameAr()),
                    trimToNull(c.nameEn()),
                    trimToNull(c.descriptionAr()),
                    trimToNull(c.descriptionEn()),
                    trimToNull(c.subject()),
                    difficulty(id, c.difficultyLevel(), issues),
                    links(id, c.skills(), skills, issues),
                    nullSafe(c.extractedSkills()).stream().map(CatalogImportService::trimToNull).filter(Objects::nonNull).distinct().toList()));
            accepted++;
        }
        return report("courses", accepted, issues);
    }

    /**
     * Replaces the allow-list of courses shown to learners. Ids that are not in the catalog are reported and ignored.
     */
    @Transactional
    public ImportReport replaceVisibleCourses(List<String> courseIds) {
        List<CatalogIssue> issues = new ArrayList<>();
        Set<String> known = new HashSet<>();
        repository.loadCourses().forEach(c -> known.add(c.id()));
        Set<String> visible = new LinkedHashSet<>();
        for (String raw : nullSafe(courseIds)) {
            String id = trimToNull(raw);
            if (id == null) continue;
            if (!known.contains(id)) {
                issues.add(new CatalogIssue("UNKNOWN_COURSE", "Course is not in the catalog", id));
                continue;
            }
            visible.add(id);
        }
        repository.replaceVisibleCourses(visible);
        return report("visible courses", visible.size(), issues);
    }

    @Transactional
    public LearnerPreferences updateLearnerProfile(String userId, LearnerProfileIn profile) {
        if (trimToNull(userId) == null) {
            throw new IllegalArgumentException("userId is required");
        }
        List<String> interests = profile == null ? List.of() : nullSafe(profile.interests()).stream()
                .map(CatalogImportService::trimToNull).filter(Objects::nonNull).distinct().toList();
        Set<String> domains = new LinkedHashSet<>();
        if (profile != null) {
            nullSafe(profile.desiredDomainIds()).stream().map(CatalogImportService::trimToNull).filter(Objects::nonNull).forEach(domains::add);
        }
        LearnerPreferences preferences = new LearnerPreferences(userId, interests, domains);
        profileRepository.replacePreferences(preferences);
        return preferences;
    }

    private String difficulty(String courseId, String raw, List<CatalogIssue> issues) {
        String value = trimToNull(raw);
        if (value == null) return null;
        if (ProficiencyCategory.difficultyRank(value) >= 0) return value.toLowerCase(Locale.ROOT);
        issues.add(new CatalogIssue("UNKNOWN_DIFFICULTY", "Difficulty '" + value + "' is not recognised; course kept without level filtering", courseId));
        return value;
    }

    private List<CourseSkillLink> links(String courseId, List<CourseSkillIn> raw, Map<String, Skill> skills, List<CatalogIssue> issues) {
        List<CourseSkillLink> links = new ArrayList<>();
        Set<String> linked = new HashSet<>();
        for (CourseSkillIn in : nullSafe(raw)) {
            String skillId = in == null ? null : trimToNull(in.skillId());
            if (skillId == null) {
                issues.add(new CatalogIssue("MISSING_SKILL_ID", "Course skill link without skill id skipped", courseId));
                continue;
            }
            Skill skill = skills.get(skillId);
            if (skill == null) {
                issues.add(new CatalogIssue("UNKNOWN_SKILL", "Course links unknown skill " + skillId, courseId));
                continue;
            }
            if (!linked.add(skillId)) continue;
            links.add(new CourseSkillLink(skillId, skill.nameAr(), skill.nameEn(), relevance(courseId, in.relevance(), issues)));
        }
        return links;
    }

    private double relevance(String courseId, Object raw, List<CatalogIssue> issues) {
        if (raw == null) return 1.0;
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else {
            try {
                value = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                issues.add(new CatalogIssue("INVALID_RELEVANCE", "Relevance '" + raw + "' is not a number, using 1", courseId));
                return 1.0;
            }
        }
        if (Double.isNaN(value) || value < 0) {
            issues.add(new CatalogIssue("INVALID_RELEVANCE", "Relevance must be >= 0, using 1", courseId));
            return 1.0;
        }
        return value;
    }

    private boolean checkId(String id, Set<String> seen, String kind, List<CatalogIssue> issues) {
        if (id == null) {
            issues.add(new CatalogIssue("MISSING_ID", "A " + kind + " without id was skipped", null));
            return false;
        }
        if (!seen.add(id)) {
            issues.add(new CatalogIssue("DUPLICATE_ID", "Duplicate " + kind + " id in payload", id));
            return false;
        }
        return true;
    }

    private ImportReport report(String what, int accepted, List<CatalogIssue> issues) {
        if (issues.isEmpty()) {
            log.info("Imported {} {}", accepted, what);
        } else {
            log.info("Imported {} {} with {} issues", accepted, what, issues.size());
            issues.forEach(i -> log.debug("{} [{}]: {}", i.code(), i.ref(), i.message()));
        }
        return new ImportReport(accepted, List.copyOf(issues));
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static String trimToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
