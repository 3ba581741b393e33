package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.domain.DomainModels.CourseSkillLink;
import com.herzen.skillgap.domain.DomainModels.Skill;
import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.profile.ProfileModels.Gap;
import com.herzen.skillgap.recommendation.RecommendationModels.MatchInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds, for every course, the gaps it addresses. Three channels are applied and their hits unioned:
 * catalog skill links, free-text extracted skills, and as a last resort containment of the gap
 * name in the course name, description or subject. The last channel only runs for courses that
 * carry neither links nor extracted skills.
 */
@Component
public class SkillCourseMatcher {

    /**
     * @return match info keyed by course id, in catalog order; courses without hits are absent
     */
    public Map<String, MatchInfo> match(List<Gap> gaps, Collection<Course> courses, ProficiencyCategory category) {
        Map<String, MatchInfo> result = new LinkedHashMap<>();
        if (gaps == null || gaps.isEmpty() || courses == null) return result;
        for (Course course : courses) {
            if (!withinLevel(course, category)) continue;
            MatchInfo info = matchCourse(gaps, course);
            if (info != null) {
                result.put(course.id(), info);
            }
        }
        return result;
    }

    /**
     * A course above the learner's category is never offered. Unknown or blank difficulty passes.
     */
    public boolean withinLevel(Course course, ProficiencyCategory category) {
        int rank = ProficiencyCategory.difficultyRank(course.difficultyLevel());
        return rank < 0 || category == null || rank <= category.rank();
    }

    static String gapKey(Gap gap) {
        return gap.skillId() != null ? gap.skillId() : "name:" + TextSimilarity.normalize(gap.displayName());
    }

    private MatchInfo matchCourse(List<Gap> gaps, Course course) {
        List<String> extracted = course.extractedSkills().stream().filter(s -> s != null && !s.isBlank()).toList();
        boolean nameChannel = course.skillLinks().isEmpty() && extracted.isEmpty();

        Set<String> gapKeys = new LinkedHashSet<>();
        Set<String> matchingSkills = new LinkedHashSet<>();
        List<String> linkMatches = new ArrayList<>();
        List<String> textMatches = new ArrayList<>();
        List<String> nameMatches = new ArrayList<>();
        Set<Integer> matchedLinks = new HashSet<>();
        Set<String> matchedExtracted = new HashSet<>();
        double gapWeightedRelevance = 0.0;

        for (Gap gap : gaps) {
            List<String> names = gap.normalizedNames();
            String label = gap.displayName();
            boolean hit = false;

            for (int i = 0; i < course.skillLinks().size(); i++) {
                CourseSkillLink link = course.skillLinks().get(i);
                if (linkMatches(gap, names, link)) {
                    matchedLinks.add(i);
                    gapWeightedRelevance += gap.gapScore() * link.relevanceScore();
                    hit = true;
                    addOnce(linkMatches, label);
                }
            }

            for (String skill : extracted) {
                if (names.stream().anyMatch(n -> TextSimilarity.similar(skill, n))) {
                    matchedExtracted.add(TextSimilarity.normalize(skill));
                    hit = true;
                    addOnce(textMatches, label);
                }
            }

            if (nameChannel && mentions(course, names)) {
                hit = true;
                addOnce(nameMatches, label);
            }

            if (hit) {
                gapKeys.add(gapKey(gap));
                if (label != null) matchingSkills.add(label);
            }
        }

        if (gapKeys.isEmpty()) return null;
        double relevanceSum = matchedLinks.stream().mapToDouble(i -> course.skillLinks().get(i).relevanceScore()).sum();
        return new MatchInfo(course.id(), new ArrayList<>(gapKeys), new ArrayList<>(matchingSkills),
                linkMatches, textMatches, nameMatches, relevanceSum, gapWeightedRelevance, matchedExtracted.size(), false);
    }

    private boolean linkMatches(Gap gap, List<String> gapNames, CourseSkillLink link) {
        if (gap.skillId() != null && gap.skillId().equals(link.skillId())) return true;
        List<String> linkNames = Skill.normalizedNames(link.nameAr(), link.nameEn());
        return linkNames.stream().anyMatch(gapNames::contains);
    }

    private boolean mentions(Course course, List<String> gapNames) {
        List<String> haystacks = Stream.of(course.nameAr(), course.nameEn(), course.descriptionAr(), course.descriptionEn(), course.subject())
                .map(TextSimilarity::normalize)
                .filter(s -> !s.isEmpty())
                .toList();
        return gapNames.stream().anyMatch(n -> haystacks.stream().anyMatch(h -> h.contains(n)));
    }

    private static void addOnce(List<String> list, String value) {
        if (value != null && !list.contains(value)) list.add(value);
    }
}
