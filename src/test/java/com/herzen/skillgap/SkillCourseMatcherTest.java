package com.herzen.skillgap;

import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.domain.DomainModels.CourseSkillLink;
import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.profile.ProfileModels.Gap;
import com.herzen.skillgap.recommendation.RecommendationModels.MatchInfo;
import com.herzen.skillgap.recommendation.SkillCourseMatcher;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SkillCourseMatcherTest {
    private final SkillCourseMatcher matcher = new SkillCourseMatcher();

    private final Gap analysis = new Gap("A", "تحليل البيانات", "Data Analysis", 80, 1);
    private final Gap writing = new Gap("B", null, "Technical Writing", 50, 2);

    private Course course(String id, String difficulty, List<CourseSkillLink> links, List<String> extracted) {
        return new Course(id, null, "Course " + id, null, null, null, difficulty, links, extracted);
    }

    @Test
    void catalogLinkMatchesByIdOrByName() {
        Course byId = course("c-id", "beginner", List.of(new CourseSkillLink("A", null, null, 0.8)), List.of());
        Course byName = course("c-name", "beginner", List.of(new CourseSkillLink("OTHER", null, " data analysis ", 0.5)), List.of());

        Map<String, MatchInfo> result = matcher.match(List.of(analysis), List.of(byId, byName), ProficiencyCategory.BEGINNER);

        assertEquals(0.8, result.get("c-id").relevanceSum(), 1e-9);
        assertEquals(List.of("تحليل البيانات"), result.get("c-id").linkMatches());
        assertEquals(0.5, result.get("c-name").relevanceSum(), 1e-9);
        assertEquals(1, result.get("c-name").skillCoverage());
    }

    @Test
    void freeTextChannelUsesTokenOverlapOrContainment() {
        Course overlap = course("c1", null, List.of(), List.of("technical report writing"));
        Course contained = course("c2", null, List.of(), List.of("writing"));
        Course unrelated = course("c3", null, List.of(), List.of("public speaking"));

        Map<String, MatchInfo> result = matcher.match(List.of(writing), List.of(overlap, contained, unrelated), ProficiencyCategory.BEGINNER);

        // {technical, writing} vs {technical, report, writing}: 2/3 > 0.5
        assertTrue(result.containsKey("c1"));
        assertEquals(1, result.get("c1").aiMatchCount());
        assertTrue(result.containsKey("c2"));
        assertFalse(result.containsKey("c3"));
    }

    @Test
    void nameChannelOnlyForCoursesWithoutSkillData() {
        Course bare = new Course("bare", null, "Intro to Data Analysis", null, null, null, null, List.of(), List.of());
        Course tagged = new Course("tagged", null, "Intro to Data Analysis", null, null, null, null, List.of(), List.of("cooking"));

        Map<String, MatchInfo> result = matcher.match(List.of(analysis), List.of(bare, tagged), ProficiencyCategory.BEGINNER);

        assertEquals(List.of("تحليل البيانات"), result.get("bare").nameMatches());
        assertEquals(0, result.get("bare").aiMatchCount());
        assertFalse(result.containsKey("tagged"));
    }

    @Test
    void coursesAboveLearnerLevelAreDropped() {
        List<CourseSkillLink> links = List.of(new CourseSkillLink("A", null, null, 1.0));
        List<Course> courses = List.of(
                course("beg", "beginner", links, List.of()),
                course("int", "Intermediate", links, List.of()),
                course("adv", "advanced", links, List.of()),
                course("odd", "expert", links, List.of()));

        Map<String, MatchInfo> result = matcher.match(List.of(analysis), courses, ProficiencyCategory.INTERMEDIATE);

        assertEquals(List.of("beg", "int", "odd"), List.copyOf(result.keySet()));
    }

    @Test
    void channelsAreUnionedPerCourse() {
        Course both = course("both", null,
                List.of(new CourseSkillLink("A", null, null, 1.0)),
                List.of("technical writing", "advanced technical writing"));

        MatchInfo info = matcher.match(List.of(analysis, writing), List.of(both), ProficiencyCategory.ADVANCED).get("both");

        assertEquals(2, info.skillCoverage());
        assertEquals(List.of("تحليل البيانات", "Technical Writing"), info.matchingSkills());
        assertEquals(2, info.aiMatchCount());
        assertEquals(80.0, info.gapWeightedRelevance(), 1e-9);
    }

    @Test
    void nothingMatchesWithoutGaps() {
        assertTrue(matcher.match(List.of(), List.of(course("c", null, List.of(), List.of("x"))), ProficiencyCategory.BEGINNER).isEmpty());
    }
}
