package com.herzen.skillgap;

import com.herzen.skillgap.assessment.AssessmentModels.QuestionIn;
import com.herzen.skillgap.assessment.AssessmentService;
import com.herzen.skillgap.assessment.QuestionBankService;
import com.herzen.skillgap.catalog.CatalogImportService;
import com.herzen.skillgap.catalog.CatalogModels.CourseIn;
import com.herzen.skillgap.catalog.CatalogModels.CourseSkillIn;
import com.herzen.skillgap.catalog.CatalogModels.DomainIn;
import com.herzen.skillgap.catalog.CatalogModels.LearnerProfileIn;
import com.herzen.skillgap.catalog.CatalogModels.SkillIn;
import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.domain.InvalidStateException;
import com.herzen.skillgap.domain.NotFoundException;
import com.herzen.skillgap.enrichment.TextAnalysisClient;
import com.herzen.skillgap.graph.CourseGraphClient;
import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.recommendation.RecommendationModels.Recommendation;
import com.herzen.skillgap.recommendation.RecommendationModels.RecommendationStatus;
import com.herzen.skillgap.recommendation.RecommendationModels.ScoreBreakdown;
import com.herzen.skillgap.recommendation.RecommendationModels.SectionedRecommendations;
import com.herzen.skillgap.recommendation.RecommendationModels.StatusEntry;
import com.herzen.skillgap.recommendation.RecommendationService;
import com.herzen.skillgap.recommendation.RecommendationStatusService;
import com.herzen.skillgap.recommendation.ScoringPolicy;
import com.herzen.skillgap.repository.CatalogJdbcRepository;
import com.herzen.skillgap.repository.EnrichmentJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.web.client.ResourceAccessException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
class RecommendationServiceTest {
    private static final String MODEL_ANSWER = """
            Sure, here is the analysis:
            {"extracted_skills":["budget planning"],
             "learning_outcomes":["Apply budgeting to a household plan","Read a balance sheet"],
             "career_paths":["Financial analyst","Controller"],
             "target_audience":{"level":"Intermediate"},
             "quality_indicators":{"overall_score":5,"content_clarity":4,"practical_applicability":3}}
            """;

    @Autowired
    private RecommendationService recommendationService;
    @Autowired
    private RecommendationStatusService statusService;
    @Autowired
    private CatalogImportService catalogImportService;
    @Autowired
    private QuestionBankService questionBankService;
    @Autowired
    private AssessmentService assessmentService;
    @Autowired
    private EnrichmentJdbcRepository enrichmentRepository;
    @SpyBean
    private CatalogJdbcRepository catalogRepository;

    @MockBean
    private CourseGraphClient graphClient;
    @MockBean
    private TextAnalysisClient textAnalysisClient;

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * A learner weak in budgeting (20), medium in spreadsheets (50), strong in speaking (90): overall 53, intermediate.
     * Courses: c1 links budgeting, c2 mentions spreadsheets in free text, c3 is too advanced, c4 is about Python,
     * c5 is hidden, c6 only comes back from the course graph.
     */
    private Fixture fixture() {
        String p = unique("rec");
        Fixture f = new Fixture(p);
        catalogImportService.importDomains(List.of(new DomainIn(f.domain, null, "Finance " + p)));
        catalogImportService.importSkills(List.of(
                new SkillIn(f.budget, null, "Budgeting", f.domain),
                new SkillIn(f.excel, null, "Spreadsheet Modelling", null),
                new SkillIn(f.speak, null, "Public Speaking", null)));
        catalogImportService.importCourses(List.of(
                new CourseIn(f.c1, null, "Budget Planning", null, null, null, "intermediate", List.of(new CourseSkillIn(f.budget, 1.0)), null),
                new CourseIn(f.c2, null, "Excel Workshop", null, null, null, "beginner", null, List.of("spreadsheet modelling basics")),
                new CourseIn(f.c3, null, "Corporate Finance", null, null, null, "advanced", List.of(new CourseSkillIn(f.budget, 1.0)), null),
                new CourseIn(f.c4, null, "Python Fundamentals", null, null, null, "beginner", null, null),
                new CourseIn(f.c5, null, "Hidden Budgets", null, null, null, "beginner", List.of(new CourseSkillIn(f.budget, 1.0)), null),
                new CourseIn(f.c6, null, "Treasury Operations", null, null, null, "beginner", null, null)));
        catalogImportService.replaceVisibleCourses(List.of(f.c1, f.c2, f.c3, f.c4, f.c6));
        catalogImportService.updateLearnerProfile(f.user, new LearnerProfileIn(List.of("Python"), List.of(f.domain)));

        questionBankService.registerTest(f.test, "اختبار الميزانية", "Budget Test", List.of(
                new QuestionIn(p + "-q1", "self_rating", 1.0, f.budget, null),
                new QuestionIn(p + "-q2", "self_rating", 1.0, f.excel, null),
                new QuestionIn(p + "-q3", "self_rating", 1.0, f.speak, null)));
        String assignmentId = assessmentService.startAssignment(f.user, f.test).assignmentId();
        assessmentService.saveResponse(assignmentId, p + "-q1", "2");
        assessmentService.saveResponse(assignmentId, p + "-q2", "5");
        assessmentService.saveResponse(assignmentId, p + "-q3", "9");
        assessmentService.submit(assignmentId);
        f.assignmentId = assignmentId;
        return f;
    }

    private static List<String> ids(List<Recommendation> recommendations) {
        return recommendations.stream().map(Recommendation::courseId).toList();
    }

    @Test
    void buildsThreeDisjointSectionsFromGapsInterestsAndCareerDomains() {
        Fixture f = fixture();
        when(graphClient.available()).thenReturn(true);
        when(graphClient.coursesForDomains(anyList(), anyInt())).thenReturn(List.of(f.c6, "course-not-in-catalog"));

        SectionedRecommendations result = recommendationService.recommend(f.user, null, ScoringPolicy.SKILL_BASED_ONLY);

        assertEquals(f.assignmentId, result.assignmentId());
        assertEquals(ProficiencyCategory.INTERMEDIATE, result.category());
        assertEquals(List.of(f.c1, f.c2), ids(result.gapBased()));
        assertEquals(List.of(f.c4), ids(result.interestBased()));
        assertEquals(List.of(f.c6), ids(result.careerBased()));

        Recommendation top = result.gapBased().get(0);
        assertEquals(45.0, top.recommendationScore());
        assertEquals("catalog", top.source());
        assertEquals(List.of("Budgeting"), top.matchingSkills());
        assertEquals("Recommended based on test results from \"Budget Test\" to develop skills: Budgeting. "
                + "Course difficulty (intermediate) matches your level", top.reason().reasonEn());
        assertEquals(33.0, result.gapBased().get(1).recommendationScore());

        assertEquals("graph", result.careerBased().get(0).source());
        verify(graphClient).coursesForDomains(eq(List.of("Finance " + f.p)), anyInt());

        Set<String> all = new HashSet<>();
        Stream.of(result.gapBased(), result.interestBased(), result.careerBased())
                .flatMap(List::stream)
                .forEach(r -> assertTrue(all.add(r.courseId()), "course listed twice: " + r.courseId()));
    }

    @Test
    void emptyAllowListHidesEverything() {
        Fixture f = fixture();
        catalogImportService.replaceVisibleCourses(List.of());

        SectionedRecommendations result = recommendationService.recommend(f.user, f.assignmentId);

        assertTrue(result.gapBased().isEmpty());
        assertTrue(result.interestBased().isEmpty());
        assertTrue(result.careerBased().isEmpty());
    }

    @Test
    void graphFailureFallsBackToCatalogCareerMatches() {
        String p = unique("career");
        String user = "user-" + p;
        catalogImportService.importDomains(List.of(new DomainIn(p + "-dom", "الأمن", "Security")));
        catalogImportService.importSkills(List.of(new SkillIn(p + "-s", null, "Threat Modelling", p + "-dom")));
        catalogImportService.importCourses(List.of(
                new CourseIn(p + "-basic", null, "Intro to Security", null, null, null, "beginner", List.of(new CourseSkillIn(p + "-s", 1)), null),
                new CourseIn(p + "-adv", null, "Red Teaming", null, null, null, "advanced", List.of(new CourseSkillIn(p + "-s", 1)), null)));
        catalogImportService.replaceVisibleCourses(List.of(p + "-basic", p + "-adv"));
        catalogImportService.updateLearnerProfile(user, new LearnerProfileIn(null, List.of(p + "-dom")));
        when(graphClient.available()).thenReturn(true);
        when(graphClient.coursesForDomains(anyList(), anyInt())).thenThrow(new ResourceAccessException("connection refused"));

        SectionedRecommendations result = recommendationService.recommend(user, null);

        assertNull(result.assignmentId());
        assertEquals(ProficiencyCategory.BEGINNER, result.category());
        assertTrue(result.gapBased().isEmpty());
        assertEquals(List.of(p + "-basic"), ids(result.careerBased()));
        Recommendation career = result.careerBased().get(0);
        assertEquals("catalog", career.source());
        assertEquals("Recommended for your desired career domains to develop skills: Threat Modelling. "
                + "Course difficulty (beginner) matches your level", career.reason().reasonEn());
    }

    @Test
    void enrichedPolicyUsesCourseMetadata() {
        Fixture f = fixture();
        when(textAnalysisClient.available()).thenReturn(true);
        when(textAnalysisClient.analyzeCourse(any())).thenReturn(MODEL_ANSWER);

        SectionedRecommendations result = recommendationService.recommend(f.user, f.assignmentId, ScoringPolicy.ENRICHED_FIVE_FACTOR);

        assertEquals(ScoringPolicy.ENRICHED_FIVE_FACTOR, result.scoringPolicy());
        Recommendation c1 = result.gapBased().stream().filter(r -> r.courseId().equals(f.c1)).findFirst().orElseThrow();
        ScoreBreakdown breakdown = c1.scoreBreakdown();
        assertEquals(80.0, breakdown.quality());
        assertEquals(90.0, breakdown.careerRelevance());
        assertEquals(80.0, breakdown.learningOutcomes());
        // 0.4*50 + 0.2*100 + 0.2*80 + 0.1*80 + 0.1*90
        assertEquals(73.0, c1.recommendationScore());
        verify(textAnalysisClient, atLeastOnce()).analyzeCourse(any());
        verify(textAnalysisClient, never()).analyzeCourse(argThat((Course c) -> c.id().equals(f.c5)));
    }

    @Test
    void overlongModelSkillsAreShortenedBeforeStorage() {
        String p = unique("long");
        String user = "user-" + p;
        catalogImportService.importCourses(List.of(new CourseIn(p, null, "Budgeting Basics", null, null, null, "beginner", null, null)));
        catalogImportService.replaceVisibleCourses(List.of(p));
        catalogImportService.updateLearnerProfile(user, new LearnerProfileIn(List.of("Budgeting"), null));
        when(textAnalysisClient.available()).thenReturn(true);
        when(textAnalysisClient.analyzeCourse(any()))
                .thenReturn("{\"extracted_skills\":[\"" + "budgeting ".repeat(60) + "\"]}");

        SectionedRecommendations result = recommendationService.recommend(user, null, ScoringPolicy.ENRICHED_FIVE_FACTOR);

        assertEquals(List.of(p), ids(result.interestBased()));
        List<String> stored = catalogRepository.loadCourse(p).orElseThrow().extractedSkills();
        assertEquals(1, stored.size());
        assertTrue(stored.get(0).length() <= 500);
        assertTrue(enrichmentRepository.loadPayload(p).isPresent());
    }

    @Test
    void failedEnrichmentWriteKeepsRecommendationsAndRollsBack() {
        Fixture f = fixture();
        when(textAnalysisClient.available()).thenReturn(true);
        when(textAnalysisClient.analyzeCourse(any())).thenReturn(MODEL_ANSWER);
        doThrow(new DataIntegrityViolationException("value too long"))
                .when(catalogRepository).replaceExtractedSkills(eq(f.c1), anyList());

        SectionedRecommendations result = recommendationService.recommend(f.user, f.assignmentId, ScoringPolicy.ENRICHED_FIVE_FACTOR);

        Recommendation c1 = result.gapBased().stream().filter(r -> r.courseId().equals(f.c1)).findFirst().orElseThrow();
        assertEquals(80.0, c1.scoreBreakdown().quality());
        assertTrue(enrichmentRepository.loadPayload(f.c1).isEmpty());
        assertTrue(enrichmentRepository.loadPayload(f.c2).isPresent());
    }

    @Test
    void foreignAssignmentIsNotFound() {
        Fixture f = fixture();

        assertThrows(NotFoundException.class, () -> recommendationService.recommend("someone-else", f.assignmentId));
        assertThrows(NotFoundException.class, () -> recommendationService.recommend(f.user, unique("missing")));
    }

    @Test
    void statusesAreTrackedPerLearner() {
        String p = unique("status");
        catalogImportService.importCourses(List.of(new CourseIn(p, null, "Tracked", null, null, null, null, null, null)));

        statusService.updateStatus("user-" + p, p, "enrolled");
        StatusEntry completed = statusService.updateStatus("user-" + p, p, "COMPLETED");

        assertEquals(RecommendationStatus.COMPLETED, completed.status());
        List<StatusEntry> statuses = statusService.statuses("user-" + p);
        assertEquals(1, statuses.size());
        assertEquals(RecommendationStatus.COMPLETED, statuses.get(0).status());
        assertTrue(statusService.statuses("nobody-" + p).isEmpty());

        assertThrows(InvalidStateException.class, () -> statusService.updateStatus("user-" + p, p, "finished"));
        assertThrows(NotFoundException.class, () -> statusService.updateStatus("user-" + p, p + "-ghost", "enrolled"));
    }

    private static final class Fixture {
        final String p;
        final String user;
        final String domain;
        final String budget;
        final String excel;
        final String speak;
        final String test;
        final String c1;
        final String c2;
        final String c3;
        final String c4;
        final String c5;
        final String c6;
        String assignmentId;

        Fixture(String p) {
            this.p = p;
            this.user = "user-" + p;
            this.domain = p + "-dom";
            this.budget = p + "-budget";
            this.excel = p + "-excel";
            this.speak = p + "-speak";
            this.test = p + "-test";
            this.c1 = p + "-c1";
            this.c2 = p + "-c2";
            this.c3 = p + "-c3";
            this.c4 = p + "-c4";
            this.c5 = p + "-c5";
            this.c6 = p + "-c6";
        }
    }
}
