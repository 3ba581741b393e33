package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.assessment.AssessmentModels.AnalysisRecord;
import com.herzen.skillgap.assessment.AssessmentModels.AssignmentRecord;
import com.herzen.skillgap.config.SkillGapProperties;
import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.domain.DomainModels.Skill;
import com.herzen.skillgap.domain.DomainModels.TrainingDomain;
import com.herzen.skillgap.domain.NotFoundException;
import com.herzen.skillgap.enrichment.CourseEnrichmentService;
import com.herzen.skillgap.enrichment.EnrichmentModels.CourseEnrichment;
import com.herzen.skillgap.graph.CourseGraphClient;
import com.herzen.skillgap.profile.GapPrioritizer;
import com.herzen.skillgap.profile.ProficiencyCategorizer;
import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.profile.ProfileModels.Gap;
import com.herzen.skillgap.profile.ProfileModels.LearnerPreferences;
import com.herzen.skillgap.recommendation.RecommendationModels.ExamContext;
import com.herzen.skillgap.recommendation.RecommendationModels.MatchInfo;
import com.herzen.skillgap.recommendation.RecommendationModels.Recommendation;
import com.herzen.skillgap.recommendation.RecommendationModels.ScoredCourse;
import com.herzen.skillgap.recommendation.RecommendationModels.Section;
import com.herzen.skillgap.recommendation.RecommendationModels.SectionedRecommendations;
import com.herzen.skillgap.repository.AssessmentJdbcRepository;
import com.herzen.skillgap.repository.CatalogJdbcRepository;
import com.herzen.skillgap.repository.LearnerProfileJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the three recommendation sections for a learner on every request. Nothing here is persisted.
 */
@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    static final int SYNTHETIC_PRIORITY = 3;
    static final int SYNTHETIC_GAP_SCORE = 50;

    private final AssessmentJdbcRepository assessmentRepository;
    private final CatalogJdbcRepository catalogRepository;
    private final LearnerProfileJdbcRepository profileRepository;
    private final ProficiencyCategorizer categorizer;
    private final GapPrioritizer prioritizer;
    private final SkillCourseMatcher matcher;
    private final RecommendationScorer scorer;
    private final RecommendationRanker ranker;
    private final ReasonComposer reasonComposer;
    private final CourseEnrichmentService enrichmentService;
    private final CourseGraphClient graphClient;
    private final SkillGapProperties.Recommendation properties;

    public RecommendationService(AssessmentJdbcRepository assessmentRepository,
                                 CatalogJdbcRepository catalogRepository,
                                 LearnerProfileJdbcRepository profileRepository,
                                 ProficiencyCategorizer categorizer,
                                 GapPrioritizer prioritizer,
                                 SkillCourseMatcher matcher,
                                 RecommendationScorer scorer,
                                 RecommendationRanker ranker,
                                 ReasonComposer reasonComposer,
                                 CourseEnrichmentService enrichmentService,
                                 CourseGraphClient graphClient,
                                 SkillGapProperties properties) {
        this.assessmentRepository = assessmentRepository;
        this.catalogRepository = catalogRepository;
        this.profileRepository = profileRepository;
        this.categorizer = categorizer;
        this.prioritizer = prioritizer;
        this.matcher = matcher;
        this.scorer = scorer;
        this.ranker = ranker;
        this.reasonComposer = reasonComposer;
        this.enrichmentService = enrichmentService;
        this.graphClient = graphClient;
        this.properties = properties.recommendation();
    }

    public SectionedRecommendations recommend(String userId, String assignmentId) {
        return recommend(userId, assignmentId, properties.scoringPolicy());
    }

    /**
     * @param assignmentId analysed assignment to use; null picks the learner's latest analysis
     */
    public SectionedRecommendations recommend(String userId, String assignmentId, ScoringPolicy policy) {
        Optional<AnalysisRecord> analysis = resolveAnalysis(userId, assignmentId);
        Map<String, Skill> skills = catalogRepository.loadSkills();

        List<Gap> gaps = analysis
                .map(a -> prioritizer.prioritize(assessmentRepository.loadSkillResults(a.assignmentId()), skills))
                .orElse(List.of());
        ProficiencyCategory category = analysis
                .map(a -> categorizer.categorize(a.overallScore()))
                .orElse(ProficiencyCategory.BEGINNER);
        ExamContext exam = analysis.flatMap(a -> assessmentRepository.loadAssignment(a.assignmentId())
                        .map(asg -> examContext(asg, a)))
                .orElse(null);

        List<Course> courses = catalogRepository.loadCourses();
        Map<String, Course> byId = courses.stream()
                .collect(Collectors.toMap(Course::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        LearnerPreferences preferences = profileRepository.loadPreferences(userId);
        Set<String> visible = catalogRepository.loadVisibleCourseIds();

        Map<Section, List<ScoredCourse>> candidates = new EnumMap<>(Section.class);
        candidates.put(Section.GAP_BASED, score(matcher.match(gaps, courses, category), gaps, category, byId, visible, policy));

        List<Gap> interestGaps = interestGaps(preferences);
        candidates.put(Section.INTEREST_BASED, score(matcher.match(interestGaps, courses, category), interestGaps, category, byId, visible, policy));

        List<TrainingDomain> domains = catalogRepository.loadDomains(preferences.desiredDomainIds());
        List<Gap> careerGaps = careerGaps(preferences, skills);
        Map<String, MatchInfo> careerMatches = new LinkedHashMap<>(matcher.match(careerGaps, courses, category));
        graphCourses(domains).stream()
                .map(byId::get)
                .filter(c -> c != null && matcher.withinLevel(c, category))
                .forEach(c -> careerMatches.putIfAbsent(c.id(), MatchInfo.graphOnly(c.id())));
        candidates.put(Section.CAREER_BASED, score(careerMatches, careerGaps, category, byId, visible, policy));

        Map<Section, List<ScoredCourse>> arranged = ranker.arrange(candidates, visible, properties.sectionLimit());

        SectionedRecommendations result = new SectionedRecommendations(
                userId,
                analysis.map(AnalysisRecord::assignmentId).orElse(null),
                category,
                policy,
                toRecommendations(arranged.get(Section.GAP_BASED), Section.GAP_BASED, exam, category),
                toRecommendations(arranged.get(Section.INTEREST_BASED), Section.INTEREST_BASED, exam, category),
                toRecommendations(arranged.get(Section.CAREER_BASED), Section.CAREER_BASED, exam, category));
        log.info("Recommendations for user {} ({}, {} gaps): {} gap-based, {} interest-based, {} career-based",
                userId, category.key(), gaps.size(),
                result.gapBased().size(), result.interestBased().size(), result.careerBased().size());
        return result;
    }

    private Optional<AnalysisRecord> resolveAnalysis(String userId, String assignmentId) {
        if (assignmentId == null || assignmentId.isBlank()) {
            return assessmentRepository.latestAnalysisForUser(userId);
        }
        AnalysisRecord analysis = assessmentRepository.loadAnalysis(assignmentId)
                .filter(a -> a.userId().equals(userId))
                .orElseThrow(() -> new NotFoundException("No analysed assignment " + assignmentId + " for user " + userId));
        return Optional.of(analysis);
    }

    /**
     * Hidden courses are skipped here so they never reach the enrichment service.
     */
    private List<ScoredCourse> score(Map<String, MatchInfo> matches,
                                     List<Gap> gaps,
                                     ProficiencyCategory category,
                                     Map<String, Course> courses,
                                     Set<String> visible,
                                     ScoringPolicy policy) {
        List<ScoredCourse> scored = new ArrayList<>();
        matches.forEach((courseId, match) -> {
            Course course = courses.get(courseId);
            if (course == null || !visible.contains(courseId)) return;
            CourseEnrichment enrichment = policy.usesEnrichment() ? enrichmentService.enrichmentFor(course) : CourseEnrichment.empty();
            scored.add(scorer.score(policy, new ScoringPolicy.Input(match, gaps, category, course, enrichment)));
        });
        return scored;
    }

    private List<Recommendation> toRecommendations(List<ScoredCourse> scored, Section section, ExamContext exam, ProficiencyCategory category) {
        return scored.stream()
                .map(s -> new Recommendation(
                        s.course().id(),
                        s.course().displayName(),
                        s.course().difficultyLevel(),
                        s.match().matchingSkills(),
                        s.score(),
                        s.breakdown(),
                        s.match().graphMatch() ? "graph" : "catalog",
                        section,
                        reasonComposer.compose(section, exam, category, s.match().matchingSkills(), s.course().difficultyLevel()),
                        s.match().skillCoverage()))
                .toList();
    }

    private List<Gap> interestGaps(LearnerPreferences preferences) {
        return preferences.interests().stream()
                .filter(i -> i != null && !i.isBlank())
                .map(i -> new Gap(null, null, i.trim(), SYNTHETIC_GAP_SCORE, SYNTHETIC_PRIORITY))
                .toList();
    }

    private List<Gap> careerGaps(LearnerPreferences preferences, Map<String, Skill> skills) {
        return skills.values().stream()
                .filter(s -> s.domainId() != null && preferences.desiredDomainIds().contains(s.domainId()))
                .map(s -> new Gap(s.id(), s.nameAr(), s.nameEn(), SYNTHETIC_GAP_SCORE, SYNTHETIC_PRIORITY))
                .sorted(GapPrioritizer.CANONICAL_ORDER)
                .toList();
    }

    private List<String> graphCourses(List<TrainingDomain> domains) {
        if (domains.isEmpty() || !graphClient.available()) return List.of();
        List<String> names = domains.stream()
                .map(d -> d.nameEn() != null && !d.nameEn().isBlank() ? d.nameEn() : d.nameAr())
                .filter(n -> n != null && !n.isBlank())
                .toList();
        try {
            return graphClient.coursesForDomains(names, properties.sectionLimit());
        } catch (RestClientException | IllegalStateException e) {
            log.warn("Course graph unavailable, career section uses the catalog only: {}", e.getMessage());
            return List.of();
        }
    }

    private static ExamContext examContext(AssignmentRecord assignment, AnalysisRecord analysis) {
        return new ExamContext(assignment.testId(), assignment.testTitleAr(), assignment.testTitleEn(), analysis.analyzedAt());
    }
}
