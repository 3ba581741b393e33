package com.herzen.skillgap.assessment;

import com.herzen.skillgap.assessment.AssessmentModels.AnalysisRecord;
import com.herzen.skillgap.assessment.AssessmentModels.AssessmentResult;
import com.herzen.skillgap.assessment.AssessmentModels.AssignmentRecord;
import com.herzen.skillgap.assessment.AssessmentModels.AssignmentStartResponse;
import com.herzen.skillgap.assessment.AssessmentModels.QuestionBreakdown;
import com.herzen.skillgap.assessment.AssessmentModels.QuestionResponse;
import com.herzen.skillgap.assessment.AssessmentModels.ResponseRecord;
import com.herzen.skillgap.assessment.AssessmentModels.ScoredResponse;
import com.herzen.skillgap.assessment.AssessmentModels.SkillAggregation;
import com.herzen.skillgap.assessment.AssessmentModels.SkillLevel;
import com.herzen.skillgap.assessment.AssessmentModels.SkillResult;
import com.herzen.skillgap.domain.DomainModels.AssignmentStatus;
import com.herzen.skillgap.domain.DomainModels.Question;
import com.herzen.skillgap.domain.DomainModels.QuestionType;
import com.herzen.skillgap.domain.InvalidStateException;
import com.herzen.skillgap.domain.NotFoundException;
import com.herzen.skillgap.profile.GapPrioritizer;
import com.herzen.skillgap.profile.ProficiencyCategorizer;
import com.herzen.skillgap.repository.AssessmentJdbcRepository;
import com.herzen.skillgap.repository.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class AssessmentService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final AssessmentJdbcRepository repository;
    private final CatalogJdbcRepository catalogRepository;
    private final ResponseScorer scorer;
    private final SkillAggregator aggregator;
    private final ProficiencyCategorizer categorizer;
    private final GapPrioritizer prioritizer;

    public AssessmentService(AssessmentJdbcRepository repository,
                             CatalogJdbcRepository catalogRepository,
                             ResponseScorer scorer,
                             SkillAggregator aggregator,
                             ProficiencyCategorizer categorizer,
                             GapPrioritizer prioritizer) {
        this.repository = repository;
        this.catalogRepository = catalogRepository;
        this.scorer = scorer;
        this.aggregator = aggregator;
        this.categorizer = categorizer;
        this.prioritizer = prioritizer;
    }

    public AssignmentStartResponse startAssignment(String userId, String testId) {
        List<Question> questions = repository.loadQuestions(testId);
        if (questions.isEmpty()) {
            throw new NotFoundException("Test not found or has no questions: " + testId);
        }
        String assignmentId = UUID.randomUUID().toString();
        repository.createAssignment(assignmentId, userId, testId);
        log.debug("Assignment {} started for user {} on test {}", assignmentId, userId, testId);
        return new AssignmentStartResponse(assignmentId, testId, questions.stream().map(Question::id).toList());
    }

    /**
     * Stores an answer, scored at save time. Answering the same question again replaces the earlier answer.
     */
    public ResponseRecord saveResponse(String assignmentId, String questionId, String rawValue) {
        AssignmentRecord assignment = requireAssignment(assignmentId);
        if (!isStatus(assignment, AssignmentStatus.IN_PROGRESS)) {
            throw new InvalidStateException("Assignment " + assignmentId + " is not in progress");
        }
        Question question = repository.loadQuestion(questionId)
                .filter(q -> q.testId().equals(assignment.testId()))
                .orElseThrow(() -> new NotFoundException("Question " + questionId + " is not part of test " + assignment.testId()));

        ScoredResponse scored = scorer.score(question, rawValue);
        ResponseRecord record = new ResponseRecord(assignmentId, questionId, rawValue, scored.score(), scored.correct());
        repository.saveResponse(record);
        return record;
    }

    /**
     * Manual grade of an open-text answer. A grade arriving after submission refreshes the stored analysis.
     */
    @Transactional
    public ResponseRecord gradeOpenText(String assignmentId, String questionId, double score, double percentage) {
        AssignmentRecord assignment = requireAssignment(assignmentId);
        ResponseRecord existing = repository.loadResponse(assignmentId, questionId)
                .orElseThrow(() -> new NotFoundException("No response to question " + questionId + " in assignment " + assignmentId));
        Question question = repository.loadQuestion(questionId)
                .orElseThrow(() -> new NotFoundException("Question not found: " + questionId));
        if (question.type() != QuestionType.OPEN_TEXT) {
            throw new InvalidStateException("Only open_text answers are graded manually, question " + questionId + " is " + question.type().wireValue());
        }

        ScoredResponse graded = scorer.grade(score, percentage);
        ResponseRecord record = new ResponseRecord(assignmentId, questionId, existing.rawValue(), graded.score(), graded.correct());
        repository.saveResponse(record);

        if (isStatus(assignment, AssignmentStatus.COMPLETED)) {
            analyze(assignment);
        }
        return record;
    }

    @Transactional
    public AssessmentResult submit(String assignmentId) {
        AssignmentRecord assignment = requireAssignment(assignmentId);
        if (!repository.markCompleted(assignmentId)) {
            throw new InvalidStateException("Assignment " + assignmentId + " was already submitted");
        }
        AnalysisRecord analysis = analyze(assignment);
        log.info("Assignment {} submitted by {}: overall score {}", assignmentId, assignment.userId(), analysis.overallScore());
        return result(assignmentId);
    }

    public AssessmentResult result(String assignmentId) {
        AssignmentRecord assignment = requireAssignment(assignmentId);
        AnalysisRecord analysis = repository.loadAnalysis(assignmentId)
                .orElseThrow(() -> new InvalidStateException("Assignment " + assignment.id() + " has not been submitted"));

        List<SkillResult> skillResults = repository.loadSkillResults(assignmentId);
        List<QuestionResponse> responses = repository.loadQuestionResponses(assignmentId);
        List<QuestionBreakdown> breakdown = aggregator.breakdown(responses);

        return new AssessmentResult(
                assignmentId,
                analysis.userId(),
                analysis.testId(),
                analysis.overallScore(),
                categorizer.categorize(analysis.overallScore()),
                skillResults,
                skillResults.stream().filter(r -> r.level() == SkillLevel.HIGH).toList(),
                prioritizer.prioritize(skillResults, catalogRepository.loadSkills()),
                breakdown,
                aggregator.totals(breakdown),
                analysis.analyzedAt());
    }

    private AnalysisRecord analyze(AssignmentRecord assignment) {
        SkillAggregation aggregation = aggregator.aggregate(repository.loadQuestionResponses(assignment.id()));
        repository.replaceSkillResults(assignment.id(), aggregation.skillResults());
        AnalysisRecord analysis = new AnalysisRecord(assignment.id(), assignment.userId(), assignment.testId(),
                aggregation.overallScore(), Instant.now());
        repository.saveAnalysis(analysis);
        return analysis;
    }

    private AssignmentRecord requireAssignment(String assignmentId) {
        return repository.loadAssignment(assignmentId)
                .orElseThrow(() -> new NotFoundException("Assignment not found: " + assignmentId));
    }

    private static boolean isStatus(AssignmentRecord assignment, AssignmentStatus status) {
        return status.name().toLowerCase(Locale.ROOT).equals(assignment.status());
    }
}
