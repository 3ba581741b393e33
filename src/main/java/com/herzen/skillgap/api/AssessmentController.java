package com.herzen.skillgap.api;

import com.herzen.skillgap.assessment.AssessmentModels;
import com.herzen.skillgap.assessment.AssessmentService;
import com.herzen.skillgap.assessment.QuestionBankService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assessment")
public class AssessmentController {
    private final QuestionBankService questionBankService;
    private final AssessmentService assessmentService;

    public AssessmentController(QuestionBankService questionBankService, AssessmentService assessmentService) {
        this.questionBankService = questionBankService;
        this.assessmentService = assessmentService;
    }

    @PostMapping("/tests")
    public ResponseEntity<AssessmentModels.TestRegistration> registerTest(@RequestBody TestRequest request) {
        return ResponseEntity.ok(questionBankService.registerTest(request.testId(), request.titleAr(), request.titleEn(), request.questions()));
    }

    @PostMapping("/assignments")
    public ResponseEntity<AssessmentModels.AssignmentStartResponse> start(@RequestBody StartRequest request) {
        return ResponseEntity.ok(assessmentService.startAssignment(request.userId(), request.testId()));
    }

    @PostMapping("/responses")
    public ResponseEntity<AssessmentModels.ResponseRecord> saveResponse(@RequestBody ResponseRequest request) {
        return ResponseEntity.ok(assessmentService.saveResponse(request.assignmentId(), request.questionId(), request.value()));
    }

    @PostMapping("/responses/grade")
    public ResponseEntity<AssessmentModels.ResponseRecord> grade(@RequestBody GradeRequest request) {
        if (request.score() == null) {
            throw new IllegalArgumentException("score is required");
        }
        double percentage = request.percentage() == null ? request.score() * 10 : request.percentage();
        return ResponseEntity.ok(assessmentService.gradeOpenText(request.assignmentId(), request.questionId(), request.score(), percentage));
    }

    @PostMapping("/assignments/{id}/submit")
    public ResponseEntity<AssessmentModels.AssessmentResult> submit(@PathVariable("id") String assignmentId) {
        return ResponseEntity.ok(assessmentService.submit(assignmentId));
    }

    @GetMapping("/assignments/{id}/result")
    public ResponseEntity<AssessmentModels.AssessmentResult> result(@PathVariable("id") String assignmentId) {
        return ResponseEntity.ok(assessmentService.result(assignmentId));
    }

    public record TestRequest(String testId, String titleAr, String titleEn, List<AssessmentModels.QuestionIn> questions) {}

    public record StartRequest(String userId, String testId) {}

    public record ResponseRequest(String assignmentId, String questionId, String value) {}

    /** {@code percentage} defaults to the score scaled to 0-100. */
    public record GradeRequest(String assignmentId, String questionId, Double score, Double percentage) {}
}
