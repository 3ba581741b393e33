package com.herzen.skillgap.api;

import com.herzen.skillgap.recommendation.RecommendationModels;
import com.herzen.skillgap.recommendation.RecommendationService;
import com.herzen.skillgap.recommendation.RecommendationStatusService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
    private final RecommendationService recommendationService;
    private final RecommendationStatusService statusService;

    public RecommendationController(RecommendationService recommendationService, RecommendationStatusService statusService) {
        this.recommendationService = recommendationService;
        this.statusService = statusService;
    }

    @GetMapping
    public ResponseEntity<RecommendationModels.SectionedRecommendations> recommend(@RequestParam String userId,
                                                                                   @RequestParam(required = false) String assignmentId) {
        return ResponseEntity.ok(recommendationService.recommend(userId, assignmentId));
    }

    @PatchMapping("/status")
    public ResponseEntity<RecommendationModels.StatusEntry> updateStatus(@RequestBody StatusRequest request) {
        return ResponseEntity.ok(statusService.updateStatus(request.userId(), request.courseId(), request.status()));
    }

    @GetMapping("/status")
    public ResponseEntity<List<RecommendationModels.StatusEntry>> statuses(@RequestParam String userId) {
        return ResponseEntity.ok(statusService.statuses(userId));
    }

    public record StatusRequest(String userId, String courseId, String status) {}
}
