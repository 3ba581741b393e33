package com.herzen.skillgap.api;

import com.herzen.skillgap.catalog.CatalogImportService;
import com.herzen.skillgap.catalog.CatalogModels;
import com.herzen.skillgap.profile.ProfileModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final CatalogImportService importService;

    public CatalogController(CatalogImportService importService) {
        this.importService = importService;
    }

    @PostMapping("/domains")
    public ResponseEntity<CatalogModels.ImportReport> importDomains(@RequestBody List<CatalogModels.DomainIn> domains) {
        return ResponseEntity.ok(importService.importDomains(domains));
    }

    @PostMapping("/skills")
    public ResponseEntity<CatalogModels.ImportReport> importSkills(@RequestBody List<CatalogModels.SkillIn> skills) {
        return ResponseEntity.ok(importService.importSkills(skills));
    }

    @PostMapping("/courses")
    public ResponseEntity<CatalogModels.ImportReport> importCourses(@RequestBody List<CatalogModels.CourseIn> courses) {
        return ResponseEntity.ok(importService.importCourses(courses));
    }

    @PutMapping("/visible-courses")
    public ResponseEntity<CatalogModels.ImportReport> visibleCourses(@RequestBody List<String> courseIds) {
        return ResponseEntity.ok(importService.replaceVisibleCourses(courseIds));
    }

    @PutMapping("/learners/{userId}/profile")
    public ResponseEntity<ProfileModels.LearnerPreferences> learnerProfile(@PathVariable String userId,
                                                                         @RequestBody CatalogModels.LearnerProfileIn profile) {
        return ResponseEntity.ok(importService.updateLearnerProfile(userId, profile));
    }
}
