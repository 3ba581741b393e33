package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.domain.InvalidStateException;
import com.herzen.skillgap.domain.NotFoundException;
import com.herzen.skillgap.recommendation.RecommendationModels.RecommendationStatus;
import com.herzen.skillgap.recommendation.RecommendationModels.StatusEntry;
import com.herzen.skillgap.repository.CatalogJdbcRepository;
import com.herzen.skillgap.repository.RecommendationJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class RecommendationStatusService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationStatusService.class);

    private final RecommendationJdbcRepository repository;
    private final CatalogJdbcRepository catalogRepository;

    public RecommendationStatusService(RecommendationJdbcRepository repository, CatalogJdbcRepository catalogRepository) {
        this.repository = repository;
        this.catalogRepository = catalogRepository;
    }

    public StatusEntry updateStatus(String userId, String courseId, String status) {
        RecommendationStatus parsed = RecommendationStatus.fromKey(status);
        if (parsed == null) {
            throw new InvalidStateException("Unknown recommendation status: " + status);
        }
        if (catalogRepository.loadCourse(courseId).isEmpty()) {
            throw new NotFoundException("Course not found: " + courseId);
        }
        repository.saveStatus(userId, courseId, parsed.key());
        log.debug("User {} marked course {} as {}", userId, courseId, parsed.key());
        return new StatusEntry(userId, courseId, parsed, Instant.now());
    }

    public List<StatusEntry> statuses(String userId) {
        return repository.loadStatuses(userId).stream()
                .map(r -> new StatusEntry(r.userId(), r.courseId(), RecommendationStatus.fromKey(r.status()), r.updatedAt()))
                .toList();
    }
}
