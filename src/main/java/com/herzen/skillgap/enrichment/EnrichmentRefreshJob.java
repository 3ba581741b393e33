package com.herzen.skillgap.enrichment;

import com.herzen.skillgap.config.SkillGapProperties;
import com.herzen.skillgap.repository.CatalogJdbcRepository;
import com.herzen.skillgap.repository.EnrichmentJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Enriches a small batch of not-yet-enriched courses on every run.
 */
@Component
public class EnrichmentRefreshJob {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentRefreshJob.class);

    private final CourseEnrichmentService enrichmentService;
    private final TextAnalysisClient client;
    private final EnrichmentJdbcRepository enrichmentRepository;
    private final CatalogJdbcRepository catalogRepository;
    private final int batchSize;

    public EnrichmentRefreshJob(CourseEnrichmentService enrichmentService,
                                TextAnalysisClient client,
                                EnrichmentJdbcRepository enrichmentRepository,
                                CatalogJdbcRepository catalogRepository,
                                SkillGapProperties properties) {
        this.enrichmentService = enrichmentService;
        this.client = client;
        this.enrichmentRepository = enrichmentRepository;
        this.catalogRepository = catalogRepository;
        this.batchSize = properties.enrichment().refreshBatchSize();
    }

    @Scheduled(initialDelayString = "${skillgap.enrichment.refresh-delay-ms:3600000}",
            fixedDelayString = "${skillgap.enrichment.refresh-delay-ms:3600000}")
    public int refreshPending() {
        if (!client.available()) return 0;
        List<String> pending = enrichmentRepository.courseIdsWithoutEnrichment(batchSize);
        int enriched = 0;
        for (String courseId : pending) {
            var course = catalogRepository.loadCourse(courseId);
            if (course.isPresent() && !enrichmentService.refresh(course.get()).isEmpty()) {
                enriched++;
            }
        }
        if (!pending.isEmpty()) {
            log.info("Enrichment refresh: {} of {} pending courses enriched", enriched, pending.size());
        }
        return enriched;
    }
}
