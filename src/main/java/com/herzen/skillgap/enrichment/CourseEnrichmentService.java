package com.herzen.skillgap.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.skillgap.config.SkillGapProperties;
import com.herzen.skillgap.domain.DomainModels.Course;
import com.herzen.skillgap.enrichment.EnrichmentModels.CourseEnrichment;
import com.herzen.skillgap.enrichment.EnrichmentModels.QualityIndicators;
import com.herzen.skillgap.profile.ProficiencyCategory;
import com.herzen.skillgap.repository.CatalogJdbcRepository;
import com.herzen.skillgap.repository.EnrichmentJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Course enrichment with a database cache in front of the language model. Every failure, including
 * a timeout, degrades to {@link CourseEnrichment#empty()}.
 */
@Service
public class CourseEnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(CourseEnrichmentService.class);

    static final int MAX_SKILLS = 15;
    static final int MAX_ITEMS = 5;
    // course_extracted_skills.skill_text width
    static final int MAX_TEXT_LENGTH = 500;

    private final TextAnalysisClient client;
    private final EnrichmentJdbcRepository repository;
    private final CatalogJdbcRepository catalogRepository;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final TransactionTemplate txTemplate;
    private final long timeoutMs;

    public CourseEnrichmentService(TextAnalysisClient client,
                                   EnrichmentJdbcRepository repository,
                                   CatalogJdbcRepository catalogRepository,
                                   ObjectMapper objectMapper,
                                   @Qualifier("enrichmentExecutor") ExecutorService executor,
                                   PlatformTransactionManager txManager,
                                   SkillGapProperties properties) {
        this.client = client;
        this.repository = repository;
        this.catalogRepository = catalogRepository;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.txTemplate = new TransactionTemplate(txManager);
        this.timeoutMs = properties.enrichment().timeoutMs();
    }

    public CourseEnrichment enrichmentFor(Course course) {
        Optional<CourseEnrichment> cached = cached(course.id());
        if (cached.isPresent()) return cached.get();
        if (!client.available()) return CourseEnrichment.empty();
        return refresh(course);
    }

    /**
     * Calls the model, stores a successful result and returns it. Courses without extracted skills
     * receive the model's ones so the free-text matching channel can use them.
     */
    public CourseEnrichment refresh(Course course) {
        String raw;
        try {
            raw = CompletableFuture.supplyAsync(() -> client.analyzeCourse(course), executor)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException | RejectedExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Enrichment unavailable for course {}: {}", course.id(), cause.toString());
            return CourseEnrichment.empty();
        }

        CourseEnrichment enrichment = parseModelAnswer(raw);
        if (enrichment.isEmpty()) {
            log.warn("Enrichment for course {} could not be read", course.id());
            return enrichment;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(enrichment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize enrichment of course " + course.id(), e);
        }
        try {
            txTemplate.executeWithoutResult(status -> {
                repository.savePayload(course.id(), payload);
                if (course.extractedSkills().stream().allMatch(String::isBlank) && !enrichment.extractedSkills().isEmpty()) {
                    catalogRepository.replaceExtractedSkills(course.id(), enrichment.extractedSkills());
                }
            });
        } catch (DataAccessException e) {
            log.warn("Enrichment of course {} not stored: {}", course.id(), e.getMostSpecificCause().toString());
            return enrichment;
        }
        log.debug("Course {} enriched: {} skills, {} outcomes", course.id(),
                enrichment.extractedSkills().size(), enrichment.learningOutcomes().size());
        return enrichment;
    }

    private Optional<CourseEnrichment> cached(String courseId) {
        return repository.loadPayload(courseId).flatMap(payload -> {
            try {
                return Optional.of(objectMapper.readValue(payload, CourseEnrichment.class));
            } catch (JsonProcessingException e) {
                log.warn("Stored enrichment of course {} is unreadable, ignoring it: {}", courseId, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    /**
     * Reads the model's answer. Text around the JSON object is tolerated; unreadable answers yield empty.
     */
    CourseEnrichment parseModelAnswer(String raw) {
        JsonNode root = readObject(raw);
        if (root == null) return CourseEnrichment.empty();

        JsonNode quality = root.path("quality_indicators");
        QualityIndicators indicators = quality.isObject()
                ? new QualityIndicators(
                        indicator(quality.path("overall_score")),
                        indicator(quality.path("content_clarity")),
                        indicator(quality.path("practical_applicability")))
                : null;

        String level = root.path("target_audience").path("level").asText("").trim().toLowerCase(Locale.ROOT);
        return new CourseEnrichment(
                strings(root.path("extracted_skills"), MAX_SKILLS),
                strings(root.path("learning_outcomes"), MAX_ITEMS),
                strings(root.path("career_paths"), MAX_ITEMS),
                ProficiencyCategory.difficultyRank(level) >= 0 ? level : null,
                indicators);
    }

    private JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String text = raw.trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Model answer is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static List<String> strings(JsonNode array, int limit) {
        if (!array.isArray()) return List.of();
        Set<String> values = new LinkedHashSet<>();
        for (JsonNode item : array) {
            JsonNode value = item.isObject() ? item.path(item.has("skill") ? "skill" : "name") : item;
            String text = value.isValueNode() ? value.asText().trim() : "";
            if (text.length() > MAX_TEXT_LENGTH) text = text.substring(0, MAX_TEXT_LENGTH).trim();
            if (!text.isEmpty() && !"null".equals(text)) values.add(text);
            if (values.size() >= limit) break;
        }
        return new ArrayList<>(values);
    }

    private static int indicator(JsonNode node) {
        int value = node.isNumber() ? node.asInt() : parseOr(node.asText(""), 3);
        return Math.max(1, Math.min(5, value == 0 ? 3 : value));
    }

    private static int parseOr(String text, int fallback) {
        try {
            return (int) Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
