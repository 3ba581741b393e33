package com.herzen.skillgap.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.skillgap.config.SkillGapProperties;
import com.herzen.skillgap.domain.DomainModels.Course;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

@Component
public class OpenAiTextAnalysisClient implements TextAnalysisClient {
    private static final String SYSTEM_PROMPT =
            "You are a course analysis expert. Extract structured metadata from course information. Return ONLY valid JSON.";

    private final RestTemplate restTemplate;
    private final SkillGapProperties.Enrichment properties;

    public OpenAiTextAnalysisClient(@Qualifier("enrichmentRestTemplate") RestTemplate restTemplate, SkillGapProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties.enrichment();
    }

    @Override
    public boolean available() {
        return properties.enabled();
    }

    @Override
    public String analyzeCourse(Course course) {
        if (!available()) {
            throw new IllegalStateException("Enrichment API key is not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.apiKey());

        Map<String, Object> body = Map.of(
                "model", properties.model(),
                "temperature", 0.3,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt(course))));

        JsonNode response = restTemplate.postForObject(properties.apiUrl(), new HttpEntity<>(body, headers), JsonNode.class);
        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull()) {
            throw new IllegalStateException("Enrichment response has no message content");
        }
        return content.asText();
    }

    static String prompt(Course course) {
        return """
                Analyze this course and extract metadata that improves course recommendations.

                COURSE INFORMATION:
                - Name (Arabic): %s
                - Name (English): %s
                - Description (Arabic): %s
                - Description (English): %s
                - Subject/Category: %s
                - Current Difficulty: %s

                Return a JSON object with this structure, using null where information cannot be determined:
                {
                  "extracted_skills": ["up to 15 specific skills taught"],
                  "learning_outcomes": ["up to 5 outcomes"],
                  "career_paths": ["up to 5 roles this course prepares for"],
                  "target_audience": {"level": "beginner|intermediate|advanced"},
                  "quality_indicators": {"overall_score": 1-5, "content_clarity": 1-5, "practical_applicability": 1-5}
                }
                """.formatted(
                orNa(course.nameAr()), orNa(course.nameEn()), orNa(course.descriptionAr()),
                orNa(course.descriptionEn()), orNa(course.subject()), orNa(course.difficultyLevel()));
    }

    private static String orNa(String s) {
        return s == null || s.isBlank() ? "N/A" : s;
    }
}
