package com.herzen.skillgap.config;

import com.herzen.skillgap.recommendation.ScoringPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "skillgap")
public record SkillGapProperties(Recommendation recommendation, Enrichment enrichment, Graph graph) {
    public SkillGapProperties {
        recommendation = recommendation == null ? new Recommendation(null, 0) : recommendation;
        enrichment = enrichment == null ? new Enrichment(null, null, null, 0, 0, 0) : enrichment;
        graph = graph == null ? new Graph(null, null, null, null, 0) : graph;
    }

    public record Recommendation(ScoringPolicy scoringPolicy, int sectionLimit) {
        public Recommendation {
            scoringPolicy = scoringPolicy == null ? ScoringPolicy.SKILL_BASED_ONLY : scoringPolicy;
            sectionLimit = sectionLimit <= 0 ? 10 : sectionLimit;
        }
    }

    /**
     * Language-model enrichment. A blank {@code apiKey} disables the outbound call.
     */
    public record Enrichment(String apiUrl, String apiKey, String model, long timeoutMs, long refreshDelayMs, int refreshBatchSize) {
        public Enrichment {
            apiUrl = apiUrl == null || apiUrl.isBlank() ? "https://api.openai.com/v1/chat/completions" : apiUrl;
            model = model == null || model.isBlank() ? "gpt-4o-mini" : model;
            timeoutMs = timeoutMs <= 0 ? 15000 : timeoutMs;
            refreshDelayMs = refreshDelayMs <= 0 ? 3600000 : refreshDelayMs;
            refreshBatchSize = refreshBatchSize <= 0 ? 5 : refreshBatchSize;
        }

        public boolean enabled() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    /**
     * Course graph service. A blank {@code baseUrl} disables the career graph channel.
     */
    public record Graph(String baseUrl, String tokenUrl, String clientId, String clientSecret, long timeoutMs) {
        public Graph {
            timeoutMs = timeoutMs <= 0 ? 10000 : timeoutMs;
        }

        public boolean enabled() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}
