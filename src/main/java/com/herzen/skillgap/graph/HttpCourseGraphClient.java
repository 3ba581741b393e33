package com.herzen.skillgap.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.skillgap.config.SkillGapProperties;
import com.herzen.skillgap.graph.AccessTokenCache.TokenGrant;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class HttpCourseGraphClient implements CourseGraphClient {
    private final RestTemplate restTemplate;
    private final AccessTokenCache tokenCache;
    private final SkillGapProperties.Graph properties;

    public HttpCourseGraphClient(@Qualifier("graphRestTemplate") RestTemplate restTemplate,
                                 AccessTokenCache tokenCache,
                                 SkillGapProperties properties) {
        this.restTemplate = restTemplate;
        this.tokenCache = tokenCache;
        this.properties = properties.graph();
    }

    @Override
    public boolean available() {
        return properties.enabled();
    }

    @Override
    public List<String> coursesForDomains(List<String> domainNames, int limit) {
        List<String> names = domainNames == null ? List.of() : domainNames.stream()
                .filter(n -> n != null && !n.isBlank())
                .toList();
        if (names.isEmpty() || !available()) return List.of();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(tokenCache.get(tokenKey(), k -> requestToken()));
        Map<String, Object> body = Map.of("query", domainQuery(names, limit), "is_prod", false);

        JsonNode response;
        try {
            response = restTemplate.postForObject(properties.baseUrl() + "/query", new HttpEntity<>(body, headers), JsonNode.class);
        } catch (HttpClientErrorException.Unauthorized e) {
            tokenCache.invalidate(tokenKey());
            throw e;
        }
        return courseIds(response, limit);
    }

    static String domainQuery(List<String> names, int limit) {
        String conditions = names.stream()
                .map(HttpCourseGraphClient::escape)
                .map(n -> "toLower(c.course_name_en) CONTAINS toLower('" + n + "') OR toLower(c.course_name) CONTAINS toLower('" + n + "')")
                .collect(Collectors.joining(" OR "));
        return """
                MATCH (c:Course)
                WHERE %s
                OPTIONAL MATCH (c)-[:ALIGNS_TO_SKILL]->(s:Skill)
                WITH c, count(DISTINCT s) AS skill_coverage
                RETURN DISTINCT c.course_id AS course_id, skill_coverage
                ORDER BY skill_coverage DESC
                LIMIT %d
                """.formatted(conditions, Math.max(1, limit));
    }

    static List<String> courseIds(JsonNode response, int limit) {
        if (response == null) return List.of();
        JsonNode rows = response.isArray() ? response : response.path("data");
        if (!rows.isArray()) rows = response.path("records");
        if (!rows.isArray()) return List.of();
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode row : rows) {
            String id = row.path("course_id").asText("");
            if (!id.isBlank()) ids.add(id);
            if (ids.size() >= limit) break;
        }
        return new ArrayList<>(ids);
    }

    private TokenGrant requestToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(properties.clientId(), properties.clientSecret());
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");

        JsonNode token = restTemplate.postForObject(properties.tokenUrl(), new HttpEntity<>(form, headers), JsonNode.class);
        if (token == null) {
            throw new IllegalStateException("Empty response from token endpoint");
        }
        JsonNode expiresIn = token.path("expires_in");
        return new TokenGrant(token.path("access_token").asText(null), expiresIn.canConvertToLong() ? expiresIn.asLong() : null);
    }

    private String tokenKey() {
        return properties.tokenUrl() + "#" + properties.clientId();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("'", "\\'");
    }
}
