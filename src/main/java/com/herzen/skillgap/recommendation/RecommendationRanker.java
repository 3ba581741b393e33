package com.herzen.skillgap.recommendation;

import com.herzen.skillgap.recommendation.RecommendationModels.ScoredCourse;
import com.herzen.skillgap.recommendation.RecommendationModels.Section;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class RecommendationRanker {
    public static final Comparator<ScoredCourse> RANKING = Comparator.comparingDouble(ScoredCourse::score).reversed()
            .thenComparing(Comparator.comparingInt((ScoredCourse s) -> s.match().skillCoverage()).reversed())
            .thenComparing(s -> s.course().id());

    public List<ScoredCourse> rank(Collection<ScoredCourse> scored) {
        return scored.stream().sorted(RANKING).toList();
    }

    /**
     * Ranks every section, drops courses outside the allow-list, removes courses already shown in an
     * earlier section and cuts each section to {@code limit}. An empty allow-list shows nothing.
     */
    public Map<Section, List<ScoredCourse>> arrange(Map<Section, ? extends Collection<ScoredCourse>> sections,
                                                   Set<String> visibleCourseIds,
                                                   int limit) {
        Map<Section, List<ScoredCourse>> arranged = new EnumMap<>(Section.class);
        Set<String> shown = new HashSet<>();
        for (Section section : Section.values()) {
            List<ScoredCourse> kept = new ArrayList<>();
            Collection<ScoredCourse> candidates = sections.get(section);
            if (candidates == null) candidates = List.of();
            for (ScoredCourse candidate : rank(candidates)) {
                if (kept.size() >= limit) break;
                String id = candidate.course().id();
                if (visibleCourseIds == null || !visibleCourseIds.contains(id)) continue;
                if (!shown.add(id)) continue;
                kept.add(candidate);
            }
            arranged.put(section, List.copyOf(kept));
        }
        return arranged;
    }
}
