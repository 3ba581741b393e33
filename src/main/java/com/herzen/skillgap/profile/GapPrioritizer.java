package com.herzen.skillgap.profile;

import com.herzen.skillgap.assessment.AssessmentModels.SkillLevel;
import com.herzen.skillgap.assessment.AssessmentModels.SkillResult;
import com.herzen.skillgap.domain.DomainModels.Skill;
import com.herzen.skillgap.profile.ProfileModels.Gap;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Component
public class GapPrioritizer {
    public static final Comparator<Gap> CANONICAL_ORDER = Comparator.comparingInt(Gap::priority)
            .thenComparing(Comparator.comparingInt(Gap::gapScore).reversed())
            .thenComparing(Gap::skillId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Gaps for every non-high skill result, in the order the matcher consumes them.
     *
     * @param skills skill catalog lookup used to attach names; unknown skills keep null names
     */
    public List<Gap> prioritize(Collection<SkillResult> results, Map<String, Skill> skills) {
        if (results == null) return List.of();
        return results.stream()
                .filter(r -> r.level() != SkillLevel.HIGH)
                .map(r -> {
                    Skill skill = skills.get(r.skillId());
                    int priority = r.level() == SkillLevel.LOW ? 1 : 2;
                    return new Gap(r.skillId(),
                            skill == null ? null : skill.nameAr(),
                            skill == null ? null : skill.nameEn(),
                            r.gapPercentage(),
                            priority);
                })
                .sorted(CANONICAL_ORDER)
                .toList();
    }
}
