package com.herzen.skillgap.profile;

import com.herzen.skillgap.domain.DomainModels.Skill;

import java.util.List;
import java.util.Set;

public class ProfileModels {
    /**
     * An open skill gap. Priority 1 is a low-level skill, 2 a medium one, 3 a synthetic target built
     * from learner interests or desired domains.
     */
    public record Gap(String skillId, String nameAr, String nameEn, int gapScore, int priority) {
        public String displayName() {
            return nameAr != null && !nameAr.isBlank() ? nameAr : nameEn;
        }

        public List<String> normalizedNames() {
            return Skill.normalizedNames(nameAr, nameEn);
        }
    }

    public record LearnerPreferences(String userId, List<String> interests, Set<String> desiredDomainIds) {}
}
