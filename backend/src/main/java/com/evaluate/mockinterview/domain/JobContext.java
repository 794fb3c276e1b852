package com.evaluate.mockinterview.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What the interview is for: the job posting plus requirements extracted from it.
 */
@Value
@Builder(toBuilder = true)
public class JobContext {
    String title;
    String description;
    @Singular
    List<String> keySkills;
    @Builder.Default
    Difficulty experienceLevel = Difficulty.INTERMEDIATE;
    @Singular
    List<String> responsibilities;
    @Singular
    List<String> preferredQualifications;

    public boolean isSkillHeavy() {
        return keySkills.size() > 3;
    }
}
