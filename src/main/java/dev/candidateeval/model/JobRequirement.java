package dev.candidateeval.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * Requirement set of the job a candidate is evaluated against.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRequirement(
        String title,
        List<String> requiredSkills,
        List<String> preferredSkills,
        Integer minExperienceYears,
        String educationRequirements) {

    public JobRequirement {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        preferredSkills = preferredSkills == null ? List.of() : List.copyOf(preferredSkills);
    }
}
