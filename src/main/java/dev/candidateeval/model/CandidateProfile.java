package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * Parsed candidate profile. Immutable once ingestion produced it.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CandidateProfile(
        PersonalInfo personalInfo,
        String summary,
        List<Education> education,
        List<Experience> experience,
        List<String> skills,
        List<Project> projects,
        List<Certification> certifications) {

    public CandidateProfile {
        education = education == null ? List.of() : List.copyOf(education);
        experience = experience == null ? List.of() : List.copyOf(experience);
        skills = skills == null ? List.of() : List.copyOf(skills);
        projects = projects == null ? List.of() : List.copyOf(projects);
        certifications = certifications == null ? List.of() : List.copyOf(certifications);
    }

    @JsonIgnore
    public String candidateName() {
        return personalInfo != null ? personalInfo.name() : null;
    }
}
