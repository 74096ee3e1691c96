package dev.candidateeval.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import dev.candidateeval.error.ProfileParseException;
import dev.candidateeval.model.JobRequirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Normalizes a job requirement document. Accepts both the canonical field names and the ones
 * emitted by the job-description generator ({@code job_title}, {@code qualifications}, ...).
 */
@Slf4j
@Service
public class RequirementIngestionService {

    public JobRequirement parseRequirement(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new ProfileParseException("Requirement document is not a JSON object");
        }
        String title = JsonFields.text(document, "title", "job_title", "position");
        if (title == null) {
            throw new ProfileParseException("Job requirement has no title");
        }

        Integer minYears = JsonFields.number(document, "min_experience_years", "experience_years",
                        "years_of_experience", "experience")
                .map(years -> (int) Math.max(0, Math.floor(years)))
                .orElse(null);

        JobRequirement requirement = JobRequirement.builder()
                .title(title)
                .requiredSkills(JsonFields.textList(document, "required_skills", "qualifications", "requirements"))
                .preferredSkills(JsonFields.textList(document, "preferred_skills", "preferred_qualifications"))
                .minExperienceYears(minYears)
                .educationRequirements(educationRequirements(document))
                .build();

        log.debug("Parsed requirement '{}': {} required, {} preferred skills",
                title, requirement.requiredSkills().size(), requirement.preferredSkills().size());
        return requirement;
    }

    private String educationRequirements(JsonNode document) {
        JsonNode value = document.has("education_requirements")
                ? document.get("education_requirements")
                : document.get("education");
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isValueNode()) {
            return JsonFields.isPlaceholder(value.asText()) ? null : value.asText().trim();
        }
        List<String> items = JsonFields.textList(value);
        return items.isEmpty() ? null : String.join("; ", items);
    }
}
