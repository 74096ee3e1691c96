package dev.candidateeval.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import dev.candidateeval.error.ProfileParseException;
import dev.candidateeval.model.CandidateProfile;
import dev.candidateeval.model.Certification;
import dev.candidateeval.model.Education;
import dev.candidateeval.model.Experience;
import dev.candidateeval.model.PersonalInfo;
import dev.candidateeval.model.Project;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates a parsed-resume document and normalizes it into a {@link CandidateProfile}.
 */
@Slf4j
@Service
public class ProfileIngestionService {

    /**
     * Parse a profile document.
     *
     * @param document the parsed-resume JSON produced upstream
     * @return the normalized profile
     * @throws ProfileParseException when the candidate has no name or no contact
     */
    public CandidateProfile parseProfile(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new ProfileParseException("Profile document is not a JSON object");
        }

        PersonalInfo personalInfo = parsePersonalInfo(document);

        CandidateProfile profile = CandidateProfile.builder()
                .personalInfo(personalInfo)
                .summary(JsonFields.text(document, "summary", "professional_summary"))
                .education(JsonFields.objects(document, "education").stream()
                        .filter(JsonNode::isObject)
                        .map(this::parseEducation)
                        .toList())
                .experience(JsonFields.objects(document, "experience", "work_experience").stream()
                        .filter(JsonNode::isObject)
                        .map(this::parseExperience)
                        .toList())
                .skills(JsonFields.textList(document, "skills"))
                .projects(JsonFields.objects(document, "projects").stream()
                        .filter(JsonNode::isObject)
                        .map(this::parseProject)
                        .filter(project -> project.name() != null)
                        .toList())
                .certifications(parseCertifications(document))
                .build();

        log.debug("Parsed profile for '{}': {} education, {} experience, {} skills",
                personalInfo.name(), profile.education().size(), profile.experience().size(),
                profile.skills().size());
        return profile;
    }

    private PersonalInfo parsePersonalInfo(JsonNode document) {
        JsonNode info = document.has("personal_info") ? document.get("personal_info") : document;
        String name = JsonFields.text(info, "name", "full_name");
        if (name == null) {
            throw new ProfileParseException("Profile has no candidate name");
        }
        String email = JsonFields.text(info, "email");
        String phone = JsonFields.text(info, "phone", "phone_number");
        if (email == null && phone == null) {
            throw new ProfileParseException("Profile for '" + name + "' has neither email nor phone");
        }
        return new PersonalInfo(name, email, phone, JsonFields.text(info, "location", "address"));
    }

    private Education parseEducation(JsonNode node) {
        String graduation = JsonFields.text(node, "graduation_date", "graduation_year", "date", "year");
        Double gpa = JsonFields.number(node, "gpa").orElse(null);
        return new Education(
                JsonFields.text(node, "degree"),
                JsonFields.text(node, "institution", "school", "university"),
                JsonFields.text(node, "field", "field_of_study", "major"),
                DateNormalizer.normalize(graduation).orElse(null),
                gpa);
    }

    private Experience parseExperience(JsonNode node) {
        String rawStart = JsonFields.text(node, "start_date");
        String rawEnd = JsonFields.text(node, "end_date");
        String duration = JsonFields.text(node, "duration", "dates", "period");

        String start = DateNormalizer.normalize(rawStart).orElse(null);
        String end = DateNormalizer.normalize(rawEnd).orElse(null);
        boolean current = DateNormalizer.isOngoing(rawEnd) || node.path("current").asBoolean(false);
        String unparsed = null;

        if (start == null && end == null && duration != null) {
            Optional<DateNormalizer.DateRange> range = DateNormalizer.splitDuration(duration);
            if (range.isPresent()) {
                start = range.get().start();
                end = range.get().end();
                current = current || range.get().current();
            } else {
                unparsed = duration;
            }
        } else if (start == null && rawStart != null) {
            unparsed = rawEnd != null ? rawStart + " - " + rawEnd : rawStart;
        }

        List<String> description = new ArrayList<>(JsonFields.textList(node, "description"));
        description.addAll(JsonFields.textList(node, "responsibilities"));
        description.addAll(JsonFields.textList(node, "achievements"));

        return Experience.builder()
                .title(JsonFields.text(node, "title", "position", "role"))
                .company(JsonFields.text(node, "company", "employer", "organization"))
                .location(JsonFields.text(node, "location"))
                .startDate(start)
                .endDate(current ? null : end)
                .current(current)
                .unparsedDuration(unparsed)
                .description(description)
                .build();
    }

    private Project parseProject(JsonNode node) {
        return new Project(
                JsonFields.text(node, "name", "title"),
                JsonFields.text(node, "description"),
                JsonFields.textList(node, "technologies", "tech_stack"),
                JsonFields.text(node, "url", "link"));
    }

    private List<Certification> parseCertifications(JsonNode document) {
        List<Certification> certifications = new ArrayList<>();
        for (JsonNode node : JsonFields.objects(document, "certifications")) {
            if (node.isObject()) {
                String name = JsonFields.text(node, "name", "title");
                if (name != null) {
                    String date = JsonFields.text(node, "date", "issued");
                    certifications.add(new Certification(name, JsonFields.text(node, "issuer", "organization"),
                            DateNormalizer.normalize(date).orElse(null)));
                }
            } else if (node.isValueNode() && !JsonFields.isPlaceholder(node.asText())) {
                certifications.add(new Certification(node.asText().trim(), null, null));
            }
        }
        return certifications;
    }
}
