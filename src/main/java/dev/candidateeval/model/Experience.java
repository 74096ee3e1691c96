package dev.candidateeval.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * One position held by the candidate.
 * Dates use YYYY-MM or YYYY granularity; a free-text duration that could not be split into
 * dates is kept verbatim in {@code unparsedDuration}.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Experience(
        String title,
        String company,
        String location,
        String startDate,
        String endDate,
        boolean current,
        String unparsedDuration,
        List<String> description) {

    public Experience {
        description = description == null ? List.of() : List.copyOf(description);
    }
}
