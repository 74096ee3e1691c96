package dev.candidateeval.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Education(
        String degree,
        String institution,
        String field,
        String graduationDate, // YYYY-MM or YYYY, null when unknown
        Double gpa) {
}
