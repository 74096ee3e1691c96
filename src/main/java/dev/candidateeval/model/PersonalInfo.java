package dev.candidateeval.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Identifying contact block of a candidate profile.
 * Name is always present; at least one of email/phone is present once ingestion succeeded.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PersonalInfo(
        String name,
        String email,
        String phone,
        String location) {
}
