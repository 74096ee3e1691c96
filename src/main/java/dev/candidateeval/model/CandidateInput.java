package dev.candidateeval.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

/**
 * Raw, unvalidated documents for one candidate run. Only the profile and the requirement are
 * mandatory; precomputed category scores and assessment answers are optional.
 */
@Builder
public record CandidateInput(
        String candidateId,
        JsonNode profile,
        JsonNode requirement,
        JsonNode upstreamScores,
        JsonNode assessment) {
}
