package dev.candidateeval.generator;

import dev.candidateeval.model.CandidateProfile;
import dev.candidateeval.model.JobRequirement;
import reactor.core.publisher.Mono;

/**
 * Source of per-category match scores for a profile/requirement pair.
 * Implemented by an LLM-backed client or a no-op placeholder.
 */
public interface CategoryScoreGenerator {

    /**
     * Score the profile against the requirement.
     *
     * @param profile     the ingested candidate profile
     * @param requirement the ingested job requirement
     * @return Mono with the validated category scores; errors with an
     *         {@link dev.candidateeval.error.EvaluationException} on failure
     */
    Mono<GeneratedScores> generate(CandidateProfile profile, JobRequirement requirement);

    /**
     * Check if the generator is configured and able to serve requests.
     *
     * @return true if calls will reach an external service
     */
    boolean isEnabled();
}
