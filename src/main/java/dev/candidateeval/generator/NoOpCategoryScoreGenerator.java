package dev.candidateeval.generator;

import dev.candidateeval.error.PartialDataException;
import dev.candidateeval.model.CandidateProfile;
import dev.candidateeval.model.JobRequirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op implementation of CategoryScoreGenerator.
 * Used when no generator provider is configured; category scores must then come from an
 * upstream scores file.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "generator.provider", havingValue = "none", matchIfMissing = true)
public class NoOpCategoryScoreGenerator implements CategoryScoreGenerator {

    public NoOpCategoryScoreGenerator() {
        log.info("Category score generator disabled - using no-op generator");
    }

    @Override
    public Mono<GeneratedScores> generate(CandidateProfile profile, JobRequirement requirement) {
        return Mono.error(new PartialDataException(
                "No category score generator configured and no upstream scores supplied"));
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
