package dev.candidateeval.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable values the pipeline is wired with. Invalid weights or retry settings
 * fail the application context, so a misconfiguration never reaches a candidate.
 */
@Slf4j
@Configuration
public class EvaluationConfig {

    @Bean
    public MatchingWeights matchingWeights(MatchingConfig matchingConfig) {
        MatchingWeights weights = MatchingWeights.fromProperties(matchingConfig.getWeights());
        log.info("Matching weights: {}", weights);
        return weights;
    }

    @Bean
    public RetryPolicy generatorRetryPolicy(GeneratorConfig generatorConfig) {
        RetryPolicy policy = RetryPolicy.from(generatorConfig.getRetry());
        log.info("Generator retry policy: {} attempts, backoff {}..{}, timeout {}",
                policy.maxAttempts(), policy.initialBackoff(), policy.maxBackoff(), policy.timeout());
        return policy;
    }
}
