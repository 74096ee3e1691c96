package dev.candidateeval.config;

import dev.candidateeval.error.ExternalServiceException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Bounded retry with exponential backoff for calls to the external generator.
 * Every attempt is limited by {@code timeout}; only retryable failures are retried.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Duration timeout) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static RetryPolicy from(GeneratorConfig.Retry config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getInitialBackoff(),
                config.getMaxBackoff(), config.getTimeout());
    }

    public RetryBackoffSpec toRetrySpec() {
        return Retry.backoff(maxAttempts - 1L, initialBackoff)
                .maxBackoff(maxBackoff)
                .jitter(0.0)
                .filter(RetryPolicy::isRetryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Wrap a call so that every attempt is time-boxed and retryable failures are retried.
     */
    public <T> Mono<T> apply(Mono<T> call) {
        return call.timeout(timeout).retryWhen(toRetrySpec());
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof ExternalServiceException external) {
            return external.isRetryable();
        }
        return error instanceof TimeoutException;
    }
}
