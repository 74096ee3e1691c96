package dev.candidateeval.error;

import dev.candidateeval.model.FailureKind;

/**
 * The external content generator failed. Rate limits, server errors and I/O failures are
 * retryable; client errors are not.
 */
public class ExternalServiceException extends EvaluationException {

    private final boolean retryable;

    public ExternalServiceException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ExternalServiceException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static ExternalServiceException forStatus(int statusCode, String body) {
        boolean retryable = statusCode == 429 || statusCode >= 500;
        return new ExternalServiceException("Generator returned HTTP " + statusCode + ": " + body, retryable);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.EXTERNAL_SERVICE;
    }
}
