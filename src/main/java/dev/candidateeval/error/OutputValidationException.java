package dev.candidateeval.error;

import dev.candidateeval.model.FailureKind;

/**
 * Structured generator output was malformed beyond best-effort field extraction.
 */
public class OutputValidationException extends EvaluationException {

    public OutputValidationException(String message) {
        super(message);
    }

    public OutputValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.VALIDATION;
    }
}
