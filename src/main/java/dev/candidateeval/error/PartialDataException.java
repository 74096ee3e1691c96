package dev.candidateeval.error;

import dev.candidateeval.model.FailureKind;

/**
 * Upstream data lacked every category or question needed by a stage. Recoverable.
 */
public class PartialDataException extends EvaluationException {

    public PartialDataException(String message) {
        super(message);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.PARTIAL_DATA;
    }
}
