package dev.candidateeval.error;

import dev.candidateeval.model.FailureKind;

/**
 * Base class of every failure the evaluation pipeline knows how to classify.
 */
public abstract class EvaluationException extends RuntimeException {

    protected EvaluationException(String message) {
        super(message);
    }

    protected EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Kind recorded on the failed stage.
     */
    public abstract FailureKind failureKind();
}
