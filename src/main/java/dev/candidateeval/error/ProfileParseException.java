package dev.candidateeval.error;

import dev.candidateeval.model.FailureKind;

/**
 * A profile or requirement document could not be structurally validated.
 * Fatal for the candidate: the pipeline stops before matching.
 */
public class ProfileParseException extends EvaluationException {

    public ProfileParseException(String message) {
        super(message);
    }

    public ProfileParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.PARSE;
    }
}
