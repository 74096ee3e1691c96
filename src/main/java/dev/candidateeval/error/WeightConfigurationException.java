package dev.candidateeval.error;

/**
 * Matcher weights are invalid. Raised while the application starts or while the CLI override
 * is validated, never per candidate.
 */
public class WeightConfigurationException extends IllegalStateException {

    public WeightConfigurationException(String message) {
        super(message);
    }
}
