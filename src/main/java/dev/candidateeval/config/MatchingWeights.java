package dev.candidateeval.config;

import dev.candidateeval.error.WeightConfigurationException;
import dev.candidateeval.model.MatchCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated, immutable weight set of the category matcher.
 * Every category is present, every weight lies in [0, 1] and the weights sum to 1.0.
 */
public record MatchingWeights(Map<MatchCategory, Double> weights) {

    public static final double SUM_TOLERANCE = 1e-6;

    public MatchingWeights {
        if (weights == null) {
            throw new WeightConfigurationException("Matching weights are missing");
        }
        EnumMap<MatchCategory, Double> copy = new EnumMap<>(MatchCategory.class);
        copy.putAll(weights);
        validate(copy);
        weights = Collections.unmodifiableMap(copy);
    }

    public static MatchingWeights defaults() {
        return new MatchingWeights(Map.of(
                MatchCategory.SKILLS, 0.40,
                MatchCategory.EXPERIENCE, 0.30,
                MatchCategory.EDUCATION, 0.20,
                MatchCategory.ADDITIONAL, 0.10));
    }

    /**
     * Build weights from configuration keys ("skills", "experience", ...).
     */
    public static MatchingWeights fromProperties(Map<String, Double> properties) {
        if (properties == null || properties.isEmpty()) {
            throw new WeightConfigurationException("Matching weights are missing");
        }
        EnumMap<MatchCategory, Double> parsed = new EnumMap<>(MatchCategory.class);
        properties.forEach((key, value) -> {
            MatchCategory category = MatchCategory.fromKey(key)
                    .orElseThrow(() -> new WeightConfigurationException("Unknown weight category: " + key));
            if (value == null) {
                throw new WeightConfigurationException("Weight for " + key + " has no value");
            }
            parsed.put(category, value);
        });
        return new MatchingWeights(parsed);
    }

    /**
     * Parse a command-line override such as {@code skills=0.5,experience=0.3,education=0.1,additional=0.1}.
     */
    public static MatchingWeights parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new WeightConfigurationException("Weight override is empty");
        }
        Map<String, Double> properties = new LinkedHashMap<>();
        for (String pair : spec.split(",")) {
            String[] parts = pair.split("[=:]", 2);
            if (parts.length != 2) {
                throw new WeightConfigurationException("Malformed weight entry: '" + pair.trim() + "'");
            }
            try {
                properties.put(parts[0].trim(), Double.parseDouble(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new WeightConfigurationException("Weight for " + parts[0].trim() + " is not a number: " + parts[1].trim());
            }
        }
        return fromProperties(properties);
    }

    public double weight(MatchCategory category) {
        return weights.get(category);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private static void validate(Map<MatchCategory, Double> weights) {
        for (MatchCategory category : MatchCategory.values()) {
            Double weight = weights.get(category);
            if (weight == null) {
                throw new WeightConfigurationException("Missing weight for category " + category);
            }
            if (!Double.isFinite(weight) || weight < 0 || weight > 1) {
                throw new WeightConfigurationException("Weight for " + category + " must be within [0, 1]: " + weight);
            }
        }
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new WeightConfigurationException("Matching weights must sum to 1.0 but sum to " + sum);
        }
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
