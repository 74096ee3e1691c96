package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Question categories of a technical assessment, declared in tie-break priority order.
 */
public enum AssessmentCategory {
    CODING("coding", "Coding", "code_"),
    SYSTEM_DESIGN("system_design", "System Design", "design_"),
    BEHAVIORAL("behavioral", "Behavioral", "behavior_");

    private final String key;
    private final String label;
    private final String idPrefix;

    AssessmentCategory(String key, String label, String idPrefix) {
        this.key = key;
        this.label = label;
        this.idPrefix = idPrefix;
    }

    @JsonKey
    @JsonValue
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public static Optional<AssessmentCategory> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (AssessmentCategory category : values()) {
            if (category.key.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return switch (normalized) {
            case "design" -> Optional.of(SYSTEM_DESIGN);
            case "behavior", "behaviour", "behavioural" -> Optional.of(BEHAVIORAL);
            case "code" -> Optional.of(CODING);
            default -> Optional.empty();
        };
    }

    /**
     * Infer the category from the question id convention ("code_1", "design_2", "behavior_3").
     */
    public static Optional<AssessmentCategory> fromQuestionId(String questionId) {
        if (questionId == null) {
            return Optional.empty();
        }
        String normalized = questionId.toLowerCase(Locale.ROOT);
        for (AssessmentCategory category : values()) {
            if (normalized.startsWith(category.idPrefix)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return key;
    }
}
