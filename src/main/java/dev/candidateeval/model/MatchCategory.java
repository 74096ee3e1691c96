package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Evaluation dimensions combined by the weighted matcher.
 */
public enum MatchCategory {
    SKILLS("skills"),
    EXPERIENCE("experience"),
    EDUCATION("education"),
    ADDITIONAL("additional");

    private final String key;

    MatchCategory(String key) {
        this.key = key;
    }

    @JsonKey
    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolve a category from its wire key ("skills") or the legacy "{key}_match" form.
     */
    public static Optional<MatchCategory> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("_match")) {
            normalized = normalized.substring(0, normalized.length() - "_match".length());
        }
        for (MatchCategory category : values()) {
            if (category.key.equals(normalized)) {
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
