package dev.candidateeval.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Score of one match category. The score is always within [0, 100].
 * {@code assessed == false} marks a category the upstream generator never scored.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryScore(
        MatchCategory category,
        double score,
        List<String> matches,
        List<String> gaps,
        boolean assessed) {

    public static final String NOT_ASSESSED_GAP = "category not assessed";

    public CategoryScore {
        score = clamp(score);
        matches = matches == null ? List.of() : List.copyOf(matches);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public static CategoryScore of(MatchCategory category, double score, List<String> matches, List<String> gaps) {
        return new CategoryScore(category, score, matches, gaps, true);
    }

    public static CategoryScore notAssessed(MatchCategory category, List<String> gaps) {
        List<String> annotated = new ArrayList<>(gaps == null ? List.of() : gaps);
        annotated.add(NOT_ASSESSED_GAP);
        return new CategoryScore(category, 0, List.of(), annotated, false);
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.max(0, Math.min(100, score));
    }
}
