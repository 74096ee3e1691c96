package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One scored assessment question.
 * A {@code null} score means the candidate gave no answer; it counts as 0 in averages.
 * {@code passionSignal} is the 0-1 qualitative signal attached to behavioral answers upstream.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssessmentQuestion(
        String id,
        AssessmentCategory category,
        Double score,
        String feedback,
        Double passionSignal) {

    public AssessmentQuestion {
        if (score != null) {
            score = CategoryScore.clamp(score);
        }
        if (passionSignal != null) {
            passionSignal = Double.isNaN(passionSignal) ? 0.0 : Math.max(0.0, Math.min(1.0, passionSignal));
        }
    }

    @JsonIgnore
    public boolean answered() {
        return score != null;
    }

    @JsonIgnore
    public double effectiveScore() {
        return score != null ? score : 0.0;
    }
}
