package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted aggregation of the four category scores.
 * The overall score is derived by the matcher and serialized on the canonical 0-100 scale
 * as {@code match_score}.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchAnalysis(
        @JsonProperty("match_score") int overallScore,
        Map<MatchCategory, CategoryScore> categories,
        String recommendation,
        List<String> keyStrengths,
        List<String> areasForConsideration,
        List<String> dataQualityNotes) {

    public MatchAnalysis {
        categories = categories == null || categories.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(MatchCategory.class))
                : Collections.unmodifiableMap(new EnumMap<>(categories));
        keyStrengths = keyStrengths == null ? List.of() : List.copyOf(keyStrengths);
        areasForConsideration = areasForConsideration == null ? List.of() : List.copyOf(areasForConsideration);
        dataQualityNotes = dataQualityNotes == null ? List.of() : List.copyOf(dataQualityNotes);
    }

    /**
     * Copy of this analysis with extra data-quality notes appended.
     */
    public MatchAnalysis withDataQualityNotes(List<String> extraNotes) {
        if (extraNotes == null || extraNotes.isEmpty()) {
            return this;
        }
        List<String> combined = new ArrayList<>(dataQualityNotes);
        combined.addAll(extraNotes);
        return new MatchAnalysis(overallScore, categories, recommendation, keyStrengths, areasForConsideration,
                combined);
    }

    @JsonIgnore
    public CategoryScore category(MatchCategory category) {
        return categories.get(category);
    }

    @JsonIgnore
    public boolean anyCategoryNotAssessed() {
        return MatchCategory.values().length != categories.size()
                || categories.values().stream().anyMatch(score -> !score.assessed());
    }

    @JsonIgnore
    public boolean noCategoryAssessed() {
        return categories.values().stream().noneMatch(CategoryScore::assessed);
    }

    /**
     * All four categories were scored and every one of them came back exactly 0.
     */
    @JsonIgnore
    public boolean allCategoriesAssessedAsZero() {
        return categories.size() == MatchCategory.values().length
                && categories.values().stream().allMatch(score -> score.assessed() && score.score() == 0);
    }
}
