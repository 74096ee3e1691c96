package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of a scored assessment. Derived entirely from the question list, so two
 * reports built from the same questions are equal.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AssessmentReport(
        Map<AssessmentCategory, Double> categoryAverages,
        Map<AssessmentCategory, Integer> questionCounts,
        Map<AssessmentCategory, Integer> unansweredCounts,
        double overallScore,
        AssessmentStatus status,
        double technicalRating,
        double passionRating,
        AssessmentCategory strongestCategory,
        AssessmentCategory weakestCategory,
        List<AssessmentQuestion> questions,
        List<String> dataQualityNotes) {

    public AssessmentReport {
        categoryAverages = immutableEnumMap(categoryAverages);
        questionCounts = immutableEnumMap(questionCounts);
        unansweredCounts = immutableEnumMap(unansweredCounts);
        questions = questions == null ? List.of() : List.copyOf(questions);
        dataQualityNotes = dataQualityNotes == null ? List.of() : List.copyOf(dataQualityNotes);
    }

    @JsonIgnore
    public int unansweredCount() {
        return unansweredCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @JsonIgnore
    public boolean passed() {
        return status == AssessmentStatus.PASS;
    }

    private static <V> Map<AssessmentCategory, V> immutableEnumMap(Map<AssessmentCategory, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.unmodifiableMap(new EnumMap<>(AssessmentCategory.class));
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }
}
