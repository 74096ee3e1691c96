package dev.candidateeval.service;

import dev.candidateeval.config.DecisionConfig;
import dev.candidateeval.config.MatchingWeights;
import dev.candidateeval.model.CategoryScore;
import dev.candidateeval.model.JobRequirement;
import dev.candidateeval.model.MatchAnalysis;
import dev.candidateeval.model.MatchCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines per-category scores into the weighted overall match score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeightedCategoryMatcher {

    private final MatchingWeights weights;
    private final DecisionConfig decisionConfig;

    /**
     * Compute the match with the configured weights.
     */
    public MatchAnalysis computeMatch(JobRequirement requirement, Map<MatchCategory, CategoryScore> categoryScores) {
        return computeMatch(requirement, categoryScores, weights);
    }

    /**
     * Compute the match analysis for one profile/requirement pair.
     * A category missing from {@code categoryScores} is recorded as not assessed with score 0.
     *
     * @param requirement    the requirement the scores were produced for
     * @param categoryScores scores per category, possibly incomplete
     * @param weights        validated weight set
     * @return the match analysis
     */
    public MatchAnalysis computeMatch(JobRequirement requirement, Map<MatchCategory, CategoryScore> categoryScores,
            MatchingWeights weights) {
        Map<MatchCategory, CategoryScore> categories = new EnumMap<>(MatchCategory.class);
        List<String> keyStrengths = new ArrayList<>();
        List<String> areas = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        double total = 0;

        for (MatchCategory category : MatchCategory.values()) {
            CategoryScore score = categoryScores != null ? categoryScores.get(category) : null;
            if (score == null) {
                score = CategoryScore.notAssessed(category, List.of());
            } else if (!score.assessed() && !score.gaps().contains(CategoryScore.NOT_ASSESSED_GAP)) {
                score = CategoryScore.notAssessed(category, score.gaps());
            }
            if (!score.assessed()) {
                notes.add("Category '" + category + "' was not assessed; it counts as 0 in the overall score");
            }

            categories.put(category, score);
            total += weights.weight(category) * CategoryScore.clamp(score.score());
            keyStrengths.addAll(score.matches());
            for (String gap : score.gaps()) {
                areas.add(CategoryScore.NOT_ASSESSED_GAP.equals(gap) ? category + " " + gap : gap);
            }
        }

        int overall = roundHalfUp(total);
        log.debug("Match for '{}': overall {} from {}", requirement != null ? requirement.title() : null,
                overall, categories.values().stream().map(CategoryScore::score).toList());

        return MatchAnalysis.builder()
                .overallScore(overall)
                .categories(categories)
                .recommendation(recommendation(requirement, overall))
                .keyStrengths(keyStrengths)
                .areasForConsideration(areas)
                .dataQualityNotes(notes)
                .build();
    }

    static int roundHalfUp(double value) {
        // two steps so 82.49999999999999 from float accumulation still rounds to 83
        return BigDecimal.valueOf(value)
                .setScale(6, RoundingMode.HALF_UP)
                .setScale(0, RoundingMode.HALF_UP)
                .intValue();
    }

    private String recommendation(JobRequirement requirement, int overall) {
        String role = requirement != null && requirement.title() != null ? requirement.title() : "the role";
        if (overall >= decisionConfig.getProceedThreshold()) {
            return String.format("Strong match for %s (%d/100): proceed with the interview process.", role, overall);
        }
        if (overall >= decisionConfig.getHoldThreshold()) {
            return String.format("Partial match for %s (%d/100): a screening interview should clarify the gaps.",
                    role, overall);
        }
        return String.format("Weak match for %s (%d/100): the profile does not meet the core requirements.",
                role, overall);
    }
}
