package dev.candidateeval.generator;

import dev.candidateeval.model.CategoryScore;
import dev.candidateeval.model.MatchCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Category scores supplied by the content generator, normalized to the 0-100 scale.
 * Categories the generator did not score are absent from {@code categories}.
 *
 * @param upstreamOverall the generator's own overall score (0-100), informational only
 * @param notes           data-quality notes raised while validating the output
 */
public record GeneratedScores(Map<MatchCategory, CategoryScore> categories, Integer upstreamOverall,
        List<String> notes) {

    public GeneratedScores {
        categories = categories == null || categories.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(MatchCategory.class))
                : Collections.unmodifiableMap(new EnumMap<>(categories));
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
