package dev.candidateeval.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candidateeval.error.OutputValidationException;
import dev.candidateeval.error.PartialDataException;
import dev.candidateeval.ingest.JsonFields;
import dev.candidateeval.model.CategoryScore;
import dev.candidateeval.model.MatchCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates match-analysis output of the content generator. Two conventions are accepted:
 * <ul>
 * <li>{@code match_score} (0-100) with {@code categories{skills{score,matches,gaps},...}};</li>
 * <li>{@code overall_match_score} (0-1) with {@code skills_match/experience_match/education_match{score,details}}
 * and {@code additional_insights}.</li>
 * </ul>
 * Scores are normalized to 0-100 and clamped. Output that is not valid JSON is searched for
 * {@code "<category>": {"score": N}} fragments before it is rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpstreamMatchParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);
    private static final Pattern CATEGORY_FRAGMENT = Pattern.compile(
            "\"(skills|experience|education|additional)(?:_match)?\"\\s*:\\s*\\{\\s*\"score\"\\s*:\\s*(\\d+(?:\\.\\d+)?)");

    private final ObjectMapper objectMapper;

    /**
     * Parse raw generator text, possibly wrapped in markdown fences or surrounded by prose.
     */
    public GeneratedScores parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            throw new OutputValidationException("Generator returned empty output");
        }
        String json = extractJsonObject(rawOutput);
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Generator output is not valid JSON, falling back to field extraction: {}",
                    e.getOriginalMessage());
            return extractFragments(rawOutput, e);
        }
    }

    /**
     * Validate an already-parsed match analysis document. A text node is parsed as raw output.
     */
    public GeneratedScores parse(JsonNode document) {
        if (document != null && document.isTextual()) {
            return parse(document.asText());
        }
        if (document == null || !document.isObject()) {
            throw new OutputValidationException("Match analysis is not a JSON object");
        }
        List<String> notes = new ArrayList<>();
        boolean unitScale = usesUnitScale(document);
        Map<MatchCategory, CategoryScore> categories = unitScale
                ? readLegacyCategories(document, notes)
                : readCategories(document.path("categories"), notes);

        if (categories.isEmpty()) {
            throw new PartialDataException("Match analysis contains no category scores");
        }

        Integer overall = JsonFields.number(document, unitScale ? "overall_match_score" : "match_score")
                .map(value -> unitScale ? toPercent(value) : value)
                .map(value -> (int) Math.round(CategoryScore.clamp(value)))
                .orElse(null);

        return new GeneratedScores(categories, overall, notes);
    }

    static String extractJsonObject(String rawOutput) {
        String text = rawOutput.trim();
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1).trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return text;
    }

    private boolean usesUnitScale(JsonNode document) {
        if (document.has("overall_match_score")) {
            return true;
        }
        Iterator<String> names = document.fieldNames();
        while (names.hasNext()) {
            if (names.next().endsWith("_match")) {
                return true;
            }
        }
        return false;
    }

    private Map<MatchCategory, CategoryScore> readCategories(JsonNode categories, List<String> notes) {
        Map<MatchCategory, CategoryScore> result = new EnumMap<>(MatchCategory.class);
        if (!categories.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = categories.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<MatchCategory> category = MatchCategory.fromKey(field.getKey());
            if (category.isEmpty()) {
                notes.add("Ignored unknown match category '" + field.getKey() + "'");
                continue;
            }
            readScore(category.get(), field.getValue(), false, notes)
                    .ifPresent(score -> result.put(category.get(), score));
        }
        return result;
    }

    private Map<MatchCategory, CategoryScore> readLegacyCategories(JsonNode document, List<String> notes) {
        Map<MatchCategory, CategoryScore> result = new EnumMap<>(MatchCategory.class);
        for (MatchCategory category : MatchCategory.values()) {
            JsonNode node = document.get(category.key() + "_match");
            if (node != null && node.isObject()) {
                readScore(category, node, true, notes).ifPresent(score -> result.put(category, score));
            }
        }
        if (!result.containsKey(MatchCategory.ADDITIONAL) && document.has("additional_insights")) {
            notes.add("Additional insights were supplied without a score; additional category not assessed");
        }
        return result;
    }

    private Optional<CategoryScore> readScore(MatchCategory category, JsonNode node, boolean unitScale,
            List<String> notes) {
        Optional<Double> raw = JsonFields.number(node, "score");
        if (raw.isEmpty()) {
            notes.add("Category '" + category + "' has no numeric score");
            return Optional.empty();
        }
        double score = unitScale ? toPercent(raw.get()) : raw.get();
        if (score < 0 || score > 100) {
            notes.add(String.format("Category '%s' score %s was outside [0, 100] and has been clamped",
                    category, raw.get()));
        }
        List<String> matches = new ArrayList<>(JsonFields.textList(node, "matches", "strengths"));
        matches.addAll(JsonFields.textList(node, "details"));
        List<String> gaps = JsonFields.textList(node, "gaps", "weaknesses");
        return Optional.of(CategoryScore.of(category, score, matches, gaps));
    }

    // 0-1 values are fractions; larger values are taken as already being percentages
    private static double toPercent(double value) {
        return value <= 1.0 ? value * 100 : value;
    }

    private GeneratedScores extractFragments(String rawOutput, JsonProcessingException cause) {
        Map<MatchCategory, CategoryScore> categories = new EnumMap<>(MatchCategory.class);
        Matcher matcher = CATEGORY_FRAGMENT.matcher(rawOutput);
        while (matcher.find()) {
            MatchCategory category = MatchCategory.fromKey(matcher.group(1)).orElseThrow();
            double score = Double.parseDouble(matcher.group(2));
            boolean unitScale = matcher.group(0).contains("_match\"");
            categories.putIfAbsent(category, CategoryScore.of(category, unitScale ? toPercent(score) : score,
                    List.of(), List.of()));
        }
        if (categories.isEmpty()) {
            throw new OutputValidationException("Generator output is not valid JSON and no category score survived",
                    cause);
        }
        return new GeneratedScores(categories, null,
                List.of("Generator output was malformed; category scores recovered by field extraction"));
    }
}
