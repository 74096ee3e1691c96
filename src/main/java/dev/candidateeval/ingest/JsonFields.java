package dev.candidateeval.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient accessors for loosely-typed generator JSON. Every accessor tolerates missing nodes,
 * wrong node types and template placeholders, returning an explicit empty value instead.
 */
public final class JsonFields {

    public static final String NOT_PROVIDED = "Not provided";

    private static final Set<String> PLACEHOLDERS = Set.of(
            "not provided", "not specified", "n/a", "na", "none", "null", "unknown", "-");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private JsonFields() {
    }

    /**
     * A generator placeholder such as "Not provided", "Name not provided" or "[Full name of the candidate]".
     */
    public static boolean isPlaceholder(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        // "Email not provided", "Company not specified", "Resume summary pending"
        return PLACEHOLDERS.contains(lower)
                || lower.endsWith(" not provided")
                || lower.endsWith(" not specified")
                || lower.endsWith(" pending");
    }

    /**
     * First non-placeholder scalar found under any of the given field names, trimmed.
     */
    public static String text(JsonNode node, String... fieldNames) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText();
                if (!isPlaceholder(text)) {
                    return text.trim();
                }
            }
        }
        return null;
    }

    public static String textOrDefault(JsonNode node, String fieldName) {
        String value = text(node, fieldName);
        return value != null ? value : NOT_PROVIDED;
    }

    /**
     * Strings under the first present field: an array of scalars, or a single comma-separated string.
     */
    public static List<String> textList(JsonNode node, String... fieldNames) {
        if (node == null || !node.isObject()) {
            return List.of();
        }
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                return textList(value);
            }
        }
        return List.of();
    }

    public static List<String> textList(JsonNode value) {
        Set<String> items = new LinkedHashSet<>();
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isArray()) {
            value.forEach(item -> {
                if (item.isValueNode() && !isPlaceholder(item.asText())) {
                    items.add(item.asText().trim());
                } else if (item.isObject()) {
                    String name = text(item, "name", "skill", "title");
                    if (name != null) {
                        items.add(name);
                    }
                }
            });
        } else if (value.isObject()) {
            value.forEach(group -> items.addAll(textList(group)));
        } else if (value.isValueNode()) {
            for (String part : value.asText().split("[,;\\n]")) {
                if (!isPlaceholder(part)) {
                    items.add(part.trim());
                }
            }
        }
        return new ArrayList<>(items);
    }

    /**
     * Numeric value of the first present field. Numeric text ("85", "5+ years") is accepted.
     */
    public static Optional<Double> number(JsonNode node, String... fieldNames) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String fieldName : fieldNames) {
            Optional<Double> value = number(node.get(fieldName));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public static Optional<Double> number(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            double number = value.asDouble();
            return Double.isFinite(number) ? Optional.of(number) : Optional.empty();
        }
        if (value.isTextual()) {
            Matcher matcher = NUMBER.matcher(value.asText());
            if (matcher.find()) {
                return Optional.of(Double.parseDouble(matcher.group()));
            }
        }
        return Optional.empty();
    }

    /**
     * Elements of an array field; a single object is treated as a one-element array.
     */
    public static List<JsonNode> objects(JsonNode node, String... fieldNames) {
        if (node == null || !node.isObject()) {
            return List.of();
        }
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value == null || value.isNull()) {
                continue;
            }
            List<JsonNode> elements = new ArrayList<>();
            if (value.isArray()) {
                value.forEach(elements::add);
            } else {
                elements.add(value);
            }
            return elements;
        }
        return List.of();
    }
}
