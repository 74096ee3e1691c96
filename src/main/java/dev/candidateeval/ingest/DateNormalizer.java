package dev.candidateeval.ingest;

import java.time.LocalDate;
import java.time.Month;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes the free-form dates found in parsed resumes to {@code YYYY-MM} or {@code YYYY}.
 */
public final class DateNormalizer {

    private static final Set<String> ONGOING = Set.of("present", "current", "now", "ongoing", "today");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("oct", 10), Map.entry("nov", 11),
            Map.entry("dec", 12));

    private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})[-/.](\\d{1,2})$");
    private static final Pattern MONTH_YEAR = Pattern.compile("^(\\d{1,2})[-/.](\\d{4})$");
    private static final Pattern NAMED_MONTH_YEAR = Pattern.compile("^([A-Za-z]+)\\.?,?\\s+(\\d{4})$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*$");

    // " - ", en dash, em dash or " to " between the two ends of a range
    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\s+-\\s+|\\s*[\\u2013\\u2014]\\s*|\\s+to\\s+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_RANGE = Pattern.compile("^(\\d{4})-(\\d{4})$");

    /**
     * A split duration. {@code end} is {@code null} when the position is ongoing.
     */
    public record DateRange(String start, String end, boolean current) {
    }

    private DateNormalizer() {
    }

    public static boolean isOngoing(String value) {
        return value != null && ONGOING.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Normalized date, or empty when the input is blank, ongoing or not recognized.
     */
    public static Optional<String> normalize(String value) {
        if (value == null || value.isBlank() || isOngoing(value)) {
            return Optional.empty();
        }
        String trimmed = value.trim();

        Matcher matcher = YEAR.matcher(trimmed);
        if (matcher.matches()) {
            return Optional.of(matcher.group(1));
        }
        matcher = YEAR_MONTH.matcher(trimmed);
        if (matcher.matches()) {
            return yearMonth(matcher.group(1), Integer.parseInt(matcher.group(2)));
        }
        matcher = MONTH_YEAR.matcher(trimmed);
        if (matcher.matches()) {
            return yearMonth(matcher.group(2), Integer.parseInt(matcher.group(1)));
        }
        matcher = NAMED_MONTH_YEAR.matcher(trimmed);
        if (matcher.matches()) {
            Integer month = monthNumber(matcher.group(1));
            return month != null ? yearMonth(matcher.group(2), month) : Optional.empty();
        }
        if (ISO_DATE.matcher(trimmed).matches()) {
            return parseIso(trimmed);
        }
        return Optional.empty();
    }

    /**
     * Split a free-text duration such as "Jan 2019 - Mar 2021" or "2019 - Present".
     * Empty when either end cannot be recognized.
     */
    public static Optional<DateRange> splitDuration(String duration) {
        if (duration == null || duration.isBlank()) {
            return Optional.empty();
        }
        String trimmed = duration.trim();
        String[] parts;
        Matcher yearRange = YEAR_RANGE.matcher(trimmed);
        if (yearRange.matches()) {
            parts = new String[] {yearRange.group(1), yearRange.group(2)};
        } else {
            parts = RANGE_SEPARATOR.split(trimmed, 2);
        }
        if (parts.length != 2) {
            return Optional.empty();
        }
        Optional<String> start = normalize(parts[0]);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        if (isOngoing(parts[1])) {
            return Optional.of(new DateRange(start.get(), null, true));
        }
        return normalize(parts[1]).map(end -> new DateRange(start.get(), end, false));
    }

    private static Optional<String> yearMonth(String year, int month) {
        if (month < 1 || month > 12) {
            return Optional.empty();
        }
        return Optional.of(String.format("%s-%02d", year, month));
    }

    private static Integer monthNumber(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        Integer month = MONTHS.get(lower);
        if (month == null && lower.length() >= 3) {
            month = MONTHS.get(lower.substring(0, 3));
            // only full month names, not arbitrary words that share a prefix
            if (month != null && !fullMonthName(month).startsWith(lower)) {
                month = null;
            }
        }
        return month;
    }

    private static String fullMonthName(int month) {
        return Month.of(month).name().toLowerCase(Locale.ROOT);
    }

    private static Optional<String> parseIso(String value) {
        try {
            LocalDate date = LocalDate.parse(value.substring(0, 10));
            return Optional.of(String.format("%d-%02d", date.getYear(), date.getMonthValue()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
