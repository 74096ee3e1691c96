package dev.candidateeval.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DateNormalizerTest {

    @Nested
    @DisplayName("Single dates")
    class NormalizeTests {

        @ParameterizedTest
        @CsvSource({
                "2021, 2021",
                "2021-03, 2021-03",
                "2021/3, 2021-03",
                "03/2021, 2021-03",
                "Mar 2021, 2021-03",
                "March 2021, 2021-03",
                "Sept 2020, 2020-09",
                "'Dec. 2019', 2019-12",
                "2021-03-15, 2021-03",
                "2021-03-15T10:00:00Z, 2021-03"
        })
        @DisplayName("Should normalize common date formats")
        void shouldNormalize(String input, String expected) {
            assertThat(DateNormalizer.normalize(input)).contains(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "Present", "soon", "2021-13", "Marchish 2021", "2021-02-30"})
        @DisplayName("Should return empty for unrecognized or ongoing values")
        void shouldRejectUnknown(String input) {
            assertThat(DateNormalizer.normalize(input)).isEmpty();
        }

        @Test
        @DisplayName("Should recognize ongoing markers")
        void shouldRecognizeOngoing() {
            assertThat(DateNormalizer.isOngoing(" Current ")).isTrue();
            assertThat(DateNormalizer.isOngoing("2021")).isFalse();
            assertThat(DateNormalizer.isOngoing(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Durations")
    class DurationTests {

        @Test
        @DisplayName("Should split a closed range")
        void shouldSplitClosedRange() {
            assertThat(DateNormalizer.splitDuration("Jan 2019 - Mar 2021"))
                    .contains(new DateNormalizer.DateRange("2019-01", "2021-03", false));
        }

        @Test
        @DisplayName("Should split an open range")
        void shouldSplitOpenRange() {
            assertThat(DateNormalizer.splitDuration("2019 to Present"))
                    .contains(new DateNormalizer.DateRange("2019", null, true));
        }

        @Test
        @DisplayName("Should split year ranges and dash variants")
        void shouldSplitDashVariants() {
            assertThat(DateNormalizer.splitDuration("2019-2021"))
                    .contains(new DateNormalizer.DateRange("2019", "2021", false));
            assertThat(DateNormalizer.splitDuration("2019 – 2021"))
                    .contains(new DateNormalizer.DateRange("2019", "2021", false));
        }

        @ParameterizedTest
        @ValueSource(strings = {"3 years", "Summer 2019 - Fall 2020", "2019"})
        @DisplayName("Should not split unrecognized durations")
        void shouldRejectUnknownDurations(String input) {
            assertThat(DateNormalizer.splitDuration(input)).isEmpty();
        }
    }
}
