package dev.candidateeval.report;

import dev.candidateeval.config.AssessmentConfig;
import dev.candidateeval.model.AssessmentCategory;
import dev.candidateeval.model.AssessmentQuestion;
import dev.candidateeval.model.AssessmentReport;
import dev.candidateeval.service.AssessmentScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AssessmentReportFormatterTest {

    private static final LocalDateTime GENERATED_AT = LocalDateTime.of(2024, 5, 17, 14, 30, 5);

    private AssessmentReportFormatter formatter;
    private AssessmentScorer scorer;

    @BeforeEach
    void setUp() {
        AssessmentConfig config = new AssessmentConfig();
        formatter = new AssessmentReportFormatter(config, ReportTemplates.engine());
        scorer = new AssessmentScorer(config);
    }

    private AssessmentReport failingReport() {
        return scorer.scoreAssessment(List.of(
                new AssessmentQuestion("code_1", AssessmentCategory.CODING, 90.0, "Efficient solution", null),
                new AssessmentQuestion("code_2", AssessmentCategory.CODING, 70.0, "Missed an edge case", null),
                new AssessmentQuestion("design_1", AssessmentCategory.SYSTEM_DESIGN, 7.4, "No scaling plan", null),
                new AssessmentQuestion("behavior_1", AssessmentCategory.BEHAVIORAL, null, "No answer provided.", null)));
    }

    @Nested
    @DisplayName("Section layout")
    class LayoutTests {

        @Test
        @DisplayName("Should render sections in the fixed order")
        void shouldRenderSectionsInOrder() {
            String text = formatter.format(failingReport(), "Alice Smith", "run-42", GENERATED_AT);

            assertThat(text).containsSubsequence(
                    "Assessment Summary for Alice Smith",
                    "Generated on: 2024-05-17 14:30:05",
                    "Run ID: run-42",
                    "OVERALL RESULTS",
                    "PERFORMANCE BY CATEGORY",
                    "DETAILED FEEDBACK BY CATEGORY",
                    "CODING QUESTIONS",
                    "SYSTEM DESIGN QUESTIONS",
                    "BEHAVIORAL QUESTIONS",
                    "SUMMARY & RECOMMENDATIONS",
                    "This report was automatically generated based on the assessment responses.");
            assertThat(text.lines().findFirst()).contains("Assessment Summary for Alice Smith");
            assertThat(text.lines().skip(1).findFirst()).contains("=".repeat("Assessment Summary for Alice Smith".length()));
            assertThat(text).endsWith("=".repeat(50));
        }

        @Test
        @DisplayName("Should render overall results and the category breakdown")
        void shouldRenderOverallResults() {
            String text = formatter.format(failingReport(), "Alice Smith", "run-42", GENERATED_AT);

            assertThat(text).contains(
                    "Total Score: 29/100",
                    "Status: FAILED ✗",
                    "Technical Rating: 0.44/1.0",
                    "Passion Rating: 0.00/1.0",
                    "Coding Questions:     80.0/100",
                    "System Design:        7.4/100",
                    "Behavioral Questions: 0.0/100",
                    "Strongest Area: Coding",
                    "Needs Improvement: Behavioral");
            assertThat(text).contains("""
                    PERFORMANCE BY CATEGORY
                    =======================
                    Coding Questions:     80.0/100
                    System Design:        7.4/100
                    Behavioral Questions: 0.0/100

                    Strongest Area: Coding
                    """);
        }

        @Test
        @DisplayName("Should mark absent categories as not assessed")
        void shouldMarkAbsentCategories() {
            AssessmentReport report = scorer.scoreAssessment(List.of(
                    new AssessmentQuestion("code_1", AssessmentCategory.CODING, 95.0, "Great", null)));

            String text = formatter.format(report, null, "run-1", GENERATED_AT);

            assertThat(text).contains("Assessment Summary for Unknown candidate",
                    "Status: PASSED ✓",
                    "System Design:        not assessed",
                    "No significant weak areas identified");
            assertThat(text).doesNotContain("SYSTEM DESIGN QUESTIONS", "BEHAVIORAL QUESTIONS");
        }
    }

    @Nested
    @DisplayName("Feedback blocks")
    class FeedbackTests {

        @Test
        @DisplayName("Should distinguish unanswered questions from scored ones")
        void shouldRenderQuestionBlocks() {
            String text = formatter.format(failingReport(), "Alice Smith", "run-42", GENERATED_AT);

            assertThat(text).containsSubsequence("Question ID: code_1", "Score: 90/100", "Feedback: Efficient solution");
            assertThat(text).contains("""
                    CODING QUESTIONS
                    ----------------
                    Average Score: 80.0/100

                    Question ID: code_1
                    Score: 90/100
                    Feedback: Efficient solution

                    Question ID: code_2
                    """);
            assertThat(text).containsSubsequence("Question ID: behavior_1", "Score: no answer",
                    "Feedback: No answer provided.");
        }

        @Test
        @DisplayName("Should list strengths and improvements per category")
        void shouldRenderBullets() {
            String text = formatter.format(failingReport(), "Alice Smith", "run-42", GENERATED_AT);

            assertThat(text).containsSubsequence(
                    "Coding Strengths:", "- Strong performance in code_1",
                    "Coding Areas for Improvement:", "- Technical skills need significant improvement");
            assertThat(text).containsSubsequence(
                    "Behavioral Strengths:", "- " + AssessmentReportFormatter.NONE_IDENTIFIED,
                    "Behavioral Areas for Improvement:", "- Needs improvement in behavior_1",
                    "- Could demonstrate more passion for the role");
        }

        @Test
        @DisplayName("Should recommend extra preparation for a failed assessment")
        void shouldRenderRecommendations() {
            String text = formatter.format(failingReport(), "Alice Smith", "run-42", GENERATED_AT);

            assertThat(text).containsSubsequence(
                    "Recommendations:",
                    "- Consider additional preparation before proceeding",
                    "- Focus on strengthening skills in behavioral questions",
                    "- Continue to leverage strong performance in coding questions");
        }
    }
}
