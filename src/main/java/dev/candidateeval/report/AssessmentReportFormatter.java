package dev.candidateeval.report;

import dev.candidateeval.config.AssessmentConfig;
import dev.candidateeval.ingest.JsonFields;
import dev.candidateeval.model.AssessmentCategory;
import dev.candidateeval.model.AssessmentQuestion;
import dev.candidateeval.model.AssessmentReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link AssessmentReport} as the plain-text assessment summary through the
 * {@code report/assessment-report} Thymeleaf text template.
 * Section labels and their order are read by downstream text scrapers and must stay stable:
 * header, OVERALL RESULTS, PERFORMANCE BY CATEGORY, DETAILED FEEDBACK BY CATEGORY,
 * SUMMARY &amp; RECOMMENDATIONS, footer.
 */
@Component
@RequiredArgsConstructor
public class AssessmentReportFormatter {

    static final String TEMPLATE = "report/assessment-report";
    static final String NONE_IDENTIFIED = "None identified";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Map<AssessmentCategory, String> BREAKDOWN_LABELS = Map.of(
            AssessmentCategory.CODING, "Coding Questions:     ",
            AssessmentCategory.SYSTEM_DESIGN, "System Design:        ",
            AssessmentCategory.BEHAVIORAL, "Behavioral Questions: ");

    private static final Map<AssessmentCategory, String> SECTION_TITLES = Map.of(
            AssessmentCategory.CODING, "CODING QUESTIONS",
            AssessmentCategory.SYSTEM_DESIGN, "SYSTEM DESIGN QUESTIONS",
            AssessmentCategory.BEHAVIORAL, "BEHAVIORAL QUESTIONS");

    private final AssessmentConfig config;
    private final TemplateEngine templateEngine;

    public record BreakdownRow(String label, String value) {
    }

    public record QuestionBlock(String id, String score, String feedback) {
    }

    public record CategorySection(String title, String label, String average, List<QuestionBlock> questions,
            List<String> strengths, List<String> improvements) {
    }

    /**
     * Format the report.
     *
     * @param report        the scored assessment
     * @param candidateName name printed in the header
     * @param runId         pipeline run id printed in the header
     * @param generatedAt   generation timestamp printed in the header
     * @return the report text, lines separated by {@code \n}
     */
    public String format(AssessmentReport report, String candidateName, String runId, LocalDateTime generatedAt) {
        String name = candidateName != null ? candidateName : "Unknown candidate";

        Context context = new Context(Locale.ROOT);
        context.setVariable("title", "Assessment Summary for " + name);
        context.setVariable("generatedAt", TIMESTAMP.format(generatedAt));
        context.setVariable("runId", runId);

        context.setVariable("totalScore", Math.round(report.overallScore()));
        context.setVariable("status", report.passed() ? "PASSED ✓" : "FAILED ✗");
        context.setVariable("technicalRating", String.format(Locale.ROOT, "%.2f", report.technicalRating()));
        context.setVariable("passionRating", String.format(Locale.ROOT, "%.2f", report.passionRating()));

        List<BreakdownRow> breakdown = new ArrayList<>();
        for (AssessmentCategory category : AssessmentCategory.values()) {
            Double average = report.categoryAverages().get(category);
            breakdown.add(new BreakdownRow(BREAKDOWN_LABELS.get(category),
                    average != null ? String.format(Locale.ROOT, "%.1f/100", average) : "not assessed"));
        }
        context.setVariable("breakdown", breakdown);
        context.setVariable("strongest", label(report.strongestCategory()));
        Double weakestAverage = average(report, report.weakestCategory());
        context.setVariable("weakness", weakestAverage != null && weakestAverage < config.getHighlightScore()
                ? "Needs Improvement: " + label(report.weakestCategory())
                : "No significant weak areas identified");

        context.setVariable("sections", sections(report));
        summary(context, report);

        return templateEngine.process(TEMPLATE, context).stripTrailing();
    }

    private List<CategorySection> sections(AssessmentReport report) {
        Map<AssessmentCategory, List<String>> strengths = new EnumMap<>(AssessmentCategory.class);
        Map<AssessmentCategory, List<String>> improvements = new EnumMap<>(AssessmentCategory.class);
        collectBullets(report, strengths, improvements);

        List<CategorySection> sections = new ArrayList<>();
        for (AssessmentCategory category : AssessmentCategory.values()) {
            if (!report.questionCounts().containsKey(category)) {
                continue;
            }
            List<QuestionBlock> questions = report.questions().stream()
                    .filter(question -> question.category() == category)
                    .map(AssessmentReportFormatter::questionBlock)
                    .toList();
            sections.add(new CategorySection(
                    SECTION_TITLES.get(category),
                    category.label(),
                    String.format(Locale.ROOT, "%.1f", report.categoryAverages().get(category)),
                    questions,
                    orNone(strengths.get(category)),
                    orNone(improvements.get(category))));
        }
        return sections;
    }

    private static QuestionBlock questionBlock(AssessmentQuestion question) {
        return new QuestionBlock(
                question.id(),
                question.answered() ? String.format(Locale.ROOT, "%.0f/100", question.score()) : "no answer",
                question.feedback() != null ? question.feedback() : JsonFields.NOT_PROVIDED);
    }

    private void collectBullets(AssessmentReport report, Map<AssessmentCategory, List<String>> strengths,
            Map<AssessmentCategory, List<String>> improvements) {
        for (AssessmentCategory category : AssessmentCategory.values()) {
            strengths.put(category, new ArrayList<>());
            improvements.put(category, new ArrayList<>());
        }
        for (AssessmentQuestion question : report.questions()) {
            double score = question.effectiveScore();
            if (score >= config.getStrongQuestionScore()) {
                strengths.get(question.category()).add("Strong performance in " + question.id());
            } else if (score <= config.getWeakQuestionScore()) {
                improvements.get(question.category()).add("Needs improvement in " + question.id());
            }
        }

        if (report.technicalRating() >= config.getStrongRating()) {
            strengths.get(AssessmentCategory.CODING).add("Strong technical capabilities demonstrated");
            strengths.get(AssessmentCategory.SYSTEM_DESIGN).add("Well-designed system architecture solutions");
        } else if (report.technicalRating() <= config.getWeakRating()) {
            improvements.get(AssessmentCategory.CODING).add("Technical skills need significant improvement");
            improvements.get(AssessmentCategory.SYSTEM_DESIGN)
                    .add("System architecture understanding needs development");
        }

        if (report.passionRating() >= config.getStrongRating()) {
            strengths.get(AssessmentCategory.BEHAVIORAL)
                    .add("Shows strong enthusiasm and genuine interest in the role");
            strengths.get(AssessmentCategory.BEHAVIORAL).add("Demonstrates excellent cultural fit indicators");
        } else if (report.passionRating() <= config.getWeakRating()) {
            improvements.get(AssessmentCategory.BEHAVIORAL).add("Could demonstrate more passion for the role");
            improvements.get(AssessmentCategory.BEHAVIORAL)
                    .add("Consider highlighting motivations and interest in future interviews");
        }
    }

    private void summary(Context context, AssessmentReport report) {
        double highlightScore = config.getHighlightScore();
        double highlightRating = config.getHighlightRating();
        Double strongestAverage = average(report, report.strongestCategory());
        Double weakestAverage = average(report, report.weakestCategory());
        boolean standout = strongestAverage != null && strongestAverage >= highlightScore;
        boolean weakSpot = weakestAverage != null && weakestAverage < highlightScore;
        boolean technical = report.technicalRating() >= highlightRating;
        boolean passionate = report.passionRating() >= highlightRating;

        context.setVariable("keyStrengths", List.of(
                standout ? label(report.strongestCategory()) : "No outstanding strengths identified",
                technical ? "Technical knowledge is solid" : "Basic technical understanding demonstrated",
                passionate ? "Shows genuine passion for the role" : "Professional attitude demonstrated"));
        context.setVariable("improvements", List.of(
                weakSpot ? label(report.weakestCategory()) : "No critical weaknesses identified",
                technical ? "Continue technical development" : "Technical skills could be stronger",
                passionate ? "Maintain positive attitude" : "Could show more enthusiasm"));
        context.setVariable("recommendations", List.of(
                report.passed()
                        ? "Proceed with next interview stage"
                        : "Consider additional preparation before proceeding",
                "Focus on strengthening skills in " + label(report.weakestCategory()).toLowerCase(Locale.ROOT)
                        + " questions",
                standout
                        ? "Continue to leverage strong performance in "
                                + label(report.strongestCategory()).toLowerCase(Locale.ROOT) + " questions"
                        : "Work on improving all areas with focused study",
                technical ? "Continue building on strong technical foundation" : "Focus on practical implementation",
                passionate ? "Maintain strong engagement level" : "Show more enthusiasm in responses"));
    }

    private static List<String> orNone(List<String> items) {
        return items == null || items.isEmpty() ? List.of(NONE_IDENTIFIED) : items;
    }

    private static Double average(AssessmentReport report, AssessmentCategory category) {
        return category != null ? report.categoryAverages().get(category) : null;
    }

    private static String label(AssessmentCategory category) {
        return category != null ? category.label() : "None";
    }
}
