package dev.candidateeval.service;

import dev.candidateeval.config.AssessmentConfig;
import dev.candidateeval.model.AssessmentCategory;
import dev.candidateeval.model.AssessmentQuestion;
import dev.candidateeval.model.AssessmentReport;
import dev.candidateeval.model.AssessmentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates scored assessment questions into an {@link AssessmentReport}.
 * Pure and deterministic: the same question list always yields an equal report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssessmentScorer {

    private final AssessmentConfig assessmentConfig;

    public AssessmentReport scoreAssessment(List<AssessmentQuestion> questions) {
        return scoreAssessment(questions, List.of());
    }

    /**
     * Score an assessment.
     *
     * @param questions      scored questions, in document order
     * @param ingestionNotes notes raised while the questions were read
     * @return the aggregated report
     */
    public AssessmentReport scoreAssessment(List<AssessmentQuestion> questions, List<String> ingestionNotes) {
        List<AssessmentQuestion> safeQuestions = questions == null ? List.of() : questions;
        List<String> notes = new ArrayList<>(ingestionNotes == null ? List.of() : ingestionNotes);

        Map<AssessmentCategory, Double> sums = new EnumMap<>(AssessmentCategory.class);
        Map<AssessmentCategory, Integer> counts = new EnumMap<>(AssessmentCategory.class);
        Map<AssessmentCategory, Integer> unanswered = new EnumMap<>(AssessmentCategory.class);
        double passionSum = 0;
        int passionCount = 0;

        for (AssessmentQuestion question : safeQuestions) {
            AssessmentCategory category = question.category();
            sums.merge(category, question.effectiveScore(), Double::sum);
            counts.merge(category, 1, Integer::sum);
            unanswered.merge(category, question.answered() ? 0 : 1, Integer::sum);
            if (category == AssessmentCategory.BEHAVIORAL && question.passionSignal() != null) {
                passionSum += question.passionSignal();
                passionCount++;
            }
        }

        Map<AssessmentCategory, Double> averages = new EnumMap<>(AssessmentCategory.class);
        for (AssessmentCategory category : AssessmentCategory.values()) {
            Integer count = counts.get(category);
            if (count == null) {
                if (!safeQuestions.isEmpty()) {
                    notes.add("No " + category.label() + " questions; category excluded from the overall score");
                }
                continue;
            }
            averages.put(category, sums.get(category) / count);
            int missing = unanswered.get(category);
            if (missing > 0) {
                notes.add(String.format("%d %s question(s) had no answer and were scored 0",
                        missing, category.label()));
            }
        }

        double overall = averages.isEmpty()
                ? 0
                : averages.values().stream().mapToDouble(Double::doubleValue).sum() / averages.size();
        if (averages.isEmpty()) {
            notes.add("Assessment contains no questions");
        }

        AssessmentStatus status = overall >= assessmentConfig.getPassThreshold()
                ? AssessmentStatus.PASS
                : AssessmentStatus.FAIL;

        AssessmentReport report = AssessmentReport.builder()
                .categoryAverages(averages)
                .questionCounts(counts)
                .unansweredCounts(unanswered)
                .overallScore(overall)
                .status(status)
                .technicalRating(technicalRating(averages, notes))
                .passionRating(passionRating(passionSum, passionCount, notes))
                .strongestCategory(strongest(averages))
                .weakestCategory(weakest(averages))
                .questions(safeQuestions)
                .dataQualityNotes(notes)
                .build();

        log.debug("Assessment scored {} ({}) from {} questions", String.format("%.2f", overall), status,
                safeQuestions.size());
        return report;
    }

    private double technicalRating(Map<AssessmentCategory, Double> averages, List<String> notes) {
        Double coding = averages.get(AssessmentCategory.CODING);
        Double design = averages.get(AssessmentCategory.SYSTEM_DESIGN);
        if (coding != null && design != null) {
            return (coding + design) / 2 / 100;
        }
        if (coding != null) {
            return coding / 100;
        }
        if (design != null) {
            return design / 100;
        }
        notes.add("No coding or system design questions; technical rating set to 0");
        return 0;
    }

    private double passionRating(double sum, int count, List<String> notes) {
        if (count == 0) {
            notes.add("No behavioral passion signal; passion rating set to 0");
            return 0;
        }
        return sum / count;
    }

    // Iteration follows enum order and only a strictly better value replaces the pick,
    // so ties go to coding, then system_design, then behavioral.
    private AssessmentCategory strongest(Map<AssessmentCategory, Double> averages) {
        AssessmentCategory best = null;
        for (Map.Entry<AssessmentCategory, Double> entry : averages.entrySet()) {
            if (best == null || entry.getValue() > averages.get(best)) {
                best = entry.getKey();
            }
        }
        return best;
    }

    private AssessmentCategory weakest(Map<AssessmentCategory, Double> averages) {
        AssessmentCategory worst = null;
        for (Map.Entry<AssessmentCategory, Double> entry : averages.entrySet()) {
            if (worst == null || entry.getValue() < averages.get(worst)) {
                worst = entry.getKey();
            }
        }
        return worst;
    }
}
