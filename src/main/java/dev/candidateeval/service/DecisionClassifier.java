package dev.candidateeval.service;

import dev.candidateeval.config.DecisionConfig;
import dev.candidateeval.model.AssessmentReport;
import dev.candidateeval.model.CategoryScore;
import dev.candidateeval.model.Decision;
import dev.candidateeval.model.DecisionStatus;
import dev.candidateeval.model.InterviewStage;
import dev.candidateeval.model.JobRequirement;
import dev.candidateeval.model.MatchAnalysis;
import dev.candidateeval.model.MatchCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies a match analysis into PROCEED, HOLD or REJECT with a confidence score and an
 * interview stage.
 * <p>
 * Bands are closed below and open above: [proceed, 100] PROCEED, [hold, proceed) HOLD,
 * [0, hold) REJECT. A processing fault never produces REJECT: when the error signal is set,
 * or scoring came back empty or all zero, a numeric REJECT is raised to HOLD and a
 * data-quality note records the override.
 */
@Slf4j
@Service
public class DecisionClassifier {

    static final String PASSED_ASSESSMENT = "Passed technical assessment";

    private final DecisionConfig config;

    public DecisionClassifier(DecisionConfig config) {
        if (config.getHoldThreshold() < 0 || config.getHoldThreshold() >= config.getProceedThreshold()
                || config.getProceedThreshold() > 100) {
            throw new IllegalStateException(String.format(
                    "Decision thresholds must satisfy 0 <= hold < proceed <= 100 (hold=%s, proceed=%s)",
                    config.getHoldThreshold(), config.getProceedThreshold()));
        }
        this.config = config;
    }

    public Decision classify(MatchAnalysis analysis, AssessmentReport report, boolean errorSignal) {
        return classify(analysis, report, errorSignal, null);
    }

    /**
     * Classify one candidate.
     *
     * @param analysis    the match analysis; {@code null} is treated as nothing assessed
     * @param report      the assessment report, or {@code null} when no assessment was taken
     * @param errorSignal set when an upstream stage failed
     * @param requirement the requirement, used for skill verification; may be {@code null}
     * @return the decision
     */
    public Decision classify(MatchAnalysis analysis, AssessmentReport report, boolean errorSignal,
            JobRequirement requirement) {
        MatchAnalysis match = analysis != null ? analysis : MatchAnalysis.builder().build();
        List<String> notes = new ArrayList<>();
        if (analysis == null) {
            notes.add("No match analysis was available; classification treats every category as not assessed");
        }

        List<CategoryScore> assessed = match.categories().values().stream()
                .filter(CategoryScore::assessed)
                .toList();
        boolean noneAssessed = assessed.isEmpty();
        boolean assessedAllZero = !noneAssessed && assessed.stream().allMatch(score -> score.score() == 0);

        double overall = match.overallScore();
        double confidence = overall;
        if (errorSignal || match.allCategoriesAssessedAsZero()) {
            confidence -= config.getErrorPenalty();
        }
        if (match.anyCategoryNotAssessed()) {
            confidence -= config.getNotAssessedPenalty();
        }
        confidence = CategoryScore.clamp(confidence);

        DecisionStatus status = statusFor(overall);
        boolean overridden = false;
        if (status == DecisionStatus.REJECT && (errorSignal || assessedAllZero || noneAssessed)) {
            overridden = true;
            status = DecisionStatus.HOLD;
            notes.add(String.format("Score %d would reject, but %s; raised to HOLD pending manual review",
                    match.overallScore(), overrideReason(errorSignal, noneAssessed)));
            log.warn("REJECT overridden to HOLD: errorSignal={}, noneAssessed={}, allZero={}",
                    errorSignal, noneAssessed, assessedAllZero);
        }
        if (errorSignal) {
            notes.add("An upstream processing error occurred; confidence reduced by " + config.getErrorPenalty());
        }
        notes.addAll(match.dataQualityNotes());
        if (report != null) {
            notes.addAll(report.dataQualityNotes());
        }

        InterviewStage stage = stageFor(status, confidence);

        Decision decision = Decision.builder()
                .decision(new Decision.Details(status, confidence, stage))
                .rationale(rationale(match, report, errorSignal))
                .recommendations(recommendations(match, report, requirement))
                .hiringManagerNotes(DecisionTemplates.hiringManagerNotes(status, stage, overridden))
                .nextSteps(DecisionTemplates.nextSteps(status, stage, overridden))
                .dataQualityNotes(notes)
                .build();

        log.debug("Classified score {} as {} / {} (confidence {})", overall, status, stage, confidence);
        return decision;
    }

    public DecisionStatus statusFor(double overallScore) {
        if (overallScore >= config.getProceedThreshold()) {
            return DecisionStatus.PROCEED;
        }
        if (overallScore >= config.getHoldThreshold()) {
            return DecisionStatus.HOLD;
        }
        return DecisionStatus.REJECT;
    }

    public InterviewStage stageFor(DecisionStatus status, double confidence) {
        return switch (status) {
            case PROCEED -> confidence >= config.getFullLoopConfidence()
                    ? InterviewStage.FULL_LOOP
                    : InterviewStage.TECHNICAL;
            case HOLD -> InterviewStage.SCREENING;
            case REJECT -> InterviewStage.SKIP;
        };
    }

    private String overrideReason(boolean errorSignal, boolean noneAssessed) {
        if (errorSignal) {
            return "an upstream processing error occurred";
        }
        return noneAssessed ? "no category was assessed" : "every assessed category scored exactly 0";
    }

    private Decision.Rationale rationale(MatchAnalysis match, AssessmentReport report, boolean errorSignal) {
        List<String> strengths = new ArrayList<>(match.keyStrengths());
        List<String> concerns = new ArrayList<>();
        List<String> risks = new ArrayList<>();

        for (CategoryScore score : match.categories().values()) {
            boolean risky = !score.assessed() || score.score() < config.getHoldThreshold();
            for (String gap : score.gaps()) {
                String entry = CategoryScore.NOT_ASSESSED_GAP.equals(gap) ? score.category() + " " + gap : gap;
                (risky ? risks : concerns).add(entry);
            }
        }

        if (report != null) {
            if (report.passed()) {
                strengths.add(PASSED_ASSESSMENT);
            } else {
                concerns.add(String.format("Failed technical assessment (%.1f/100)%s", report.overallScore(),
                        report.weakestCategory() != null
                                ? "; weakest area: " + report.weakestCategory().label()
                                : ""));
            }
        }
        if (errorSignal) {
            risks.add("Category scoring failed upstream; scores may not reflect the candidate");
        }
        return new Decision.Rationale(strengths, concerns, risks);
    }

    private Decision.Recommendations recommendations(MatchAnalysis match, AssessmentReport report,
            JobRequirement requirement) {
        Set<String> focus = new LinkedHashSet<>();
        match.categories().values().stream()
                .sorted(Comparator.comparingDouble(CategoryScore::score)
                        .thenComparing(score -> score.category().ordinal()))
                .limit(2)
                .forEach(score -> {
                    if (!score.assessed()) {
                        focus.add("Assess " + score.category() + " directly; it was not scored");
                    }
                    score.gaps().stream()
                            .filter(gap -> !CategoryScore.NOT_ASSESSED_GAP.equals(gap))
                            .forEach(focus::add);
                });
        if (report != null && report.weakestCategory() != null) {
            focus.add(report.weakestCategory().label() + " (weakest assessment area)");
        }

        Set<String> verification = new LinkedHashSet<>(categoryMatches(match, MatchCategory.SKILLS));
        if (requirement != null) {
            verification.addAll(requirement.requiredSkills());
        }

        Set<String> discussion = new LinkedHashSet<>(categoryMatches(match, MatchCategory.EXPERIENCE));
        discussion.addAll(categoryMatches(match, MatchCategory.ADDITIONAL));

        return new Decision.Recommendations(List.copyOf(focus), List.copyOf(verification), List.copyOf(discussion));
    }

    private List<String> categoryMatches(MatchAnalysis match, MatchCategory category) {
        CategoryScore score = match.category(category);
        return score != null ? score.matches() : List.of();
    }
}
