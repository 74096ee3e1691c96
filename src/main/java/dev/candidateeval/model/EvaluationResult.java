package dev.candidateeval.model;

import lombok.Builder;

import java.util.List;

/**
 * Everything one pipeline run produced, including the failed stages.
 */
@Builder
public record EvaluationResult(
        String runId,
        String candidateId,
        RunStatus status,
        CandidateProfile profile,
        JobRequirement requirement,
        MatchAnalysis matchAnalysis,
        AssessmentReport assessmentReport,
        Decision decision,
        List<StageResult<?>> failures) {

    public EvaluationResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public int exitCode() {
        return status.exitCode();
    }

    public String candidateName() {
        return profile != null ? profile.candidateName() : null;
    }

    public String failureSummary() {
        return failures.stream()
                .map(StageResult::describeFailure)
                .reduce((a, b) -> a + "; " + b)
                .orElse(null);
    }
}
