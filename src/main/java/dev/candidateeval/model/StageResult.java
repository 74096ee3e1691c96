package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of one pipeline stage. A failed stage carries a {@code null} artifact together with
 * the failure kind and reason.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageResult<T>(
        PipelineStage stage,
        T artifact,
        FailureKind failureKind,
        String failureReason) {

    public static <T> StageResult<T> succeeded(PipelineStage stage, T artifact) {
        return new StageResult<>(stage, artifact, null, null);
    }

    public static <T> StageResult<T> failed(PipelineStage stage, FailureKind kind, String reason) {
        return new StageResult<>(stage, null, kind, reason);
    }

    @JsonIgnore
    public boolean hasFailed() {
        return failureKind != null;
    }

    public String describeFailure() {
        return stage + " " + failureKind + ": " + failureReason;
    }
}
