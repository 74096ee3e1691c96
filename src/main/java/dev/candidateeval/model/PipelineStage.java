package dev.candidateeval.model;

/**
 * Stages of one candidate's evaluation pipeline, in execution order.
 */
public enum PipelineStage {
    INGESTION,
    CATEGORY_SCORING,
    MATCHING,
    ASSESSMENT,
    DECISION
}
