package dev.candidateeval.model;

public enum InterviewStage {
    SKIP,
    SCREENING,
    TECHNICAL,
    FULL_LOOP
}
