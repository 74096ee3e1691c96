package dev.candidateeval.model;

public enum AssessmentStatus {
    PASS,
    FAIL
}
