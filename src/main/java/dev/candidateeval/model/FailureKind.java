package dev.candidateeval.model;

public enum FailureKind {
    PARSE,
    PARTIAL_DATA,
    EXTERNAL_SERVICE,
    TIMEOUT,
    VALIDATION,
    CANCELLED,
    INTERNAL
}
