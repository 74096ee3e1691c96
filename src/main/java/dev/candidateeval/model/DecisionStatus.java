package dev.candidateeval.model;

public enum DecisionStatus {
    PROCEED,
    HOLD,
    REJECT
}
