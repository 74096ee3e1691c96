package dev.candidateeval.model;

/**
 * Run-level outcome of one candidate pipeline and its CLI exit code.
 */
public enum RunStatus {
    /** Every stage produced its artifact. */
    COMPLETED(0),
    /** Ingestion failed; no decision was produced. */
    FAILED(1),
    /** At least one stage failed but a decision was still produced. */
    DEGRADED(2),
    /** The pipeline was cancelled before finishing. */
    CANCELLED(4);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
