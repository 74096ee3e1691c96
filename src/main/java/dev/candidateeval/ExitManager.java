package dev.candidateeval;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Manages application exit and the meaning of its exit codes.
 * Separated to allow mocking in tests and avoid killing the test runner.
 */
@Slf4j
@Component
public class ExitManager {

    public static final int SUCCESS = 0;
    public static final int FAILED = 1;
    public static final int DEGRADED = 2;
    public static final int USAGE_ERROR = 3;
    public static final int CANCELLED = 4;

    public void exit(int status) {
        log.info("Candidate Evaluator exiting with code {} ({})", status, describe(status));
        if (!isTest()) {
            System.exit(status);
        }
    }

    public static String describe(int status) {
        return switch (status) {
            case SUCCESS -> "all stages succeeded";
            case FAILED -> "no usable profile or fatal failure";
            case DEGRADED -> "decision produced with degraded stages";
            case USAGE_ERROR -> "usage or configuration error";
            case CANCELLED -> "cancelled";
            default -> "unexpected";
        };
    }

    protected boolean isTest() {
        String cp = System.getProperty("java.class.path", "");
        return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
    }
}
