package dev.candidateeval.metrics;

import dev.candidateeval.model.EvaluationResult;
import dev.candidateeval.model.StageResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for candidate evaluation runs.
 */
@Component
public class EvaluationMetrics {

    private static final String TAG_STATUS = "status";

    private final MeterRegistry registry;

    private final Counter evaluationsStartedCounter;
    private final Timer pipelineTimer;

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger lastMatchScore = new AtomicInteger(0);

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.evaluationsStartedCounter = Counter.builder("candidate_evaluator_evaluations_started_total")
                .description("Total candidate pipelines started")
                .register(registry);

        this.pipelineTimer = Timer.builder("candidate_evaluator_pipeline_duration")
                .description("Time to evaluate one candidate")
                .register(registry);

        Gauge.builder("candidate_evaluator_pipelines_in_flight", inFlight, AtomicInteger::get)
                .description("Candidate pipelines currently running")
                .register(registry);

        Gauge.builder("candidate_evaluator_last_match_score", lastMatchScore, AtomicInteger::get)
                .description("Overall match score of the last evaluated candidate")
                .register(registry);
    }

    public void recordStarted() {
        evaluationsStartedCounter.increment();
        inFlight.incrementAndGet();
    }

    /**
     * Record a finished pipeline: run status, decision status, stage failures and duration.
     */
    public void recordFinished(EvaluationResult result, Duration duration) {
        pipelineTimer.record(duration);
        recordOutcome(result);
    }

    /**
     * A pipeline stopped running, whether it completed, failed or was cancelled.
     */
    public void recordEnded() {
        inFlight.decrementAndGet();
    }

    /**
     * Record run status, decision status and stage failures of a result.
     */
    public void recordOutcome(EvaluationResult result) {
        Counter.builder("candidate_evaluator_evaluations_completed_total")
                .tag(TAG_STATUS, result.status().name())
                .register(registry)
                .increment();

        if (result.decision() != null) {
            Counter.builder("candidate_evaluator_decisions_total")
                    .tag(TAG_STATUS, result.decision().status().name())
                    .register(registry)
                    .increment();
        }
        if (result.matchAnalysis() != null) {
            lastMatchScore.set(result.matchAnalysis().overallScore());
        }
        for (StageResult<?> failure : result.failures()) {
            recordStageFailure(failure);
        }
    }

    public void recordStageFailure(StageResult<?> failure) {
        Counter.builder("candidate_evaluator_stage_failures_total")
                .tag("stage", failure.stage().name())
                .tag("kind", failure.failureKind().name())
                .register(registry)
                .increment();
    }

    public int getInFlight() {
        return inFlight.get();
    }
}
