package dev.candidateeval.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.candidateeval.config.MatchingWeights;
import dev.candidateeval.config.PipelineConfig;
import dev.candidateeval.error.EvaluationException;
import dev.candidateeval.error.ProfileParseException;
import dev.candidateeval.generator.CategoryScoreGenerator;
import dev.candidateeval.generator.GeneratedScores;
import dev.candidateeval.generator.UpstreamMatchParser;
import dev.candidateeval.ingest.AssessmentReader;
import dev.candidateeval.ingest.ParsedAssessment;
import dev.candidateeval.ingest.ProfileIngestionService;
import dev.candidateeval.ingest.RequirementIngestionService;
import dev.candidateeval.metrics.EvaluationMetrics;
import dev.candidateeval.model.AssessmentReport;
import dev.candidateeval.model.CandidateInput;
import dev.candidateeval.model.CandidateProfile;
import dev.candidateeval.model.Decision;
import dev.candidateeval.model.EvaluationResult;
import dev.candidateeval.model.FailureKind;
import dev.candidateeval.model.JobRequirement;
import dev.candidateeval.model.MatchAnalysis;
import dev.candidateeval.model.PipelineStage;
import dev.candidateeval.model.RunStatus;
import dev.candidateeval.model.StageResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Runs the evaluation pipeline of one or many candidates.
 * <p>
 * Stages: INGESTION, then the category scoring and matching branch zipped with the assessment
 * branch, then DECISION. Every stage outcome goes through the {@link CandidateResultCache}.
 * A failed stage is recorded with its failure kind and later stages run on what exists; only
 * an ingestion failure stops the candidate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationPipelineService {

    private static final String SEPARATOR = "========================================";

    // Scoring failures that mean "the pipeline broke" rather than "data was missing"
    private static final Set<FailureKind> ERROR_SIGNAL_KINDS = EnumSet.of(
            FailureKind.EXTERNAL_SERVICE, FailureKind.TIMEOUT, FailureKind.VALIDATION, FailureKind.INTERNAL);

    private final ProfileIngestionService profileIngestionService;
    private final RequirementIngestionService requirementIngestionService;
    private final AssessmentReader assessmentReader;
    private final CategoryScoreGenerator categoryScoreGenerator;
    private final UpstreamMatchParser upstreamMatchParser;
    private final WeightedCategoryMatcher matcher;
    private final AssessmentScorer assessmentScorer;
    private final DecisionClassifier classifier;
    private final CandidateResultCache cache;
    private final RunLedgerService runLedgerService;
    private final EvaluationMetrics metrics;
    private final MatchingWeights defaultWeights;
    private final PipelineConfig pipelineConfig;

    // Keyed by run id; one candidate may have several runs in flight
    private final Map<String, Cancellation> cancellations = new ConcurrentHashMap<>();

    private record Ingested(CandidateProfile profile, JobRequirement requirement) {
    }

    private record Run(String runId, String candidateId) {
    }

    private record Cancellation(String candidateId, Sinks.One<Boolean> signal) {
    }

    public Mono<EvaluationResult> evaluate(CandidateInput input) {
        return evaluate(input, defaultWeights);
    }

    /**
     * Evaluate one candidate.
     *
     * @param input   raw documents of the candidate
     * @param weights matcher weights for this run
     * @return Mono with the result; never errors for stage failures, which are recorded instead
     */
    public Mono<EvaluationResult> evaluate(CandidateInput input, MatchingWeights weights) {
        String candidateId = input.candidateId() != null ? input.candidateId() : UUID.randomUUID().toString();
        String runId = UUID.randomUUID().toString();
        Run run = new Run(runId, candidateId);
        Sinks.One<Boolean> cancelSignal = Sinks.one();

        return Mono.defer(() -> {
                    long start = System.nanoTime();
                    cancellations.put(runId, new Cancellation(candidateId, cancelSignal));
                    cache.begin(runId, candidateId);
                    metrics.recordStarted();
                    log.info("Evaluating candidate '{}' (run {})", candidateId, runId);

                    return runStages(run, input, weights)
                            .map(status -> assemble(run, status))
                            .doOnNext(result -> metrics.recordFinished(result,
                                    Duration.ofNanos(System.nanoTime() - start)))
                            .doFinally(signal -> metrics.recordEnded());
                })
                .doOnCancel(() -> cache.markCancelled(runId))
                .takeUntilOther(cancelSignal.asMono())
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    EvaluationResult result = cancelled(run);
                    metrics.recordOutcome(result);
                    return result;
                }))
                .doOnNext(result -> release(runId))
                .flatMap(this::recordInLedger)
                .doFinally(signal -> release(runId));
    }

    public Flux<EvaluationResult> evaluateAll(List<CandidateInput> inputs) {
        return evaluateAll(inputs, defaultWeights);
    }

    /**
     * Evaluate independent candidates concurrently, bounded by {@code pipeline.concurrency}.
     * Results are emitted in completion order.
     */
    public Flux<EvaluationResult> evaluateAll(List<CandidateInput> inputs, MatchingWeights weights) {
        log.info(SEPARATOR);
        log.info("Evaluating {} candidates (concurrency {})", inputs.size(), pipelineConfig.getConcurrency());
        log.info(SEPARATOR);
        return Flux.fromIterable(inputs)
                .flatMap(input -> evaluate(input, weights), Math.max(1, pipelineConfig.getConcurrency()));
    }

    /**
     * Cancel every running pipeline of one candidate. Other candidates are not affected.
     *
     * @return true if at least one running pipeline was signalled
     */
    public boolean cancel(String candidateId) {
        boolean signalled = false;
        for (String runId : activeRuns(candidateId)) {
            signalled |= cancelRun(runId);
        }
        return signalled;
    }

    /**
     * Cancel a single run. Other runs of the same candidate keep going.
     *
     * @return true if the run was still running and got signalled
     */
    public boolean cancelRun(String runId) {
        Cancellation cancellation = cancellations.get(runId);
        return cancellation != null && cancellation.signal().tryEmitValue(Boolean.TRUE).isSuccess();
    }

    /**
     * Ids of the runs of a candidate that are still in flight.
     */
    public List<String> activeRuns(String candidateId) {
        return cancellations.entrySet().stream()
                .filter(entry -> entry.getValue().candidateId().equals(candidateId))
                .map(Map.Entry::getKey)
                .toList();
    }

    private Mono<RunStatus> runStages(Run run, CandidateInput input, MatchingWeights weights) {
        Ingested ingested;
        try {
            ingested = new Ingested(
                    profileIngestionService.parseProfile(input.profile()),
                    requirementIngestionService.parseRequirement(input.requirement()));
            cache.record(run.runId(), StageResult.succeeded(PipelineStage.INGESTION, ingested));
        } catch (ProfileParseException e) {
            log.error("Ingestion failed for '{}': {}", run.candidateId(), e.getMessage());
            cache.record(run.runId(), failure(PipelineStage.INGESTION, e));
            return Mono.just(RunStatus.FAILED);
        }

        Mono<Optional<MatchAnalysis>> matchBranch = scoreCategories(run, input.upstreamScores(), ingested)
                .map(scoring -> match(run, ingested.requirement(), scoring, weights));
        Mono<Optional<AssessmentReport>> assessmentBranch = scoreAssessment(run, input.assessment());

        return Mono.zip(matchBranch, assessmentBranch)
                .map(branches -> {
                    boolean errorSignal = hasErrorSignal(run);
                    decide(run, branches.getT1().orElse(null), branches.getT2().orElse(null),
                            errorSignal, ingested.requirement());
                    return runStatus(run);
                });
    }

    private Mono<StageResult<GeneratedScores>> scoreCategories(Run run, JsonNode upstreamScores,
            Ingested ingested) {
        Mono<GeneratedScores> source = upstreamScores != null && !upstreamScores.isNull()
                ? Mono.fromCallable(() -> upstreamMatchParser.parse(upstreamScores))
                : categoryScoreGenerator.generate(ingested.profile(), ingested.requirement());

        return source
                .map(scores -> StageResult.succeeded(PipelineStage.CATEGORY_SCORING, scores))
                .onErrorResume(e -> {
                    log.warn("Category scoring failed for '{}': {}", run.candidateId(), describe(e));
                    StageResult<GeneratedScores> failed = failure(PipelineStage.CATEGORY_SCORING, e);
                    return Mono.just(failed);
                })
                .doOnNext(result -> cache.record(run.runId(), result));
    }

    private Optional<MatchAnalysis> match(Run run, JobRequirement requirement,
            StageResult<GeneratedScores> scoring, MatchingWeights weights) {
        try {
            GeneratedScores scores = scoring.hasFailed() ? new GeneratedScores(Map.of(), null, List.of())
                    : scoring.artifact();
            List<String> notes = new ArrayList<>(scores.notes());
            if (scoring.hasFailed()) {
                notes.add("Category scoring failed (" + scoring.failureKind() + "): " + scoring.failureReason());
            }
            MatchAnalysis analysis = matcher.computeMatch(requirement, scores.categories(), weights)
                    .withDataQualityNotes(notes);
            if (scores.upstreamOverall() != null && scores.upstreamOverall() != analysis.overallScore()) {
                log.debug("Upstream overall {} differs from weighted overall {} for '{}'",
                        scores.upstreamOverall(), analysis.overallScore(), run.candidateId());
            }
            cache.record(run.runId(), StageResult.succeeded(PipelineStage.MATCHING, analysis));
            return Optional.of(analysis);
        } catch (RuntimeException e) {
            log.warn("Matching failed for '{}': {}", run.candidateId(), describe(e));
            cache.record(run.runId(), failure(PipelineStage.MATCHING, e));
            return Optional.empty();
        }
    }

    private Mono<Optional<AssessmentReport>> scoreAssessment(Run run, JsonNode assessment) {
        if (assessment == null || assessment.isNull()) {
            return Mono.just(Optional.empty());
        }
        return Mono.fromCallable(() -> {
                    ParsedAssessment parsed = assessmentReader.readAssessment(assessment);
                    return assessmentScorer.scoreAssessment(parsed.questions(), parsed.notes());
                })
                .map(report -> {
                    cache.record(run.runId(), StageResult.succeeded(PipelineStage.ASSESSMENT, report));
                    return Optional.of(report);
                })
                .onErrorResume(e -> {
                    log.warn("Assessment scoring failed for '{}': {}", run.candidateId(), describe(e));
                    cache.record(run.runId(), failure(PipelineStage.ASSESSMENT, e));
                    return Mono.just(Optional.empty());
                });
    }

    private void decide(Run run, MatchAnalysis analysis, AssessmentReport report, boolean errorSignal,
            JobRequirement requirement) {
        try {
            Decision decision = classifier.classify(analysis, report, errorSignal, requirement);
            cache.record(run.runId(), StageResult.succeeded(PipelineStage.DECISION, decision));
            log.info("Candidate '{}': {} / {} (confidence {})", run.candidateId(), decision.status(),
                    decision.interviewStage(), String.format("%.1f", decision.confidenceScore()));
        } catch (RuntimeException e) {
            log.error("Decision failed for '{}': {}", run.candidateId(), describe(e), e);
            cache.record(run.runId(), failure(PipelineStage.DECISION, e));
        }
    }

    private boolean hasErrorSignal(Run run) {
        return cache.stages(run.runId()).values().stream()
                .filter(StageResult::hasFailed)
                .anyMatch(result -> result.stage() == PipelineStage.MATCHING
                        || (result.stage() == PipelineStage.CATEGORY_SCORING
                                && ERROR_SIGNAL_KINDS.contains(result.failureKind())));
    }

    private RunStatus runStatus(Run run) {
        Map<PipelineStage, StageResult<?>> stages = cache.stages(run.runId());
        boolean anyFailed = stages.values().stream().anyMatch(StageResult::hasFailed);
        boolean partialMatch = cache.get(run.runId(), PipelineStage.MATCHING)
                .map(StageResult::artifact)
                .map(MatchAnalysis.class::cast)
                .map(MatchAnalysis::anyCategoryNotAssessed)
                .orElse(false);
        return anyFailed || partialMatch ? RunStatus.DEGRADED : RunStatus.COMPLETED;
    }

    private EvaluationResult assemble(Run run, RunStatus status) {
        if (!cache.finish(run.runId(), status)) {
            return cancelled(run);
        }
        Map<PipelineStage, StageResult<?>> stages = cache.stages(run.runId());
        Ingested ingested = artifact(stages, PipelineStage.INGESTION, Ingested.class);

        EvaluationResult result = EvaluationResult.builder()
                .runId(run.runId())
                .candidateId(run.candidateId())
                .status(status)
                .profile(ingested != null ? ingested.profile() : null)
                .requirement(ingested != null ? ingested.requirement() : null)
                .matchAnalysis(artifact(stages, PipelineStage.MATCHING, MatchAnalysis.class))
                .assessmentReport(artifact(stages, PipelineStage.ASSESSMENT, AssessmentReport.class))
                .decision(artifact(stages, PipelineStage.DECISION, Decision.class))
                .failures(stages.values().stream().filter(StageResult::hasFailed).toList())
                .build();

        if (status != RunStatus.COMPLETED) {
            log.warn("Candidate '{}' finished {}: {}", run.candidateId(), status, result.failureSummary());
        }
        return result;
    }

    /**
     * Result of a cancelled run: completed stages keep their artifacts, every other stage is
     * reported as cancelled.
     */
    private EvaluationResult cancelled(Run run) {
        cache.markCancelled(run.runId());
        Map<PipelineStage, StageResult<?>> stages = cache.stages(run.runId());
        List<StageResult<?>> failures = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            StageResult<?> recorded = stages.get(stage);
            if (recorded == null) {
                failures.add(StageResult.failed(stage, FailureKind.CANCELLED, "Pipeline cancelled"));
            } else if (recorded.hasFailed()) {
                failures.add(recorded);
            }
        }
        Ingested ingested = artifact(stages, PipelineStage.INGESTION, Ingested.class);
        return EvaluationResult.builder()
                .runId(run.runId())
                .candidateId(run.candidateId())
                .status(RunStatus.CANCELLED)
                .profile(ingested != null ? ingested.profile() : null)
                .requirement(ingested != null ? ingested.requirement() : null)
                .matchAnalysis(artifact(stages, PipelineStage.MATCHING, MatchAnalysis.class))
                .assessmentReport(artifact(stages, PipelineStage.ASSESSMENT, AssessmentReport.class))
                .decision(artifact(stages, PipelineStage.DECISION, Decision.class))
                .failures(failures)
                .build();
    }

    // The result is assembled; nothing reads the run's stages any more
    private void release(String runId) {
        cancellations.remove(runId);
        cache.evict(runId);
    }

    private Mono<EvaluationResult> recordInLedger(EvaluationResult result) {
        return Mono.fromCallable(() -> runLedgerService.record(result))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(result)
                .onErrorResume(e -> {
                    log.error("Could not record run {} in the ledger: {}", result.runId(), e.getMessage(), e);
                    return Mono.just(result);
                });
    }

    private static <T> T artifact(Map<PipelineStage, StageResult<?>> stages, PipelineStage stage, Class<T> type) {
        StageResult<?> result = stages.get(stage);
        return result != null && type.isInstance(result.artifact()) ? type.cast(result.artifact()) : null;
    }

    static <T> StageResult<T> failure(PipelineStage stage, Throwable error) {
        return StageResult.failed(stage, failureKind(error), describe(error));
    }

    static FailureKind failureKind(Throwable error) {
        if (error instanceof EvaluationException evaluationException) {
            return evaluationException.failureKind();
        }
        if (error instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        return FailureKind.INTERNAL;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
