package dev.candidateeval.service;

import dev.candidateeval.entity.EvaluationRun;
import dev.candidateeval.model.EvaluationResult;
import dev.candidateeval.repository.EvaluationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persists one ledger row per pipeline run using SQLite storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunLedgerService {

    private static final int MAX_REASON_LENGTH = 2000;

    private final EvaluationRunRepository evaluationRunRepository;

    /**
     * Record a finished run.
     *
     * @param result the pipeline result
     * @return the saved ledger row
     */
    @Transactional
    public EvaluationRun record(EvaluationResult result) {
        Optional<EvaluationRun> existing = evaluationRunRepository.findByRunId(result.runId());
        if (existing.isPresent()) {
            log.debug("Run {} already recorded", result.runId());
            return existing.get();
        }

        String reason = result.failureSummary();
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            reason = reason.substring(0, MAX_REASON_LENGTH);
        }

        EvaluationRun run = EvaluationRun.builder()
                .runId(result.runId())
                .candidateId(result.candidateId())
                .candidateName(result.candidateName())
                .status(result.status().name())
                .matchScore(result.matchAnalysis() != null ? result.matchAnalysis().overallScore() : null)
                .decisionStatus(result.decision() != null ? result.decision().status().name() : null)
                .confidenceScore(result.decision() != null ? result.decision().confidenceScore() : null)
                .failureReason(reason)
                .exitCode(result.exitCode())
                .createdAt(LocalDateTime.now())
                .build();

        EvaluationRun saved = evaluationRunRepository.save(run);
        log.info("Recorded run {} for '{}' with status {}", result.runId(), result.candidateId(), result.status());
        return saved;
    }

    /**
     * Ledger rows of one candidate, newest first.
     */
    public List<EvaluationRun> history(String candidateId) {
        return evaluationRunRepository.findByCandidateIdOrderByCreatedAtDesc(candidateId);
    }
}
