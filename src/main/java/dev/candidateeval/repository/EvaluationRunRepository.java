package dev.candidateeval.repository;

import dev.candidateeval.entity.EvaluationRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the evaluation run ledger.
 */
@Repository
public interface EvaluationRunRepository extends JpaRepository<EvaluationRun, Long> {

    Optional<EvaluationRun> findByRunId(String runId);

    /**
     * Runs of one candidate, newest first.
     */
    List<EvaluationRun> findByCandidateIdOrderByCreatedAtDesc(String candidateId);
}
