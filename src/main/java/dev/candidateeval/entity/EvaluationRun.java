package dev.candidateeval.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One row per candidate pipeline run. Failed and cancelled runs are recorded here too, so the
 * ledger is the run-level failure record.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "evaluation_runs", indexes = {
        @Index(name = "idx_candidate_id", columnList = "candidateId"),
        @Index(name = "idx_created_at", columnList = "createdAt")
})
public class EvaluationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String runId;

    @Column(nullable = false)
    private String candidateId;

    private String candidateName;

    @Column(nullable = false, length = 16)
    private String status;

    private Integer matchScore;

    @Column(length = 16)
    private String decisionStatus;

    private Double confidenceScore;

    @Column(length = 2000)
    private String failureReason;

    @Column(nullable = false)
    private int exitCode;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
