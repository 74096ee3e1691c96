package dev.candidateeval.service;

import dev.candidateeval.entity.EvaluationRun;
import dev.candidateeval.model.CandidateProfile;
import dev.candidateeval.model.Decision;
import dev.candidateeval.model.DecisionStatus;
import dev.candidateeval.model.EvaluationResult;
import dev.candidateeval.model.FailureKind;
import dev.candidateeval.model.InterviewStage;
import dev.candidateeval.model.MatchAnalysis;
import dev.candidateeval.model.PersonalInfo;
import dev.candidateeval.model.PipelineStage;
import dev.candidateeval.model.RunStatus;
import dev.candidateeval.model.StageResult;
import dev.candidateeval.repository.EvaluationRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunLedgerServiceTest {

    @Mock
    private EvaluationRunRepository evaluationRunRepository;

    @Captor
    private ArgumentCaptor<EvaluationRun> runCaptor;

    private RunLedgerService runLedgerService;

    @BeforeEach
    void setUp() {
        runLedgerService = new RunLedgerService(evaluationRunRepository);
    }

    @Nested
    @DisplayName("Recording runs")
    class RecordTests {

        @Test
        @DisplayName("Should store the outcome of a degraded run")
        void shouldRecordDegradedRun() {
            EvaluationResult result = EvaluationResult.builder()
                    .runId("run-1")
                    .candidateId("alice")
                    .status(RunStatus.DEGRADED)
                    .profile(CandidateProfile.builder()
                            .personalInfo(new PersonalInfo("Alice", "alice@example.com", null, null))
                            .build())
                    .matchAnalysis(MatchAnalysis.builder().overallScore(0).build())
                    .decision(Decision.builder()
                            .decision(new Decision.Details(DecisionStatus.HOLD, 0.0, InterviewStage.SCREENING))
                            .build())
                    .failures(List.of(StageResult.failed(PipelineStage.CATEGORY_SCORING,
                            FailureKind.EXTERNAL_SERVICE, "Generator returned HTTP 503")))
                    .build();
            when(evaluationRunRepository.findByRunId("run-1")).thenReturn(Optional.empty());
            when(evaluationRunRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

            runLedgerService.record(result);

            verify(evaluationRunRepository).save(runCaptor.capture());
            EvaluationRun run = runCaptor.getValue();
            assertThat(run.getCandidateName()).isEqualTo("Alice");
            assertThat(run.getStatus()).isEqualTo("DEGRADED");
            assertThat(run.getExitCode()).isEqualTo(2);
            assertThat(run.getMatchScore()).isZero();
            assertThat(run.getDecisionStatus()).isEqualTo("HOLD");
            assertThat(run.getFailureReason())
                    .isEqualTo("CATEGORY_SCORING EXTERNAL_SERVICE: Generator returned HTTP 503");
            assertThat(run.getCreatedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should truncate long failure reasons")
        void shouldTruncateReason() {
            EvaluationResult result = EvaluationResult.builder()
                    .runId("run-2")
                    .candidateId("bob")
                    .status(RunStatus.FAILED)
                    .failures(List.of(StageResult.failed(PipelineStage.INGESTION, FailureKind.PARSE,
                            "x".repeat(5000))))
                    .build();
            when(evaluationRunRepository.findByRunId("run-2")).thenReturn(Optional.empty());

            runLedgerService.record(result);

            verify(evaluationRunRepository).save(runCaptor.capture());
            assertThat(runCaptor.getValue().getFailureReason()).hasSize(2000);
            assertThat(runCaptor.getValue().getMatchScore()).isNull();
            assertThat(runCaptor.getValue().getDecisionStatus()).isNull();
        }

        @Test
        @DisplayName("Should not record the same run twice")
        void shouldSkipRecordedRun() {
            EvaluationRun existing = EvaluationRun.builder().runId("run-3").build();
            when(evaluationRunRepository.findByRunId("run-3")).thenReturn(Optional.of(existing));

            EvaluationRun recorded = runLedgerService.record(EvaluationResult.builder()
                    .runId("run-3")
                    .candidateId("carol")
                    .status(RunStatus.COMPLETED)
                    .build());

            assertThat(recorded).isSameAs(existing);
            verify(evaluationRunRepository, never()).save(any());
        }
    }

    @Test
    @DisplayName("Should return candidate history from the repository")
    void shouldReturnHistory() {
        EvaluationRun run = EvaluationRun.builder().runId("run-1").candidateId("alice").build();
        when(evaluationRunRepository.findByCandidateIdOrderByCreatedAtDesc("alice")).thenReturn(List.of(run));

        assertThat(runLedgerService.history("alice")).containsExactly(run);
    }
}
