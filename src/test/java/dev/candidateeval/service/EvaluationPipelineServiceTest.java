package dev.candidateeval.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candidateeval.config.AssessmentConfig;
import dev.candidateeval.config.DecisionConfig;
import dev.candidateeval.config.MatchingWeights;
import dev.candidateeval.config.PipelineConfig;
import dev.candidateeval.config.RetryPolicy;
import dev.candidateeval.error.ExternalServiceException;
import dev.candidateeval.error.PartialDataException;
import dev.candidateeval.generator.CategoryScoreGenerator;
import dev.candidateeval.generator.UpstreamMatchParser;
import dev.candidateeval.ingest.AssessmentReader;
import dev.candidateeval.ingest.ProfileIngestionService;
import dev.candidateeval.ingest.RequirementIngestionService;
import dev.candidateeval.metrics.EvaluationMetrics;
import dev.candidateeval.model.CandidateInput;
import dev.candidateeval.model.DecisionStatus;
import dev.candidateeval.model.EvaluationResult;
import dev.candidateeval.model.FailureKind;
import dev.candidateeval.model.InterviewStage;
import dev.candidateeval.model.PipelineStage;
import dev.candidateeval.model.RunStatus;
import dev.candidateeval.model.StageResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvaluationPipelineServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private CategoryScoreGenerator generator;

    @Mock
    private RunLedgerService runLedgerService;

    private EvaluationMetrics metrics;
    private CandidateResultCache cache;
    private EvaluationPipelineService service;

    @BeforeEach
    void setUp() {
        DecisionConfig decisionConfig = new DecisionConfig();
        PipelineConfig pipelineConfig = new PipelineConfig();
        pipelineConfig.setConcurrency(2);
        metrics = new EvaluationMetrics(new SimpleMeterRegistry());
        cache = new CandidateResultCache();

        service = new EvaluationPipelineService(
                new ProfileIngestionService(),
                new RequirementIngestionService(),
                new AssessmentReader(),
                generator,
                new UpstreamMatchParser(MAPPER),
                new WeightedCategoryMatcher(MatchingWeights.defaults(), decisionConfig),
                new AssessmentScorer(new AssessmentConfig()),
                new DecisionClassifier(decisionConfig),
                cache,
                runLedgerService,
                metrics,
                MatchingWeights.defaults(),
                pipelineConfig);
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static JsonNode profile(String name) {
        return json("""
                {
                  "personal_info": {"name": "%s", "email": "%s@example.com", "phone": "Not provided"},
                  "summary": "Backend engineer",
                  "skills": ["Java", "Spring", "SQL"],
                  "experience": [
                    {"title": "Engineer", "company": "Acme", "start_date": "2019-01", "end_date": "Present"}
                  ]
                }
                """.formatted(name, name.toLowerCase()));
    }

    private static JsonNode requirement() {
        return json("""
                {"title": "Backend Engineer", "required_skills": ["Java", "SQL"], "min_experience_years": 3}
                """);
    }

    private static JsonNode scores(int skills, int experience, int education, int additional) {
        return json("""
                {
                  "match_score": 0,
                  "categories": {
                    "skills": {"score": %d, "matches": ["Java"], "gaps": []},
                    "experience": {"score": %d, "matches": [], "gaps": []},
                    "education": {"score": %d, "matches": [], "gaps": []},
                    "additional": {"score": %d, "matches": [], "gaps": []}
                  }
                }
                """.formatted(skills, experience, education, additional));
    }

    private static CandidateInput input(String id, JsonNode profile, JsonNode upstreamScores) {
        return CandidateInput.builder()
                .candidateId(id)
                .profile(profile)
                .requirement(requirement())
                .upstreamScores(upstreamScores)
                .build();
    }

    @Nested
    @DisplayName("Completed runs")
    class CompletedTests {

        @Test
        @DisplayName("Should complete with a decision when every stage succeeds")
        void shouldCompleteRun() {
            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), scores(90, 75, 80, 85))))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
                        assertThat(result.exitCode()).isZero();
                        assertThat(result.candidateName()).isEqualTo("Alice");
                        assertThat(result.matchAnalysis().overallScore()).isEqualTo(83);
                        assertThat(result.decision().status()).isEqualTo(DecisionStatus.PROCEED);
                        assertThat(result.decision().interviewStage()).isEqualTo(InterviewStage.TECHNICAL);
                        assertThat(result.failures()).isEmpty();
                    })
                    .verifyComplete();

            verify(runLedgerService).record(any());
            verifyNoInteractions(generator);
            assertThat(metrics.getInFlight()).isZero();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("Should score the assessment alongside the match")
        void shouldScoreAssessment() {
            CandidateInput withAssessment = CandidateInput.builder()
                    .candidateId("alice")
                    .profile(profile("Alice"))
                    .requirement(requirement())
                    .upstreamScores(scores(90, 75, 80, 85))
                    .assessment(json("""
                            {"question_scores": {"code_1": 80, "design_1": 70, "behavior_1": 90},
                             "passion_rating": 0.8}
                            """))
                    .build();

            StepVerifier.create(service.evaluate(withAssessment))
                    .assertNext(result -> {
                        assertThat(result.assessmentReport()).isNotNull();
                        assertThat(result.assessmentReport().overallScore()).isEqualTo(80.0);
                        assertThat(result.decision().rationale().keyStrengths())
                                .contains(DecisionClassifier.PASSED_ASSESSMENT);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should call the generator when no scores are supplied")
        void shouldUseGenerator() {
            when(generator.generate(any(), any())).thenReturn(Mono.fromCallable(
                    () -> new UpstreamMatchParser(MAPPER).parse(scores(90, 75, 80, 85))));

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), null)))
                    .assertNext(result -> assertThat(result.status()).isEqualTo(RunStatus.COMPLETED))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should fail the run when the profile has no contact")
        void shouldFailOnParseError() {
            JsonNode noContact = json("""
                    {"personal_info": {"name": "Bob", "email": "Not provided", "phone": "[Phone]"}}
                    """);

            StepVerifier.create(service.evaluate(input("bob", noContact, scores(90, 75, 80, 85))))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(RunStatus.FAILED);
                        assertThat(result.exitCode()).isEqualTo(1);
                        assertThat(result.decision()).isNull();
                        assertThat(result.failures()).singleElement().satisfies(failure -> {
                            assertThat(failure.stage()).isEqualTo(PipelineStage.INGESTION);
                            assertThat(failure.failureKind()).isEqualTo(FailureKind.PARSE);
                        });
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should degrade to HOLD when the generator fails")
        void shouldDegradeOnGeneratorFailure() {
            when(generator.generate(any(), any()))
                    .thenReturn(Mono.error(new ExternalServiceException("Generator returned HTTP 503", true)));

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), null)))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(RunStatus.DEGRADED);
                        assertThat(result.exitCode()).isEqualTo(2);
                        assertThat(result.matchAnalysis().overallScore()).isZero();
                        assertThat(result.decision().status()).isEqualTo(DecisionStatus.HOLD);
                        assertThat(result.decision().dataQualityNotes())
                                .anyMatch(note -> note.contains("upstream processing error"));
                        assertThat(result.failures()).extracting(StageResult::failureKind)
                                .containsExactly(FailureKind.EXTERNAL_SERVICE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should degrade to HOLD when the generator times out")
        void shouldDegradeOnGeneratorTimeout() {
            RetryPolicy shortPolicy = new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(20),
                    Duration.ofMillis(50));
            when(generator.generate(any(), any())).thenReturn(shortPolicy.apply(Mono.never()));

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), null)))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(RunStatus.DEGRADED);
                        assertThat(result.failures()).singleElement().satisfies(failure -> {
                            assertThat(failure.stage()).isEqualTo(PipelineStage.CATEGORY_SCORING);
                            assertThat(failure.failureKind()).isEqualTo(FailureKind.TIMEOUT);
                        });
                        assertThat(result.matchAnalysis().overallScore()).isZero();
                        assertThat(result.decision().status()).isEqualTo(DecisionStatus.HOLD);
                        assertThat(result.decision().dataQualityNotes())
                                .anyMatch(note -> note.startsWith("An upstream processing error occurred"));
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("Should degrade without an error signal when scores are simply missing")
        void shouldDegradeOnPartialData() {
            when(generator.generate(any(), any()))
                    .thenReturn(Mono.error(new PartialDataException("No category score generator configured")));

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), null)))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(RunStatus.DEGRADED);
                        assertThat(result.decision().status()).isEqualTo(DecisionStatus.HOLD);
                        assertThat(result.decision().dataQualityNotes())
                                .noneMatch(note -> note.startsWith("An upstream processing error occurred"));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should degrade when a category is missing from the scores")
        void shouldDegradeOnMissingCategory() {
            JsonNode partial = json("""
                    {"categories": {"skills": {"score": 90}, "experience": {"score": 80}, "education": {"score": 70}}}
                    """);

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), partial)))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(RunStatus.DEGRADED);
                        assertThat(result.failures()).isEmpty();
                        assertThat(result.matchAnalysis().anyCategoryNotAssessed()).isTrue();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should keep the result when the ledger write fails")
        void shouldSurviveLedgerFailure() {
            when(runLedgerService.record(any())).thenThrow(new IllegalStateException("database is locked"));

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), scores(90, 75, 80, 85))))
                    .assertNext(result -> assertThat(result.status()).isEqualTo(RunStatus.COMPLETED))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Should cancel a candidate waiting on the generator")
        void shouldCancelRunningCandidate() {
            when(generator.generate(any(), any())).thenReturn(Mono.never());

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), null)))
                    .then(() -> assertThat(service.cancel("alice")).isTrue())
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
                        assertThat(result.exitCode()).isEqualTo(4);
                        assertThat(result.profile()).isNotNull();
                        assertThat(result.decision()).isNull();
                        assertThat(result.failures()).extracting(StageResult::stage)
                                .containsExactly(PipelineStage.CATEGORY_SCORING, PipelineStage.MATCHING,
                                        PipelineStage.ASSESSMENT, PipelineStage.DECISION);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(service.activeRuns("alice")).isEmpty();
            assertThat(cache.size()).isZero();
            assertThat(metrics.getInFlight()).isZero();
        }

        @Test
        @DisplayName("Should cancel one run and leave the other run of the candidate alone")
        void shouldCancelSingleRun() {
            when(generator.generate(any(), any())).thenReturn(Mono.never());

            StepVerifier.create(service.evaluate(input("alice", profile("Alice"), null)))
                    .then(() -> {
                        EvaluationResult other = service
                                .evaluate(input("alice", profile("Alice"), scores(90, 75, 80, 85)))
                                .block(Duration.ofSeconds(5));
                        assertThat(other.status()).isEqualTo(RunStatus.COMPLETED);
                        assertThat(other.matchAnalysis().overallScore()).isEqualTo(83);

                        List<String> running = service.activeRuns("alice");
                        assertThat(running).hasSize(1);
                        assertThat(service.cancelRun(running.get(0))).isTrue();
                    })
                    .assertNext(result -> assertThat(result.status()).isEqualTo(RunStatus.CANCELLED))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("Should report false when the candidate is not running")
        void shouldIgnoreUnknownCandidate() {
            assertThat(service.cancel("nobody")).isFalse();
        }
    }

    @Nested
    @DisplayName("Batch runs")
    class BatchTests {

        @Test
        @DisplayName("Should evaluate candidates independently")
        void shouldEvaluateAll() {
            JsonNode broken = json("""
                    {"personal_info": {"email": "anon@example.com"}}
                    """);
            List<CandidateInput> inputs = List.of(
                    input("alice", profile("Alice"), scores(90, 75, 80, 85)),
                    input("anon", broken, scores(90, 75, 80, 85)),
                    input("carol", profile("Carol"), scores(20, 10, 30, 0)));

            StepVerifier.create(service.evaluateAll(inputs).collectList())
                    .assertNext(results -> {
                        assertThat(results).hasSize(3);
                        assertThat(results).filteredOn(r -> r.candidateId().equals("anon"))
                                .singleElement()
                                .satisfies(r -> assertThat(r.status()).isEqualTo(RunStatus.FAILED));
                        assertThat(results).filteredOn(r -> r.candidateId().equals("carol"))
                                .singleElement()
                                .satisfies(r -> assertThat(r.decision().status()).isEqualTo(DecisionStatus.REJECT));
                    })
                    .verifyComplete();

            verify(runLedgerService, times(3)).record(any());
        }

        @Test
        @DisplayName("Should keep overlapping runs of one candidate apart")
        void shouldSeparateRunsOfSameCandidate() {
            UpstreamMatchParser parser = new UpstreamMatchParser(MAPPER);
            when(generator.generate(any(), any())).thenReturn(Mono.delay(Duration.ofMillis(200))
                    .map(tick -> parser.parse(scores(90, 90, 90, 90))));
            List<CandidateInput> inputs = List.of(
                    input("alice", profile("Alice"), null),
                    input("alice", profile("Alice"), scores(20, 10, 30, 0)));

            StepVerifier.create(service.evaluateAll(inputs).collectList())
                    .assertNext(results -> {
                        assertThat(results).extracting(EvaluationResult::status)
                                .containsOnly(RunStatus.COMPLETED);
                        assertThat(results).extracting(EvaluationResult::runId).doesNotHaveDuplicates();
                        assertThat(results).extracting(r -> r.matchAnalysis().overallScore())
                                .containsExactlyInAnyOrder(90, 17);
                        assertThat(results).extracting(r -> r.decision().status())
                                .containsExactlyInAnyOrder(DecisionStatus.PROCEED, DecisionStatus.REJECT);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(cache.size()).isZero();
        }
    }
}
