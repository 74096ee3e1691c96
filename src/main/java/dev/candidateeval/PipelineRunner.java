package dev.candidateeval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.candidateeval.config.MatchingWeights;
import dev.candidateeval.error.WeightConfigurationException;
import dev.candidateeval.model.CandidateInput;
import dev.candidateeval.model.EvaluationResult;
import dev.candidateeval.report.ArtifactWriter;
import dev.candidateeval.service.EvaluationPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Orchestrates one command-line evaluation: argument parsing, input loading, the pipeline and
 * artifact writing.
 * Separated from the main Application class for better testability and SRP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

    private static final String SEPARATOR = "========================================";

    private final EvaluationPipelineService pipelineService;
    private final ArtifactWriter artifactWriter;
    private final MatchingWeights matchingWeights;
    private final ObjectMapper objectMapper;

    @Value("${evaluator.metrics-wait-seconds:0}")
    private int metricsWaitSeconds;

    /**
     * Executes the evaluation and handles the post-execution wait.
     *
     * @param args raw program arguments
     * @return the process exit code
     */
    public int execute(String... args) {
        log.info(SEPARATOR);
        log.info("Candidate Evaluator Starting");
        log.info(SEPARATOR);

        EvaluationCommand command;
        MatchingWeights weights;
        CandidateInput input;
        try {
            command = EvaluationCommand.parse(args);
            weights = command.weights() != null ? MatchingWeights.parse(command.weights()) : matchingWeights;
            input = readInput(command);
        } catch (IllegalArgumentException | WeightConfigurationException e) {
            log.error("Invalid invocation: {}", e.getMessage());
            log.info(EvaluationCommand.USAGE);
            return ExitManager.USAGE_ERROR;
        } catch (IOException e) {
            log.error("Cannot read input: {}", e.getMessage());
            return ExitManager.USAGE_ERROR;
        }

        try {
            EvaluationResult result = pipelineService.evaluate(input, weights).block();
            if (result == null) {
                throw new IllegalStateException("Pipeline produced no result");
            }
            artifactWriter.write(result, command.outputPrefix());

            log.info(SEPARATOR);
            log.info("Candidate Evaluator Completed: {}", result.status());
            if (result.decision() != null) {
                log.info("Decision: {} / {} (match score {})", result.decision().status(),
                        result.decision().interviewStage(),
                        result.matchAnalysis() != null ? result.matchAnalysis().overallScore() : "n/a");
            }
            log.info(SEPARATOR);

            handleMetricsWait();

            return result.exitCode();
        } catch (IOException e) {
            log.error("Candidate Evaluator failed writing artifacts: {}", e.getMessage(), e);
            throw new IllegalStateException("Artifact writing failed", e);
        }
    }

    private CandidateInput readInput(EvaluationCommand command) throws IOException {
        return CandidateInput.builder()
                .candidateId(command.candidateId() != null
                        ? command.candidateId()
                        : candidateIdFrom(command.profile()))
                .profile(readDocument(command.profile()))
                .requirement(readDocument(command.requirement()))
                .upstreamScores(command.scores() != null ? readDocument(command.scores()) : null)
                .assessment(command.assessment() != null ? readDocument(command.assessment()) : null)
                .build();
    }

    /**
     * Read a JSON document. Content that is not valid JSON is passed on as text so the stage
     * consuming it can record the failure.
     */
    private JsonNode readDocument(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("{} is not valid JSON: {}", path, e.getOriginalMessage());
            return TextNode.valueOf(content);
        }
    }

    private static String candidateIdFrom(Path profile) {
        String fileName = profile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private void handleMetricsWait() {
        if (metricsWaitSeconds > 0) {
            log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
            try {
                Thread.sleep(metricsWaitSeconds * 1000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Metrics wait interrupted");
            }
        }
    }
}
