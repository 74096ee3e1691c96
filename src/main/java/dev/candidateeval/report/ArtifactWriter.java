package dev.candidateeval.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.candidateeval.model.EvaluationResult;
import dev.candidateeval.model.FailureKind;
import dev.candidateeval.model.PipelineStage;
import dev.candidateeval.model.RunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the artifacts of one run next to the given output prefix:
 * {@code _parsed_resume.json}, {@code _match_analysis.json}, {@code _decision.json},
 * {@code _assessment_report.txt}, and {@code _run_failure.json} for failed or cancelled runs.
 * Only artifacts that exist are written.
 */
@Slf4j
@Component
public class ArtifactWriter {

    public static final String PARSED_RESUME_SUFFIX = "_parsed_resume.json";
    public static final String MATCH_ANALYSIS_SUFFIX = "_match_analysis.json";
    public static final String DECISION_SUFFIX = "_decision.json";
    public static final String ASSESSMENT_REPORT_SUFFIX = "_assessment_report.txt";
    public static final String RUN_FAILURE_SUFFIX = "_run_failure.json";

    private final ObjectWriter writer;
    private final AssessmentReportFormatter reportFormatter;

    public ArtifactWriter(ObjectMapper objectMapper, AssessmentReportFormatter reportFormatter) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.reportFormatter = reportFormatter;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record RunFailure(String runId, String candidateId, RunStatus status, int exitCode, List<Failure> failures,
            LocalDateTime recordedAt) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record Failure(PipelineStage stage, FailureKind failureKind, String failureReason) {
    }

    /**
     * Write every artifact the result carries.
     *
     * @param result the pipeline result
     * @param prefix output path prefix, e.g. {@code out/jane}
     * @return the files written, in writing order
     * @throws IOException if a file cannot be written
     */
    public List<Path> write(EvaluationResult result, String prefix) throws IOException {
        Path parent = Path.of(prefix).toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<Path> written = new ArrayList<>();
        if (result.profile() != null) {
            written.add(writeJson(prefix + PARSED_RESUME_SUFFIX, result.profile()));
        }
        if (result.matchAnalysis() != null) {
            written.add(writeJson(prefix + MATCH_ANALYSIS_SUFFIX, result.matchAnalysis()));
        }
        if (result.decision() != null) {
            written.add(writeJson(prefix + DECISION_SUFFIX, result.decision()));
        }
        if (result.assessmentReport() != null) {
            String text = reportFormatter.format(result.assessmentReport(), result.candidateName(), result.runId(),
                    LocalDateTime.now());
            Path path = Path.of(prefix + ASSESSMENT_REPORT_SUFFIX);
            Files.writeString(path, text + "\n", StandardCharsets.UTF_8);
            written.add(path);
        }
        if (result.status() == RunStatus.FAILED || result.status() == RunStatus.CANCELLED) {
            written.add(writeJson(prefix + RUN_FAILURE_SUFFIX, runFailure(result)));
        }

        written.forEach(path -> log.info("Wrote {}", path));
        return written;
    }

    private RunFailure runFailure(EvaluationResult result) {
        List<Failure> failures = result.failures().stream()
                .map(stage -> new Failure(stage.stage(), stage.failureKind(), stage.failureReason()))
                .toList();
        return new RunFailure(result.runId(), result.candidateId(), result.status(), result.exitCode(), failures,
                LocalDateTime.now());
    }

    private Path writeJson(String file, Object value) throws IOException {
        Path path = Path.of(file);
        writer.writeValue(path.toFile(), value);
        return path;
    }
}
