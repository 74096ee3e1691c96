package dev.candidateeval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class CandidateEvaluatorApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(CandidateEvaluatorApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            int exitCode = pipelineRunner.execute(args);
            exitManager.exit(exitCode);
        } catch (Exception e) {
            log.error("Candidate Evaluator failed: {}", e.getMessage(), e);
            exitManager.exit(ExitManager.FAILED);
        }
    }
}
