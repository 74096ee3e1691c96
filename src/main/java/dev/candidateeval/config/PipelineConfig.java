package dev.candidateeval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Loaded from application.yml under 'pipeline' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineConfig {

    /** Candidates evaluated concurrently by a batch run. */
    private int concurrency = 4;
}
