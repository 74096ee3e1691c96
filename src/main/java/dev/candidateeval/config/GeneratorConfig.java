package dev.candidateeval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration of the external content generator that supplies category scores.
 * Loaded from application.yml under 'generator' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "generator")
public class GeneratorConfig {

    /** none | openrouter */
    private String provider = "none";
    private String apiKey;
    private String model = "openai/o3-mini";
    private String baseUrl = "https://openrouter.ai/api/v1";
    private double temperature = 0.2;
    private int maxTokens = 2000;
    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(20);
        private Duration timeout = Duration.ofSeconds(60);
    }
}
