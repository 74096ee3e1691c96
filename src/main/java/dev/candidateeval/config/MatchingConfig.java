package dev.candidateeval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the weighted category matcher.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
            "skills", 0.40,
            "experience", 0.30,
            "education", 0.20,
            "additional", 0.10));
}
