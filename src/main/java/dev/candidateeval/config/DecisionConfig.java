package dev.candidateeval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Bands and confidence adjustments of the decision classifier.
 * Loaded from application.yml under 'decision' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "decision")
public class DecisionConfig {

    private double proceedThreshold = 70;
    private double holdThreshold = 40;
    private double fullLoopConfidence = 85;
    private double errorPenalty = 15;
    private double notAssessedPenalty = 10;
}
