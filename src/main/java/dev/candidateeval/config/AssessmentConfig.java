package dev.candidateeval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Thresholds for assessment scoring and the assessment report.
 * Loaded from application.yml under 'assessment' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "assessment")
public class AssessmentConfig {

    private double passThreshold = 60;

    // Per-question bullets in the report
    private double strongQuestionScore = 80;
    private double weakQuestionScore = 60;

    // Technical/passion rating bullets in the report
    private double strongRating = 0.8;
    private double weakRating = 0.5;

    private double highlightScore = 70;
    private double highlightRating = 0.7;
}
