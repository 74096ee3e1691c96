package dev.candidateeval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * Classified hiring outcome. Built once per pipeline run and never mutated; a changed
 * precursor produces a new decision.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Decision(
        Details decision,
        Rationale rationale,
        Recommendations recommendations,
        HiringManagerNotes hiringManagerNotes,
        NextSteps nextSteps,
        List<String> dataQualityNotes) {

    public Decision {
        dataQualityNotes = dataQualityNotes == null ? List.of() : List.copyOf(dataQualityNotes);
    }

    @JsonIgnore
    public DecisionStatus status() {
        return decision.status();
    }

    @JsonIgnore
    public double confidenceScore() {
        return decision.confidenceScore();
    }

    @JsonIgnore
    public InterviewStage interviewStage() {
        return decision.interviewStage();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Details(DecisionStatus status, double confidenceScore, InterviewStage interviewStage) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Rationale(List<String> keyStrengths, List<String> concerns, List<String> riskFactors) {
        public Rationale {
            keyStrengths = List.copyOf(keyStrengths);
            concerns = List.copyOf(concerns);
            riskFactors = List.copyOf(riskFactors);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Recommendations(List<String> interviewFocus, List<String> skillVerification,
            List<String> discussionPoints) {
        public Recommendations {
            interviewFocus = List.copyOf(interviewFocus);
            skillVerification = List.copyOf(skillVerification);
            discussionPoints = List.copyOf(discussionPoints);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HiringManagerNotes(String salaryBandFit, String growthTrajectory, String teamFitConsiderations,
            List<String> onboardingRequirements) {
        public HiringManagerNotes {
            onboardingRequirements = List.copyOf(onboardingRequirements);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record NextSteps(List<String> immediateActions, List<String> requiredApprovals,
            String timelineRecommendation) {
        public NextSteps {
            immediateActions = List.copyOf(immediateActions);
            requiredApprovals = List.copyOf(requiredApprovals);
        }
    }
}
