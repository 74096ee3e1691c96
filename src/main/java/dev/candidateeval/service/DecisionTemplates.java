package dev.candidateeval.service;

import dev.candidateeval.model.Decision.HiringManagerNotes;
import dev.candidateeval.model.Decision.NextSteps;
import dev.candidateeval.model.DecisionStatus;
import dev.candidateeval.model.InterviewStage;

import java.util.List;

/**
 * Fixed hiring-manager notes and next steps per classification outcome.
 */
final class DecisionTemplates {

    private DecisionTemplates() {
    }

    static HiringManagerNotes hiringManagerNotes(DecisionStatus status, InterviewStage stage, boolean overridden) {
        if (overridden) {
            return new HiringManagerNotes(
                    "Unable to determine",
                    "Unable to determine",
                    "Manual assessment required",
                    List.of("Standard onboarding process"));
        }
        return switch (status) {
            case PROCEED -> stage == InterviewStage.FULL_LOOP
                    ? new HiringManagerNotes(
                            "Likely within or above the target band; confirm expectations early",
                            "Strong trajectory based on matched skills and experience",
                            "Validate collaboration style during the full interview loop",
                            List.of("Standard onboarding process", "Early ownership of a scoped project"))
                    : new HiringManagerNotes(
                            "Likely within the target band",
                            "Positive trajectory; confirm depth in the technical interview",
                            "Assess team fit alongside the technical interview",
                            List.of("Standard onboarding process", "Mentoring on areas raised in the analysis"));
            case HOLD -> new HiringManagerNotes(
                    "To be determined after screening",
                    "Unclear; the screening should establish depth of experience",
                    "Evaluate during the screening call",
                    List.of("Standard onboarding process", "Targeted training for identified gaps"));
            case REJECT -> new HiringManagerNotes(
                    "Not applicable",
                    "Not aligned with the current role requirements",
                    "Not evaluated",
                    List.of());
        };
    }

    static NextSteps nextSteps(DecisionStatus status, InterviewStage stage, boolean overridden) {
        if (overridden) {
            return new NextSteps(
                    List.of("Re-run analysis or manually review"),
                    List.of("Hiring manager approval needed"),
                    "Proceed with caution due to data processing issues");
        }
        return switch (status) {
            case PROCEED -> stage == InterviewStage.FULL_LOOP
                    ? new NextSteps(
                            List.of("Schedule the full interview loop", "Share the interview focus areas with the panel"),
                            List.of("Hiring manager approval needed"),
                            "Schedule within 1 week")
                    : new NextSteps(
                            List.of("Schedule a technical interview", "Prepare skill verification exercises"),
                            List.of("Hiring manager approval needed"),
                            "Schedule within 1-2 weeks");
            case HOLD -> new NextSteps(
                    List.of("Schedule a screening call", "Clarify the concerns listed in the rationale"),
                    List.of("Recruiter review"),
                    "Revisit within 2 weeks");
            case REJECT -> new NextSteps(
                    List.of("Send a rejection notice", "Keep the profile on file for better-matching roles"),
                    List.of(),
                    "No further action");
        };
    }
}
