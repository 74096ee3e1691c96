package dev.candidateeval.ingest;

import dev.candidateeval.model.AssessmentQuestion;

import java.util.List;

/**
 * Questions read from an assessment document, plus notes about entries that had to be skipped.
 */
public record ParsedAssessment(List<AssessmentQuestion> questions, List<String> notes) {

    public ParsedAssessment {
        questions = questions == null ? List.of() : List.copyOf(questions);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
