package dev.candidateeval.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import dev.candidateeval.error.PartialDataException;
import dev.candidateeval.model.AssessmentCategory;
import dev.candidateeval.model.AssessmentQuestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads scored assessment answers. Two shapes are accepted:
 * <ul>
 * <li>a question list, either top-level or under {@code questions}, with
 * {@code id, category, score, feedback, passion_signal} per entry;</li>
 * <li>an assessment result with {@code question_scores} and {@code feedback} maps keyed by
 * question id and a single {@code passion_rating}, applied to every behavioral answer.</li>
 * </ul>
 * The category of a question falls back to its id prefix ({@code code_}, {@code design_},
 * {@code behavior_}).
 */
@Slf4j
@Service
public class AssessmentReader {

    static final String NO_ANSWER_FEEDBACK = "No answer provided.";

    public ParsedAssessment readAssessment(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            throw new PartialDataException("Assessment document is empty");
        }

        List<String> notes = new ArrayList<>();
        List<AssessmentQuestion> questions;

        if (document.isArray()) {
            questions = readQuestionList(document, notes);
        } else if (document.has("questions")) {
            questions = readQuestionList(document.get("questions"), notes);
        } else if (document.has("question_scores")) {
            questions = readScoreMap(document, notes);
        } else {
            throw new PartialDataException("Assessment document has neither 'questions' nor 'question_scores'");
        }

        if (questions.isEmpty()) {
            throw new PartialDataException("Assessment contains no scorable questions");
        }
        log.debug("Read {} assessment questions ({} skipped)", questions.size(), notes.size());
        return new ParsedAssessment(questions, notes);
    }

    private List<AssessmentQuestion> readQuestionList(JsonNode array, List<String> notes) {
        List<AssessmentQuestion> questions = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return questions;
        }
        int index = 0;
        for (JsonNode node : array) {
            index++;
            if (!node.isObject()) {
                notes.add("Assessment entry " + index + " skipped: not an object");
                continue;
            }
            String id = JsonFields.text(node, "id", "question_id");
            if (id == null) {
                id = "question_" + index;
            }
            Optional<AssessmentCategory> category = resolveCategory(
                    JsonFields.text(node, "category", "type", "question_type"), id);
            if (category.isEmpty()) {
                notes.add("Assessment question '" + id + "' skipped: unknown category");
                continue;
            }
            String feedback = JsonFields.textOrDefault(node, "feedback");
            Double score = NO_ANSWER_FEEDBACK.equals(feedback)
                    ? null
                    : JsonFields.number(node, "score").orElse(null);
            Double passion = JsonFields.number(node, "passion_signal", "passion_rating").orElse(null);
            questions.add(new AssessmentQuestion(id, category.get(), score, feedback, passion));
        }
        return questions;
    }

    private List<AssessmentQuestion> readScoreMap(JsonNode document, List<String> notes) {
        List<AssessmentQuestion> questions = new ArrayList<>();
        JsonNode scores = document.get("question_scores");
        JsonNode feedback = document.path("feedback");
        Double passion = JsonFields.number(document, "passion_rating").orElse(null);

        Iterator<Map.Entry<String, JsonNode>> fields = scores.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String id = entry.getKey();
            Optional<AssessmentCategory> category = AssessmentCategory.fromQuestionId(id);
            if (category.isEmpty()) {
                notes.add("Assessment question '" + id + "' skipped: unknown category");
                continue;
            }
            String text = JsonFields.textOrDefault(feedback, id);
            Double score = NO_ANSWER_FEEDBACK.equals(text) ? null : JsonFields.number(entry.getValue()).orElse(null);
            Double signal = category.get() == AssessmentCategory.BEHAVIORAL ? passion : null;
            questions.add(new AssessmentQuestion(id, category.get(), score, text, signal));
        }
        return questions;
    }

    private Optional<AssessmentCategory> resolveCategory(String declared, String id) {
        Optional<AssessmentCategory> category = AssessmentCategory.fromKey(declared);
        return category.isPresent() ? category : AssessmentCategory.fromQuestionId(id);
    }
}
