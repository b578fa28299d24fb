package uk.gegc.quizdrill.features.question.application.imports;

import uk.gegc.quizdrill.features.question.domain.model.Question;

/**
 * Result of normalizing one import record: either a question or the reason it was rejected.
 */
public record NormalizationOutcome(int index, Question question, String error) {

    public static NormalizationOutcome success(int index, Question question) {
        return new NormalizationOutcome(index, question, null);
    }

    public static NormalizationOutcome failure(int index, String error) {
        return new NormalizationOutcome(index, null, error);
    }

    public boolean isSuccess() {
        return question != null;
    }
}
