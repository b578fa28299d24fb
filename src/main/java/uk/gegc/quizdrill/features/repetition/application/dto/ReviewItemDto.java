package uk.gegc.quizdrill.features.repetition.application.dto;

import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;

/**
 * A question due for review together with its mistake history.
 * {@code question} is {@code null} when the record refers to a question that is no longer stored.
 */
public record ReviewItemDto(Question question, WrongAnswerRecord record) {
}
