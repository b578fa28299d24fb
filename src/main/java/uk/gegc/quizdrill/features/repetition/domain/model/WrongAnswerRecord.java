package uk.gegc.quizdrill.features.repetition.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import uk.gegc.quizdrill.shared.persistence.UtcInstantDeserializer;

import java.time.Instant;
import java.util.List;

/**
 * Mistake history for one question. A record exists only while the question has an
 * uncorrected wrong answer.
 *
 * @param questionId      id of the question; the question itself may no longer exist
 * @param wrongCount      wrong answers since the question was last answered correctly
 * @param lastAttemptTime time of the most recent wrong answer; stored timestamps without an
 *                        offset are read as UTC
 * @param lastAnswer      indices selected in that answer, ascending
 */
@JsonPropertyOrder({"question_id", "wrong_count", "last_attempt", "last_answer"})
public record WrongAnswerRecord(
        @JsonProperty("question_id") String questionId,
        @JsonProperty("wrong_count") int wrongCount,
        @JsonProperty("last_attempt") @JsonDeserialize(using = UtcInstantDeserializer.class) Instant lastAttemptTime,
        @JsonProperty("last_answer") List<Integer> lastAnswer
) {

    public WrongAnswerRecord {
        lastAnswer = lastAnswer == null ? List.of() : List.copyOf(lastAnswer);
    }

    public static WrongAnswerRecord first(String questionId, List<Integer> answer, Instant attemptedAt) {
        return new WrongAnswerRecord(questionId, 1, attemptedAt, answer);
    }

    public WrongAnswerRecord recordAnotherMiss(List<Integer> answer, Instant attemptedAt) {
        return new WrongAnswerRecord(questionId, wrongCount + 1, attemptedAt, answer);
    }
}
