package uk.gegc.quizdrill.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Canonical quiz item. Instances are immutable, so a reference taken at session
 * creation is unaffected by later imports.
 *
 * @param id             store-unique identifier
 * @param text           question prompt
 * @param choices        answer options, addressed by index
 * @param correctAnswers ascending indices into {@code choices}
 * @param domain         category label
 * @param comment        optional explanation, empty when absent
 */
@JsonPropertyOrder({"id", "question", "choices", "correct_answers", "domain", "comment"})
public record Question(
        String id,
        @JsonProperty("question") String text,
        List<String> choices,
        @JsonProperty("correct_answers") List<Integer> correctAnswers,
        String domain,
        String comment
) {

    public static final String DEFAULT_DOMAIN = "General";

    public Question {
        choices = choices == null ? List.of() : List.copyOf(choices);
        correctAnswers = correctAnswers == null ? List.of() : List.copyOf(correctAnswers);
        if (domain == null || domain.isBlank()) {
            domain = DEFAULT_DOMAIN;
        }
        if (comment == null) {
            comment = "";
        }
    }
}
