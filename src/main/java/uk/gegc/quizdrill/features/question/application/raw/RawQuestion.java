package uk.gegc.quizdrill.features.question.application.raw;

import java.util.List;

/**
 * Result of reading one loosely shaped question record. Aliased fields are already
 * resolved and scalar values other than the id already trimmed; absent values are
 * {@code null}.
 *
 * <p>{@code sourceText} is the question text exactly as it appeared in the record and is
 * what a derived id is computed from. {@code id} is likewise kept as written.
 */
public record RawQuestion(
        String id,
        String text,
        String sourceText,
        ChoiceInput choices,
        List<AnswerToken> correctAnswers,
        String domain,
        String comment
) {
    public RawQuestion {
        correctAnswers = correctAnswers == null ? List.of() : List.copyOf(correctAnswers);
        if (choices == null) {
            choices = new ChoiceInput.Absent();
        }
    }
}
