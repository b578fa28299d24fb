package uk.gegc.quizdrill.features.question.application.raw;

/**
 * One entry of a raw correct-answer field.
 */
public sealed interface AnswerToken {

    record IndexToken(int index) implements AnswerToken {
    }

    /**
     * Either a choice letter ({@code "B"}) or the full text of a choice.
     */
    record TextToken(String value) implements AnswerToken {
    }
}
