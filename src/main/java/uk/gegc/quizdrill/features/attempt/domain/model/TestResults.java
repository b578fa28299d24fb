package uk.gegc.quizdrill.features.attempt.domain.model;

import java.util.List;

/**
 * Outcome of a submitted test.
 *
 * @param perQuestion    one entry per session question, in session order
 * @param score          percentage of correct answers, rounded to two decimals
 * @param correctCount   number of exactly correct answers
 * @param totalQuestions number of questions in the session
 * @param mode           mode of the session that produced these results
 */
public record TestResults(
        List<QuestionResult> perQuestion,
        double score,
        int correctCount,
        int totalQuestions,
        TestMode mode
) {
    public TestResults {
        perQuestion = List.copyOf(perQuestion);
    }
}
