package uk.gegc.quizdrill.features.attempt.domain.model;

import uk.gegc.quizdrill.features.question.domain.model.Question;

import java.util.List;

public record QuestionResult(
        Question question,
        List<Integer> selectedIndices,
        List<Integer> correctAnswers,
        boolean correct
) {
    public QuestionResult {
        selectedIndices = List.copyOf(selectedIndices);
        correctAnswers = List.copyOf(correctAnswers);
    }
}
