package uk.gegc.quizdrill.features.repetition.application;

import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.repetition.application.dto.ReviewItemDto;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;

import java.util.List;
import java.util.Map;

public interface WrongAnswerService {

    /**
     * Records the outcome of one answered question. A correct answer clears the question's
     * history; a wrong one creates or bumps its record.
     */
    void update(String questionId, List<Integer> selectedIndices, boolean correct);

    /**
     * Questions from {@code allQuestions} that currently have a mistake record, in input order.
     */
    List<Question> reviewPool(List<Question> allQuestions);

    List<WrongAnswerRecord> findAll();

    Map<String, WrongAnswerRecord> lookup();

    /**
     * Review-pool questions paired with their records, in {@code allQuestions} order.
     */
    List<ReviewItemDto> reviewOverview(List<Question> allQuestions);
}
