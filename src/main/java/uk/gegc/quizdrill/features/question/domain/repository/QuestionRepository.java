package uk.gegc.quizdrill.features.question.domain.repository;

import uk.gegc.quizdrill.features.question.domain.model.Question;

import java.util.List;

/**
 * Storage port for the question collection. Implementations read and write the
 * collection as a whole.
 */
public interface QuestionRepository {

    List<Question> loadAll();

    void saveAll(List<Question> questions);
}
