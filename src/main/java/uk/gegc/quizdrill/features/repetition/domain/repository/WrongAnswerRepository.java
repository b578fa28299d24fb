package uk.gegc.quizdrill.features.repetition.domain.repository;

import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;

import java.util.List;

/**
 * Storage port for mistake records, read and written as a whole collection.
 */
public interface WrongAnswerRepository {

    List<WrongAnswerRecord> loadAll();

    void saveAll(List<WrongAnswerRecord> records);
}
