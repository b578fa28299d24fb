package uk.gegc.quizdrill.features.repetition.infra.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import uk.gegc.quizdrill.features.repetition.domain.model.WrongAnswerRecord;
import uk.gegc.quizdrill.features.repetition.domain.repository.WrongAnswerRepository;
import uk.gegc.quizdrill.shared.config.StorageProperties;
import uk.gegc.quizdrill.shared.persistence.JsonFileStore;

import java.nio.file.Path;
import java.util.List;

@Repository
public class JsonFileWrongAnswerRepository implements WrongAnswerRepository {

    private final JsonFileStore<WrongAnswerRecord> store;

    @Autowired
    public JsonFileWrongAnswerRepository(StorageProperties storageProperties, ObjectMapper objectMapper) {
        this(storageProperties.wrongAnswersPath(), objectMapper);
    }

    public JsonFileWrongAnswerRepository(Path path, ObjectMapper objectMapper) {
        this.store = new JsonFileStore<>(path, new TypeReference<List<WrongAnswerRecord>>() {}, objectMapper);
    }

    @Override
    public List<WrongAnswerRecord> loadAll() {
        return store.readAll();
    }

    @Override
    public void saveAll(List<WrongAnswerRecord> records) {
        store.writeAll(records);
    }
}
