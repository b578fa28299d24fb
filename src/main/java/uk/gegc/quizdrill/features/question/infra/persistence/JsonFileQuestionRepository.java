package uk.gegc.quizdrill.features.question.infra.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.features.question.domain.repository.QuestionRepository;
import uk.gegc.quizdrill.shared.config.StorageProperties;
import uk.gegc.quizdrill.shared.persistence.JsonFileStore;

import java.nio.file.Path;
import java.util.List;

@Repository
public class JsonFileQuestionRepository implements QuestionRepository {

    private final JsonFileStore<Question> store;

    @Autowired
    public JsonFileQuestionRepository(StorageProperties storageProperties, ObjectMapper objectMapper) {
        this(storageProperties.questionsPath(), objectMapper);
    }

    public JsonFileQuestionRepository(Path path, ObjectMapper objectMapper) {
        this.store = new JsonFileStore<>(path, new TypeReference<List<Question>>() {}, objectMapper);
    }

    @Override
    public List<Question> loadAll() {
        return store.readAll();
    }

    @Override
    public void saveAll(List<Question> questions) {
        store.writeAll(questions);
    }
}
