package uk.gegc.quizdrill.shared.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "quizdrill.storage")
public class StorageProperties {

    @NotBlank(message = "Property quizdrill.storage.data-dir must be configured")
    private String dataDir = "data";

    @NotBlank(message = "Property quizdrill.storage.questions-file must be configured")
    private String questionsFile = "questions.json";

    @NotBlank(message = "Property quizdrill.storage.wrong-answers-file must be configured")
    private String wrongAnswersFile = "wrong_questions.json";

    public Path questionsPath() {
        return Path.of(dataDir).resolve(questionsFile);
    }

    public Path wrongAnswersPath() {
        return Path.of(dataDir).resolve(wrongAnswersFile);
    }
}
