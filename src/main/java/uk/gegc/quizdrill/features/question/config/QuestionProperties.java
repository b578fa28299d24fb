package uk.gegc.quizdrill.features.question.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "quizdrill.question")
public class QuestionProperties {

    /**
     * Name hashed inside the per-text namespace when a record carries no explicit id.
     * Changing it changes every derived id, so re-imports would duplicate questions.
     */
    @NotBlank(message = "Property quizdrill.question.id-discriminator must be configured")
    private String idDiscriminator = "cissp-question";
}
