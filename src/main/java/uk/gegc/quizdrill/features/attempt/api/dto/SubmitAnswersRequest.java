package uk.gegc.quizdrill.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(name = "SubmitAnswersRequest", description = "Selected choice indices keyed by question id")
public record SubmitAnswersRequest(
        @Schema(description = "Question id to selected choice indices; unanswered questions may be omitted",
                example = "{\"q-1\": [\"0\", \"2\"]}")
        Map<String, List<String>> answers
) {
    public SubmitAnswersRequest {
        if (answers == null) {
            answers = Map.of();
        }
    }
}
