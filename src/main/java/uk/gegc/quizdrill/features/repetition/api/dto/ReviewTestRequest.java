package uk.gegc.quizdrill.features.repetition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "ReviewTestRequest", description = "Parameters for a review test")
public record ReviewTestRequest(
        @Schema(description = "Number of questions; empty, zero or non-numeric means every due question", example = "5")
        @Size(max = 10, message = "totalQuestions must not exceed 10 characters")
        String totalQuestions
) {
}
