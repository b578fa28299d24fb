package uk.gegc.quizdrill.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "CreateTestRequest", description = "Parameters for a new test")
public record CreateTestRequest(
        @Schema(description = "Number of questions; empty, zero or non-numeric means all available", example = "10")
        @Size(max = 10, message = "totalQuestions must not exceed 10 characters")
        String totalQuestions,
        @Schema(description = "Exact domain to draw from; omit for all domains", example = "Security Operations")
        @Size(max = 200, message = "domain must not exceed 200 characters")
        String domain
) {
}
