package uk.gegc.quizdrill.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ImportErrorDto", description = "A record that was skipped during import")
public record ImportErrorDto(
        @Schema(description = "Zero-based position of the record in the payload", example = "3")
        int index,
        @Schema(description = "Why the record could not be normalized", example = "Question text is required")
        String message
) {
}
