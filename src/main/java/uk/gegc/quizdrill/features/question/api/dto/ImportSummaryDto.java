package uk.gegc.quizdrill.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ImportSummaryDto", description = "Summary of a question import")
public record ImportSummaryDto(
        @Schema(description = "Questions added under a new id", example = "12")
        int imported,
        @Schema(description = "Existing questions replaced by the import", example = "3")
        int updated,
        @Schema(description = "Records that could not be normalized", example = "1")
        int skipped,
        List<ImportErrorDto> errors
) {
    public ImportSummaryDto {
        if (errors == null) {
            errors = List.of();
        }
    }
}
