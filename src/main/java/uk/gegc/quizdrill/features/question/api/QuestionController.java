package uk.gegc.quizdrill.features.question.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.quizdrill.features.question.api.dto.ImportSummaryDto;
import uk.gegc.quizdrill.features.question.application.QuestionQueryService;
import uk.gegc.quizdrill.features.question.application.imports.QuestionImportService;
import uk.gegc.quizdrill.features.question.domain.model.Question;
import uk.gegc.quizdrill.shared.exception.ImportFormatException;
import uk.gegc.quizdrill.shared.exception.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@Tag(name = "Questions", description = "Question bank listing and import")
@RestController
@RequestMapping("/api/v1/questions")
@RequiredArgsConstructor
public class QuestionController {

    private final QuestionQueryService questionQueryService;
    private final QuestionImportService questionImportService;

    @GetMapping
    @Operation(summary = "List questions", description = "Returns every stored question, optionally limited to one domain.")
    public ResponseEntity<List<Question>> getQuestions(
            @Parameter(description = "Exact domain label") @RequestParam(required = false) String domain
    ) {
        return ResponseEntity.ok(questionQueryService.findByDomain(domain));
    }

    @GetMapping("/domains")
    @Operation(summary = "List domains", description = "Distinct domain labels in alphabetical order.")
    public ResponseEntity<List<String>> getDomains() {
        return ResponseEntity.ok(questionQueryService.findDomains());
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Import questions from a JSON file",
            description = "Accepts an array of question records or an object with a 'questions' or 'data' field. "
                    + "Records with an existing id replace the stored question; invalid records are skipped."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Import summary",
                    content = @Content(schema = @Schema(implementation = ImportSummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Unreadable payload or unsupported shape",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ImportSummaryDto> importFile(@RequestPart("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please choose a JSON file to upload.");
        }
        try (InputStream input = file.getInputStream()) {
            return ResponseEntity.ok(questionImportService.importQuestions(input));
        } catch (IOException ex) {
            throw new ImportFormatException("Uploaded file could not be read", ex);
        }
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Import questions from a JSON body", description = "Same rules as the file upload variant.")
    public ResponseEntity<ImportSummaryDto> importJson(@RequestBody JsonNode payload) {
        return ResponseEntity.ok(questionImportService.importQuestions(payload));
    }
}
