package uk.gegc.quizdrill.features.question.application.imports;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizdrill.features.question.api.dto.ImportSummaryDto;

import java.io.InputStream;

public interface QuestionImportService {

    /**
     * Parses a JSON payload and merges its questions into the store by id.
     *
     * @throws uk.gegc.quizdrill.shared.exception.ImportFormatException if the bytes are not JSON
     *                                                                  or the shape is unsupported
     */
    ImportSummaryDto importQuestions(InputStream input);

    ImportSummaryDto importQuestions(JsonNode payload);
}
