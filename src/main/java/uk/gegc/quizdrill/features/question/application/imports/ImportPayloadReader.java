package uk.gegc.quizdrill.features.question.application.imports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizdrill.shared.exception.ImportFormatException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates the question records inside an import payload.
 *
 * <p>Accepted payloads are a bare array of records, or an object whose {@code questions}
 * (or, failing that, {@code data}) field holds either an array of records or an object
 * whose values are the records.
 */
@Component
@RequiredArgsConstructor
public class ImportPayloadReader {

    private static final List<String> WRAPPER_FIELDS = List.of("questions", "data");

    private final ObjectMapper objectMapper;

    public JsonNode readTree(InputStream input) {
        if (input == null) {
            throw new ImportFormatException("Import input stream is required");
        }
        try {
            JsonNode payload = objectMapper.readTree(input);
            if (payload == null || payload.isMissingNode()) {
                throw new ImportFormatException("Import payload is empty");
            }
            return payload;
        } catch (JsonProcessingException ex) {
            throw new ImportFormatException("Malformed JSON import payload: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new ImportFormatException("Import payload could not be read", ex);
        }
    }

    public List<JsonNode> extractRecords(JsonNode payload) {
        if (payload == null) {
            throw new ImportFormatException("Import payload is required");
        }
        if (payload.isArray()) {
            return elements(payload);
        }
        if (payload.isObject()) {
            JsonNode wrapped = unwrap(payload);
            if (wrapped.isArray()) {
                return elements(wrapped);
            }
            if (wrapped.isObject()) {
                return values(wrapped);
            }
        }
        throw new ImportFormatException("Unsupported format. Expected a list of questions.");
    }

    private JsonNode unwrap(JsonNode payload) {
        JsonNode emptyCandidate = null;
        for (String field : WRAPPER_FIELDS) {
            JsonNode value = payload.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isContainerNode() && value.isEmpty()) {
                if (emptyCandidate == null) {
                    emptyCandidate = value;
                }
                continue;
            }
            return value;
        }
        if (emptyCandidate != null) {
            return emptyCandidate;
        }
        throw new ImportFormatException("Unsupported format. Expected a 'questions' or 'data' field.");
    }

    private List<JsonNode> elements(JsonNode array) {
        List<JsonNode> records = new ArrayList<>(array.size());
        array.forEach(records::add);
        return records;
    }

    private List<JsonNode> values(JsonNode object) {
        List<JsonNode> records = new ArrayList<>(object.size());
        object.elements().forEachRemaining(records::add);
        return records;
    }
}
