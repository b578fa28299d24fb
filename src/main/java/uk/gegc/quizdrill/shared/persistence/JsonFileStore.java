package uk.gegc.quizdrill.shared.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.quizdrill.shared.exception.StorageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Whole-file JSON array storage: every read returns the full collection and every write
 * replaces it.
 *
 * <p>There is no locking here. Two callers that both read, mutate and write will lose the
 * earlier write. Callers that need a single writer must serialize themselves.
 *
 * @param <T> element type of the stored array
 */
@Slf4j
public class JsonFileStore<T> {

    private final Path path;
    private final TypeReference<List<T>> elementListType;
    private final ObjectMapper mapper;

    public JsonFileStore(Path path, TypeReference<List<T>> elementListType, ObjectMapper objectMapper) {
        this.path = path;
        this.elementListType = elementListType;
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Reads the whole array. A missing, blank or malformed file yields an empty list.
     */
    public List<T> readAll() {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try {
            String raw = Files.readString(path, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return new ArrayList<>();
            }
            List<T> items = mapper.readValue(raw, elementListType);
            if (items == null) {
                return new ArrayList<>();
            }
            List<T> result = new ArrayList<>(items.size());
            for (T item : items) {
                if (item != null) {
                    result.add(item);
                }
            }
            return result;
        } catch (IOException ex) {
            log.warn("Store file unreadable, treating as empty: path={}, error={}", path, ex.getMessage());
            return new ArrayList<>();
        }
    }

    public void writeAll(List<T> items) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, mapper.writeValueAsString(items), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new StorageException(path, ex);
        }
    }
}
