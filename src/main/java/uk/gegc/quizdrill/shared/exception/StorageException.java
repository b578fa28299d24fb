package uk.gegc.quizdrill.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.nio.file.Path;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class StorageException extends RuntimeException {

    public StorageException(Path path, Throwable cause) {
        super(String.format("Failed to write store file %s: %s", path, cause.getMessage()), cause);
    }
}
