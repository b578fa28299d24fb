package uk.gegc.quizdrill.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an import payload cannot be parsed or has an unsupported top-level shape.
 * Nothing is written to the question store when this is raised.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ImportFormatException extends RuntimeException {

    public ImportFormatException(String message) {
        super(message);
    }

    public ImportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
