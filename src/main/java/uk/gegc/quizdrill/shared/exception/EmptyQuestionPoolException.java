package uk.gegc.quizdrill.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when no question matches the criteria of a new test.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class EmptyQuestionPoolException extends RuntimeException {

    public EmptyQuestionPoolException(String message) {
        super(message);
    }
}
