package uk.gegc.quizdrill.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NoResultsException extends RuntimeException {

    public NoResultsException() {
        super("No results to display");
    }
}
