package uk.gegc.quizdrill.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class NoActiveSessionException extends RuntimeException {

    public NoActiveSessionException() {
        super("No active test found. Start a new test first.");
    }
}
