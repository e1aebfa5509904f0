package com.rideshare.reputation.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Base of the errors the API reports with a stable code.
 */
@Getter
public abstract class ReputationException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final Map<String, String> details;

    protected ReputationException(String code, HttpStatus status, String message,
                                  Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }
}
