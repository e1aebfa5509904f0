package com.rideshare.reputation.exception;

import org.springframework.http.HttpStatus;

/**
 * Storage or collaborator failure the caller cannot fix.
 */
public class InternalException extends ReputationException {

    public static final String CODE = "INTERNAL_ERROR";

    public InternalException(String message, Throwable cause) {
        super(CODE, HttpStatus.INTERNAL_SERVER_ERROR, message, null, cause);
    }
}
