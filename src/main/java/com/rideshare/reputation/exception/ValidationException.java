package com.rideshare.reputation.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ValidationException extends ReputationException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        this(message, Map.of());
    }

    public ValidationException(String message, Map<String, String> details) {
        super(CODE, HttpStatus.BAD_REQUEST, message, details, null);
    }
}
