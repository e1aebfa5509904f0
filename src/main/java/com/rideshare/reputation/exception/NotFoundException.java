package com.rideshare.reputation.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ReputationException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, HttpStatus.NOT_FOUND, message, null, null);
    }

    public static NotFoundException of(String entity, String id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
