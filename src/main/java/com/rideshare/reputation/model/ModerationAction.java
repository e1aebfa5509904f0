package com.rideshare.reputation.model;

import com.rideshare.reputation.exception.ValidationException;

import java.util.Map;

public enum ModerationAction {
    HIDE("hide_rating"),
    DELETE("delete_rating");

    private final String auditAction;

    ModerationAction(String auditAction) {
        this.auditAction = auditAction;
    }

    public String auditAction() {
        return auditAction;
    }

    public static ModerationAction fromString(String value) {
        if (value != null) {
            for (ModerationAction action : values()) {
                if (action.name().equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        throw new ValidationException("Unknown moderation action: " + value,
                Map.of("action", "must be one of hide, delete"));
    }
}
