package com.rideshare.reputation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * How a secondary action (audit append, notification) went after the primary mutation committed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SideEffectOutcome(String name, Status status, String error) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static SideEffectOutcome succeeded(String name) {
        return new SideEffectOutcome(name, Status.SUCCEEDED, null);
    }

    public static SideEffectOutcome failed(String name, String error) {
        return new SideEffectOutcome(name, Status.FAILED, error);
    }

    public static SideEffectOutcome skipped(String name, String reason) {
        return new SideEffectOutcome(name, Status.SKIPPED, reason);
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
