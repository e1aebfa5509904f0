package com.rideshare.reputation.model;

public enum RideStatus {
    SCHEDULED,
    MATCHED,
    ONGOING,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
