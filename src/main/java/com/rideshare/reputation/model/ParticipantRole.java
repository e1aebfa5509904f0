package com.rideshare.reputation.model;

public enum ParticipantRole {
    RIDER,
    PASSENGER;

    public ParticipantRole counterpart() {
        return this == RIDER ? PASSENGER : RIDER;
    }
}
