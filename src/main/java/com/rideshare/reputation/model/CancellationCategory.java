package com.rideshare.reputation.model;

public enum CancellationCategory {
    PERSONAL_EMERGENCY,
    FOUND_ALTERNATIVE,
    NO_LONGER_NEEDED,
    PASSENGER_NO_SHOW,
    RIDER_NO_SHOW,
    SAFETY_CONCERN,
    PAYMENT_ISSUE,
    VEHICLE_ISSUE,
    WEATHER,
    OTHER;

    public boolean isNoShow() {
        return this == PASSENGER_NO_SHOW || this == RIDER_NO_SHOW;
    }
}
