package com.rideshare.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A ride as recorded by the matching subsystem. Read-only here; terminal rides never change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ride facts consumed by trust scoring")
public class RideRecord {

    @Schema(description = "Ride ID", example = "RIDE-000123")
    private String rideId;

    @Schema(description = "UID of the user offering the ride", example = "user-rider-01")
    private String riderUid;

    @Schema(description = "UID of the matched passenger, null until matched", example = "user-pass-07")
    private String passengerUid;

    private RideStatus status;

    @Schema(description = "Scheduled departure, epoch milliseconds")
    private long departAt;

    private String cancelledByUid;

    @Schema(description = "Cancellation time, epoch milliseconds; 0 when not cancelled")
    private long cancelledAt;

    private CancellationCategory cancellationCategory;

    public boolean involves(String uid) {
        return uid.equals(riderUid) || uid.equals(passengerUid);
    }

    public ParticipantRole roleOf(String uid) {
        if (uid.equals(riderUid)) return ParticipantRole.RIDER;
        if (uid.equals(passengerUid)) return ParticipantRole.PASSENGER;
        return null;
    }

    /**
     * The participant who failed to appear, or null when this ride was not cancelled for a no-show.
     */
    public String noShowUid() {
        if (status != RideStatus.CANCELLED || cancellationCategory == null) return null;
        return switch (cancellationCategory) {
            case PASSENGER_NO_SHOW -> passengerUid;
            case RIDER_NO_SHOW -> riderUid;
            default -> null;
        };
    }
}
