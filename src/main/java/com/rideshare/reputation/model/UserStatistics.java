package com.rideshare.reputation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate counts for one user, derived from rides and ratings. Never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserStatistics {
    private String userUid;

    // Terminal rides (completed or cancelled) by role
    private int totalRidesAsRider;
    private int totalRidesAsPassenger;
    private int completedRidesAsRider;
    private int completedRidesAsPassenger;

    // Cancellations made by this user, by the role they held
    private int cancellationsAsRider;
    private int cancellationsAsPassenger;
    private int lateCancellations;
    private int noShows;

    private double averageRating;
    private int totalRatings;
    private int totalRatingsAsRider;
    private int totalRatingsAsPassenger;

    public static UserStatistics empty(String userUid) {
        return UserStatistics.builder().userUid(userUid).build();
    }

    public int getTotalRides() {
        return totalRidesAsRider + totalRidesAsPassenger;
    }

    public int getCompletedRides() {
        return completedRidesAsRider + completedRidesAsPassenger;
    }

    public int getCancellations() {
        return cancellationsAsRider + cancellationsAsPassenger;
    }
}
