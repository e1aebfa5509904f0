package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.engine.RatingMath;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.exception.NotFoundException;
import com.rideshare.reputation.model.ParticipantRole;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.model.RideRecord;
import com.rideshare.reputation.model.RideStatus;
import com.rideshare.reputation.model.UserStatistics;
import com.rideshare.reputation.repository.RatingRepository;
import com.rideshare.reputation.repository.RideRepository;
import com.rideshare.reputation.repository.UserRepository;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Derives a user's aggregate counts from their rides and the ratings they received.
 */
@Service
public class StatisticsService {

    private final UserRepository userRepo;
    private final RideRepository rideRepo;
    private final RatingRepository ratingRepo;
    private final ReputationConfig reputationConfig;

    public StatisticsService(UserRepository userRepo,
                             RideRepository rideRepo,
                             RatingRepository ratingRepo,
                             ReputationConfig reputationConfig) {
        this.userRepo = userRepo;
        this.rideRepo = rideRepo;
        this.ratingRepo = ratingRepo;
        this.reputationConfig = reputationConfig;
    }

    public UserStatistics getStatistics(String uid) {
        List<RideRecord> rides;
        List<Rating> received;
        try {
            if (!userRepo.exists(uid)) {
                throw NotFoundException.of("User", uid);
            }
            rides = rideRepo.findByParticipant(uid);
            received = ratingRepo.findByRatedUid(uid);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read history for user " + uid, e);
        }

        UserStatistics stats = UserStatistics.empty(uid);
        long lateWindowMs = Duration.ofHours(
                reputationConfig.getScoring().getLateCancellationWindowHours()).toMillis();

        for (RideRecord ride : rides) {
            ParticipantRole role = ride.roleOf(uid);
            if (role == null || ride.getStatus() == null || !ride.getStatus().isTerminal()) continue;

            if (role == ParticipantRole.RIDER) {
                stats.setTotalRidesAsRider(stats.getTotalRidesAsRider() + 1);
            } else {
                stats.setTotalRidesAsPassenger(stats.getTotalRidesAsPassenger() + 1);
            }

            if (ride.getStatus() == RideStatus.COMPLETED) {
                if (role == ParticipantRole.RIDER) {
                    stats.setCompletedRidesAsRider(stats.getCompletedRidesAsRider() + 1);
                } else {
                    stats.setCompletedRidesAsPassenger(stats.getCompletedRidesAsPassenger() + 1);
                }
                continue;
            }

            // Cancelled: a no-show is charged to the absent party, not to whoever cancelled
            if (ride.getCancellationCategory() != null && ride.getCancellationCategory().isNoShow()) {
                if (uid.equals(ride.noShowUid())) {
                    stats.setNoShows(stats.getNoShows() + 1);
                }
                continue;
            }

            if (!uid.equals(ride.getCancelledByUid())) continue;

            if (role == ParticipantRole.RIDER) {
                stats.setCancellationsAsRider(stats.getCancellationsAsRider() + 1);
            } else {
                stats.setCancellationsAsPassenger(stats.getCancellationsAsPassenger() + 1);
            }
            if (ride.getCancelledAt() > 0 && ride.getDepartAt() - ride.getCancelledAt() < lateWindowMs) {
                stats.setLateCancellations(stats.getLateCancellations() + 1);
            }
        }

        for (Rating rating : received) {
            // The rater's counterpart role is the role the user was rated in
            if (rating.getRaterRole().counterpart() == ParticipantRole.RIDER) {
                stats.setTotalRatingsAsRider(stats.getTotalRatingsAsRider() + 1);
            } else {
                stats.setTotalRatingsAsPassenger(stats.getTotalRatingsAsPassenger() + 1);
            }
        }
        stats.setTotalRatings(received.size());
        stats.setAverageRating(RatingMath.average(received,
                reputationConfig.getRatings().isHiddenCountsTowardAverage()));

        return stats;
    }
}
