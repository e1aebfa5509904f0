package com.rideshare.reputation.seeder;

import com.rideshare.reputation.model.CancellationCategory;
import com.rideshare.reputation.model.ParticipantRole;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.model.RideRecord;
import com.rideshare.reputation.model.RideStatus;
import com.rideshare.reputation.model.UserProfile;
import com.rideshare.reputation.model.VerificationStatus;
import com.rideshare.reputation.repository.RatingRepository;
import com.rideshare.reputation.repository.RideRepository;
import com.rideshare.reputation.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Seeds Aerospike with a small ride-share community for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates 8 users:
 *   - user-01 to user-05: reliable members who complete nearly every ride
 *   - user-06: cancels late and misses pickups
 *   - user-07: target of repeated one-star ratings from user-08
 *   - user-08: has never ridden (zero history)
 */
@Component
@Profile("seed")
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final long HOUR = Duration.ofHours(1).toMillis();
    private static final long DAY = Duration.ofDays(1).toMillis();

    private static final String[] NAMES = {
            "Amara Okafor", "Bastien Roy", "Chen Wei", "Dana Levi",
            "Eitan Maor", "Farah Haddad", "Gus Lindqvist", "Hana Sato"
    };

    private final UserRepository userRepo;
    private final RideRepository rideRepo;
    private final RatingRepository ratingRepo;
    private final Random random = new Random(42); // fixed seed for reproducibility

    private int rideCounter = 0;

    public DataSeeder(UserRepository userRepo, RideRepository rideRepo, RatingRepository ratingRepo) {
        this.userRepo = userRepo;
        this.rideRepo = rideRepo;
        this.ratingRepo = ratingRepo;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting data seeding ===");

        long now = System.currentTimeMillis();
        seedUsers(now);

        // Reliable members ride with each other
        for (int rider = 1; rider <= 5; rider++) {
            for (int trip = 0; trip < 4 + rider * 3; trip++) {
                int passenger = 1 + random.nextInt(5);
                if (passenger == rider) passenger = rider % 5 + 1;
                String rideId = completedRide(uid(rider), uid(passenger), now - (trip + 1) * DAY);
                rate(rideId, uid(passenger), uid(rider), ParticipantRole.PASSENGER, 4 + random.nextInt(2), now - trip * DAY);
                rate(rideId, uid(rider), uid(passenger), ParticipantRole.RIDER, 3 + random.nextInt(3), now - trip * DAY);
            }
        }

        // user-06: a couple of completed rides, then late cancellations and no-shows
        for (int i = 0; i < 3; i++) {
            String rideId = completedRide(uid(6), uid(1 + i), now - (20 + i) * DAY);
            rate(rideId, uid(1 + i), uid(6), ParticipantRole.PASSENGER, 2 + i, now - (20 + i) * DAY);
        }
        for (int i = 0; i < 2; i++) {
            long departAt = now - (10 + i) * DAY;
            cancelledRide(uid(6), uid(2), departAt, uid(6), departAt - 2 * HOUR, CancellationCategory.PERSONAL_EMERGENCY);
        }
        cancelledRide(uid(3), uid(6), now - 5 * DAY, uid(3), now - 5 * DAY + HOUR, CancellationCategory.PASSENGER_NO_SHOW);

        // user-07: repeated one-star ratings from user-08, one of them already hidden
        for (int i = 0; i < 3; i++) {
            String rideId = completedRide(uid(7), uid(8), now - (3 + i) * DAY);
            rate(rideId, uid(8), uid(7), ParticipantRole.PASSENGER, 1, now - (3 + i) * DAY);
        }
        ratingRepo.findByRatedUid(uid(7)).stream()
                .findFirst()
                .ifPresent(rating -> ratingRepo.hide(rating.getRideId(), rating.getRaterUid(), now));

        log.info("=== Data seeding complete: {} users, {} rides ===", NAMES.length, rideCounter);
    }

    private void seedUsers(long now) {
        log.info("Seeding users...");
        for (int i = 1; i <= NAMES.length; i++) {
            boolean verifiedRider = i <= 5;
            userRepo.save(UserProfile.builder()
                    .uid(uid(i))
                    .displayName(NAMES[i - 1])
                    .email("user" + i + "@example.com")
                    .phoneNumber(String.format("+1555010%04d", i))
                    .riderVerificationStatus(verifiedRider ? VerificationStatus.APPROVED : VerificationStatus.PENDING)
                    .riderVerified(verifiedRider)
                    .createdAt(now - 90 * DAY)
                    .updatedAt(now - 90 * DAY)
                    .build());
        }
    }

    private String completedRide(String riderUid, String passengerUid, long departAt) {
        String rideId = nextRideId();
        rideRepo.save(RideRecord.builder()
                .rideId(rideId)
                .riderUid(riderUid)
                .passengerUid(passengerUid)
                .status(RideStatus.COMPLETED)
                .departAt(departAt)
                .build());
        return rideId;
    }

    private void cancelledRide(String riderUid, String passengerUid, long departAt,
                               String cancelledBy, long cancelledAt, CancellationCategory category) {
        rideRepo.save(RideRecord.builder()
                .rideId(nextRideId())
                .riderUid(riderUid)
                .passengerUid(passengerUid)
                .status(RideStatus.CANCELLED)
                .departAt(departAt)
                .cancelledByUid(cancelledBy)
                .cancelledAt(cancelledAt)
                .cancellationCategory(category)
                .build());
    }

    private void rate(String rideId, String raterUid, String ratedUid, ParticipantRole raterRole,
                      int score, long createdAt) {
        ratingRepo.save(Rating.builder()
                .rideId(rideId)
                .raterUid(raterUid)
                .ratedUid(ratedUid)
                .raterRole(raterRole)
                .score(score)
                .review(score >= 4 ? "Smooth ride" : "Could be better")
                .tags(score >= 4 ? List.of("punctual", "friendly") : List.of("late"))
                .visible(true)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build());
    }

    private String nextRideId() {
        return String.format("RIDE-%06d", ++rideCounter);
    }

    private static String uid(int i) {
        return String.format("user-%02d", i);
    }
}
