package com.rideshare.reputation.engine;

import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.model.TrustCategory;
import com.rideshare.reputation.model.TrustScoreBreakdown;
import com.rideshare.reputation.model.UserStatistics;
import org.springframework.stereotype.Component;

/**
 * Turns a user's statistics into a 0-100 trust score.
 *
 * <pre>
 *   rating      (0-30)  average rating x 6, 0 without ratings
 *   completion  (0-25)  completed / total rides x 25, 0 without rides
 *   reliability (0-25)  25 - penalties, floored at 0
 *   experience  (0-20)  tier on total rides
 * </pre>
 *
 * Pure: the same statistics always give the same breakdown.
 */
@Component
public class TrustScoreCalculator {

    static final int MAX_RATING_POINTS = 30;
    static final int MAX_COMPLETION_POINTS = 25;
    static final int MAX_RELIABILITY_POINTS = 25;

    private final ReputationConfig.Scoring scoring;

    public TrustScoreCalculator(ReputationConfig reputationConfig) {
        this.scoring = reputationConfig.getScoring();
    }

    public TrustScoreBreakdown calculate(UserStatistics stats) {
        int ratingPoints = ratingPoints(stats.getAverageRating(), stats.getTotalRatings());

        int totalRides = stats.getTotalRides();
        int completedRides = stats.getCompletedRides();
        int completionPoints = totalRides == 0
                ? 0
                : (int) Math.round(completedRides * (double) MAX_COMPLETION_POINTS / totalRides);
        double completionRate = totalRides == 0
                ? 0.0
                : RatingMath.round(completedRides * 100.0 / totalRides, 2);

        int deductions = stats.getCancellations() * scoring.getCancellationPenalty()
                + stats.getLateCancellations() * scoring.getLateCancellationPenalty()
                + stats.getNoShows() * scoring.getNoShowPenalty();
        int reliabilityPoints = Math.max(0, MAX_RELIABILITY_POINTS - deductions);

        int experiencePoints = experiencePoints(totalRides);

        int total = ratingPoints + completionPoints + reliabilityPoints + experiencePoints;

        return TrustScoreBreakdown.builder()
                .userUid(stats.getUserUid())
                .total(total)
                .category(TrustCategory.fromScore(total))
                .components(TrustScoreBreakdown.Components.builder()
                        .rating(ratingPoints)
                        .completion(completionPoints)
                        .reliability(reliabilityPoints)
                        .experience(experiencePoints)
                        .build())
                .calculations(TrustScoreBreakdown.Calculations.builder()
                        .rating(TrustScoreBreakdown.RatingCalc.builder()
                                .averageRating(RatingMath.round(stats.getAverageRating(), 2))
                                .totalRatings(stats.getTotalRatings())
                                .points(ratingPoints)
                                .build())
                        .completion(TrustScoreBreakdown.CompletionCalc.builder()
                                .completionRate(completionRate)
                                .completedRides(completedRides)
                                .totalRides(totalRides)
                                .points(completionPoints)
                                .build())
                        .reliability(TrustScoreBreakdown.ReliabilityCalc.builder()
                                .cancellations(stats.getCancellations())
                                .lateCancellations(stats.getLateCancellations())
                                .noShows(stats.getNoShows())
                                .deductions(deductions)
                                .points(reliabilityPoints)
                                .build())
                        .experience(TrustScoreBreakdown.ExperienceCalc.builder()
                                .totalRides(totalRides)
                                .points(experiencePoints)
                                .build())
                        .build())
                .build();
    }

    private int ratingPoints(double averageRating, int totalRatings) {
        if (totalRatings == 0) return 0;
        double clamped = Math.max(0.0, Math.min(5.0, averageRating));
        return (int) Math.min(MAX_RATING_POINTS, Math.round(clamped * 6));
    }

    static int experiencePoints(int totalRides) {
        if (totalRides <= 0) return 0;
        if (totalRides <= 5) return 5;
        if (totalRides <= 15) return 10;
        if (totalRides <= 30) return 15;
        return 20;
    }
}
