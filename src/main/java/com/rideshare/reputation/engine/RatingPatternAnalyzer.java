package com.rideshare.reputation.engine;

import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.model.RatingPatterns;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribution and anomaly flags over a population of ratings. Does no I/O.
 */
@Component
public class RatingPatternAnalyzer {

    private final ReputationConfig.Ratings ratingsConfig;

    public RatingPatternAnalyzer(ReputationConfig reputationConfig) {
        this.ratingsConfig = reputationConfig.getRatings();
    }

    /**
     * @param population every rating to analyze, hidden ones included
     * @param now        reference instant for the recent window, epoch milliseconds
     */
    public RatingPatterns analyze(List<Rating> population, long now) {
        int[] stars = new int[6];
        int hiddenCount = 0;
        int recentLow = 0;
        long recentSince = now - Duration.ofDays(ratingsConfig.getRecentWindowDays()).toMillis();
        Map<String, Integer> oneStarByRater = new HashMap<>();

        for (Rating rating : population) {
            int score = rating.getScore();
            if (score >= 1 && score <= 5) {
                stars[score]++;
            }
            if (!rating.isVisible()) {
                hiddenCount++;
            }
            if (score < ratingsConfig.getLowRatingThreshold() && rating.getCreatedAt() >= recentSince) {
                recentLow++;
            }
            if (score == 1) {
                oneStarByRater.merge(rating.getRaterUid(), 1, Integer::sum);
            }
        }

        int total = population.size();
        boolean multipleOneStar = oneStarByRater.values().stream().anyMatch(count -> count > 1);
        boolean highHiddenRate = total > 0
                && (double) hiddenCount / total > ratingsConfig.getHiddenRateThreshold();

        double average = RatingMath.average(population, ratingsConfig.isHiddenCountsTowardAverage());

        return RatingPatterns.builder()
                .totalRatings(total)
                .averageRating(RatingMath.round(average, 1))
                .distribution(RatingPatterns.Distribution.builder()
                        .oneStar(stars[1])
                        .twoStar(stars[2])
                        .threeStar(stars[3])
                        .fourStar(stars[4])
                        .fiveStar(stars[5])
                        .build())
                .hiddenCount(hiddenCount)
                .recentLowRatings(recentLow)
                .suspiciousPatterns(RatingPatterns.SuspiciousPatterns.builder()
                        .hasMultipleOneStarFromSameUser(multipleOneStar)
                        .hasUnusuallyHighHiddenRate(highHiddenRate)
                        .build())
                .build();
    }
}
