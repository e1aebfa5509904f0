package com.rideshare.reputation.engine;

import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.model.RatingPatterns;
import com.rideshare.reputation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.rideshare.reputation.testutil.TestDataFactory.DAY;
import static com.rideshare.reputation.testutil.TestDataFactory.createRating;
import static org.assertj.core.api.Assertions.assertThat;

class RatingPatternAnalyzerTest {

    private static final long NOW = 1_700_000_000_000L;

    private RatingPatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new RatingPatternAnalyzer(TestDataFactory.defaultConfig());
    }

    @Test
    void analyze_emptyPopulation_allZeroAndNoFlags() {
        RatingPatterns result = analyzer.analyze(List.of(), NOW);

        assertThat(result.getTotalRatings()).isZero();
        assertThat(result.getAverageRating()).isZero();
        assertThat(result.getDistribution().sum()).isZero();
        assertThat(result.getSuspiciousPatterns().isHasUnusuallyHighHiddenRate()).isFalse();
        assertThat(result.getSuspiciousPatterns().isHasMultipleOneStarFromSameUser()).isFalse();
    }

    @Test
    void analyze_distributionSumsToTotal() {
        List<Rating> ratings = List.of(
                rating("R1", "A", 1), rating("R2", "B", 2), rating("R3", "C", 5),
                rating("R4", "D", 5), rating("R5", "E", 4), rating("R6", "F", 3));

        RatingPatterns result = analyzer.analyze(ratings, NOW);

        RatingPatterns.Distribution d = result.getDistribution();
        assertThat(d.sum()).isEqualTo(result.getTotalRatings()).isEqualTo(6);
        assertThat(d.getOneStar()).isEqualTo(1);
        assertThat(d.getFiveStar()).isEqualTo(2);
        assertThat(result.getAverageRating()).isEqualTo(3.3);
    }

    @Test
    void analyze_hiddenRateAboveThreshold_flagged() {
        List<Rating> ratings = population(10, 3);

        RatingPatterns result = analyzer.analyze(ratings, NOW);

        assertThat(result.getHiddenCount()).isEqualTo(3);
        assertThat(result.getSuspiciousPatterns().isHasUnusuallyHighHiddenRate()).isTrue();
    }

    @Test
    void analyze_hiddenRateAtThreshold_notFlagged() {
        RatingPatterns result = analyzer.analyze(population(10, 2), NOW);

        assertThat(result.getHiddenCount()).isEqualTo(2);
        assertThat(result.getSuspiciousPatterns().isHasUnusuallyHighHiddenRate()).isFalse();
    }

    @Test
    void analyze_twoOneStarsFromSameRater_flagged() {
        List<Rating> ratings = List.of(rating("R1", "A", 1), rating("R2", "A", 1), rating("R3", "B", 5));

        assertThat(analyzer.analyze(ratings, NOW).getSuspiciousPatterns().isHasMultipleOneStarFromSameUser())
                .isTrue();
    }

    @Test
    void analyze_oneStarsFromDifferentRaters_notFlagged() {
        List<Rating> ratings = List.of(rating("R1", "A", 1), rating("R2", "B", 1), rating("R3", "A", 2));

        assertThat(analyzer.analyze(ratings, NOW).getSuspiciousPatterns().isHasMultipleOneStarFromSameUser())
                .isFalse();
    }

    @Test
    void analyze_recentLowRatings_onlyInsideWindowAndBelowThree() {
        List<Rating> ratings = List.of(
                createRating("R1", "A", "U", 1, true, NOW - 2 * DAY),
                createRating("R2", "B", "U", 2, true, NOW - 29 * DAY),
                createRating("R3", "C", "U", 3, true, NOW - DAY),
                createRating("R4", "D", "U", 2, true, NOW - 31 * DAY));

        assertThat(analyzer.analyze(ratings, NOW).getRecentLowRatings()).isEqualTo(2);
    }

    @Test
    void analyze_hiddenRatingsCountedButExcludedFromAverage() {
        List<Rating> ratings = List.of(
                createRating("R1", "A", "U", 5, true, NOW),
                createRating("R2", "B", "U", 1, false, NOW));

        RatingPatterns result = analyzer.analyze(ratings, NOW);

        assertThat(result.getTotalRatings()).isEqualTo(2);
        assertThat(result.getDistribution().getOneStar()).isEqualTo(1);
        assertThat(result.getAverageRating()).isEqualTo(5.0);
    }

    @Test
    void analyze_hiddenCountsTowardAverageWhenConfigured() {
        ReputationConfig config = TestDataFactory.defaultConfig();
        config.getRatings().setHiddenCountsTowardAverage(true);
        RatingPatternAnalyzer inclusive = new RatingPatternAnalyzer(config);

        List<Rating> ratings = List.of(
                createRating("R1", "A", "U", 5, true, NOW),
                createRating("R2", "B", "U", 1, false, NOW));

        assertThat(inclusive.analyze(ratings, NOW).getAverageRating()).isEqualTo(3.0);
    }

    private static Rating rating(String rideId, String raterUid, int score) {
        return createRating(rideId, raterUid, "U", score, true, NOW - DAY);
    }

    private static List<Rating> population(int total, int hidden) {
        List<Rating> ratings = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            ratings.add(createRating("R" + i, "rater-" + i, "U", 4, i >= hidden, NOW - DAY));
        }
        return ratings;
    }
}
