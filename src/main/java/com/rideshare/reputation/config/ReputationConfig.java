package com.rideshare.reputation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reputation")
public class ReputationConfig {

    private Scoring scoring = new Scoring();

    private Ratings ratings = new Ratings();

    private Paging paging = new Paging();

    @Data
    public static class Scoring {
        // Points deducted from the reliability component (max 25) per event.
        private int cancellationPenalty = 2;
        private int lateCancellationPenalty = 5;
        private int noShowPenalty = 10;

        // A cancellation closer than this to scheduled departure is "late".
        private int lateCancellationWindowHours = 24;
    }

    @Data
    public static class Ratings {
        // false: hidden ratings count toward totalRatings but not averageRating.
        // Applies to trust scoring and pattern analysis alike.
        private boolean hiddenCountsTowardAverage = false;

        // hiddenCount / totalRatings strictly above this raises the hidden-rate flag.
        private double hiddenRateThreshold = 0.20;

        private int recentWindowDays = 30;

        // Ratings strictly below this score are "low".
        private int lowRatingThreshold = 3;
    }

    // Page-number pagination shared by audit log, rating and ranking listings.
    @Data
    public static class Paging {
        private int defaultPageSize = 50;
        private int maxPageSize = 100;
    }
}
