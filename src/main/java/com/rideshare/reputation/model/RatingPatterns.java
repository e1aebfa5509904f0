package com.rideshare.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Rating distribution and anomaly flags for a population of ratings")
public class RatingPatterns {

    @Schema(description = "All ratings in the population, hidden ones included")
    private int totalRatings;

    @Schema(description = "Average score rounded to one decimal; 0 for an empty population", example = "4.3")
    private double averageRating;

    private Distribution distribution;

    private int hiddenCount;

    @Schema(description = "Ratings below the low threshold created inside the recent window")
    private int recentLowRatings;

    private SuspiciousPatterns suspiciousPatterns;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Distribution {
        private int oneStar;
        private int twoStar;
        private int threeStar;
        private int fourStar;
        private int fiveStar;

        public int sum() {
            return oneStar + twoStar + threeStar + fourStar + fiveStar;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SuspiciousPatterns {
        private boolean hasMultipleOneStarFromSameUser;
        private boolean hasUnusuallyHighHiddenRate;
    }
}
