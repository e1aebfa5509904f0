package com.rideshare.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one trust score calculation. Deterministic in the user's statistics,
 * so it carries no timestamp; the store records {@code calculatedAt} alongside it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Trust score with per-component points and the inputs behind them")
public class TrustScoreBreakdown {

    @Schema(description = "User UID", example = "user-rider-01")
    private String userUid;

    @Schema(description = "Sum of the four components, 0-100", example = "72")
    private int total;

    @Schema(description = "Excellent (>=80), Good (>=60), Fair (>=40) or Poor", example = "Good")
    private TrustCategory category;

    private Components components;

    private Calculations calculations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Components {
        @Schema(description = "0-30")
        private int rating;
        @Schema(description = "0-25")
        private int completion;
        @Schema(description = "0-25")
        private int reliability;
        @Schema(description = "0-20")
        private int experience;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Calculations {
        private RatingCalc rating;
        private CompletionCalc completion;
        private ReliabilityCalc reliability;
        private ExperienceCalc experience;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RatingCalc {
        private double averageRating;
        private int totalRatings;
        private int points;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompletionCalc {
        @Schema(description = "Completed over total terminal rides, as a percentage with two decimals", example = "87.5")
        private double completionRate;
        private int completedRides;
        private int totalRides;
        private int points;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReliabilityCalc {
        private int cancellations;
        private int lateCancellations;
        private int noShows;
        @Schema(description = "Penalty points before flooring the component at zero")
        private int deductions;
        private int points;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExperienceCalc {
        private int totalRides;
        private int points;
    }
}
