package com.rideshare.reputation.engine;

import com.rideshare.reputation.model.Rating;

import java.util.Collection;

/**
 * Averaging shared by statistics and pattern analysis so both apply the same hidden-rating policy.
 */
public final class RatingMath {

    private RatingMath() {
    }

    /**
     * Mean score of the ratings that count toward the average; 0 when none do.
     * Hidden ratings are included only when {@code includeHidden} is set.
     */
    public static double average(Collection<Rating> ratings, boolean includeHidden) {
        int sum = 0;
        int count = 0;
        for (Rating rating : ratings) {
            if (!includeHidden && !rating.isVisible()) continue;
            sum += rating.getScore();
            count++;
        }
        return count == 0 ? 0.0 : (double) sum / count;
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
