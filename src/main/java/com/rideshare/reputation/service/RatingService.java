package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.engine.RatingPatternAnalyzer;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.model.RatingPatterns;
import com.rideshare.reputation.repository.RatingRepository;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of ratings: listings for moderators and pattern analysis.
 */
@Service
public class RatingService {

    private final RatingRepository ratingRepo;
    private final RatingPatternAnalyzer patternAnalyzer;
    private final ReputationConfig reputationConfig;

    public RatingService(RatingRepository ratingRepo,
                         RatingPatternAnalyzer patternAnalyzer,
                         ReputationConfig reputationConfig) {
        this.ratingRepo = ratingRepo;
        this.patternAnalyzer = patternAnalyzer;
        this.reputationConfig = reputationConfig;
    }

    public PagedResponse<Rating> listRatings(String rideId, String userUid, Integer page, Integer pageSize) {
        Map<String, String> errors = new LinkedHashMap<>();
        PageRequest pageRequest = PageRequest.resolve(page, pageSize, reputationConfig.getPaging(), errors);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid rating query", errors);
        }
        List<Rating> ratings;
        try {
            ratings = ratingRepo.findByFilters(blankToNull(rideId), blankToNull(userUid));
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read ratings", e);
        }
        return PagedResponse.of(ratings, pageRequest.page(), pageRequest.pageSize());
    }

    /**
     * Patterns over the ratings a user received and/or the ratings of one ride.
     * With neither filter the whole rating set is analyzed.
     */
    public RatingPatterns getPatterns(String userUid, String rideId) {
        List<Rating> population;
        try {
            population = ratingRepo.findPopulation(blankToNull(userUid), blankToNull(rideId));
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read ratings for pattern analysis", e);
        }
        return patternAnalyzer.analyze(population, System.currentTimeMillis());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
