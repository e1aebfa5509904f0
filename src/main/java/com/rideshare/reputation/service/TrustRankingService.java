package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.TrustRankingEntry;
import com.rideshare.reputation.model.UserProfile;
import com.rideshare.reputation.repository.TrustScoreRepository;
import com.rideshare.reputation.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Queries over stored trust scores. Users never recalculated do not appear.
 */
@Service
public class TrustRankingService {

    private static final Logger log = LoggerFactory.getLogger(TrustRankingService.class);

    private final TrustScoreRepository trustScoreRepo;
    private final UserRepository userRepo;
    private final ReputationConfig reputationConfig;

    public TrustRankingService(TrustScoreRepository trustScoreRepo,
                               UserRepository userRepo,
                               ReputationConfig reputationConfig) {
        this.trustScoreRepo = trustScoreRepo;
        this.userRepo = userRepo;
        this.reputationConfig = reputationConfig;
    }

    /**
     * Highest score first; ties broken by user uid. Both bounds inclusive.
     */
    public PagedResponse<TrustRankingEntry> getRanking(Integer minScore, Integer maxScore,
                                                       Integer page, Integer pageSize) {
        Map<String, String> errors = new LinkedHashMap<>();
        checkScore("minScore", minScore, errors);
        checkScore("maxScore", maxScore, errors);
        if (minScore != null && maxScore != null && minScore > maxScore) {
            errors.put("maxScore", "must not be less than minScore");
        }
        PageRequest pageRequest = PageRequest.resolve(page, pageSize, reputationConfig.getPaging(), errors);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid trust ranking query", errors);
        }

        List<TrustRankingEntry> ranked = load(entry ->
                        (minScore == null || entry.getTotal() >= minScore)
                        && (maxScore == null || entry.getTotal() <= maxScore),
                Comparator.comparingInt(TrustRankingEntry::getTotal).reversed()
                        .thenComparing(TrustRankingEntry::getUserUid));

        PagedResponse<TrustRankingEntry> result = PagedResponse.of(ranked, pageRequest.page(), pageRequest.pageSize());
        result.data().forEach(this::attachDisplayName);
        return result;
    }

    /**
     * Users scoring strictly below {@code below} or strictly above {@code above}, lowest first.
     * Empty when neither threshold is given.
     */
    public List<TrustRankingEntry> getOutliers(Integer below, Integer above) {
        Map<String, String> errors = new LinkedHashMap<>();
        checkScore("below", below, errors);
        checkScore("above", above, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid trust outlier query", errors);
        }
        if (below == null && above == null) {
            return List.of();
        }

        List<TrustRankingEntry> outliers = load(entry ->
                        (below != null && entry.getTotal() < below)
                        || (above != null && entry.getTotal() > above),
                Comparator.comparingInt(TrustRankingEntry::getTotal)
                        .thenComparing(TrustRankingEntry::getUserUid));
        outliers.forEach(this::attachDisplayName);
        return outliers;
    }

    private List<TrustRankingEntry> load(Predicate<TrustRankingEntry> filter,
                                         Comparator<TrustRankingEntry> order) {
        List<TrustRankingEntry> stored;
        try {
            stored = trustScoreRepo.findAll();
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read stored trust scores", e);
        }
        return stored.stream()
                .filter(filter)
                .sorted(order)
                .toList();
    }

    private void attachDisplayName(TrustRankingEntry entry) {
        try {
            UserProfile user = userRepo.findByUid(entry.getUserUid());
            if (user != null) {
                entry.setDisplayName(user.getDisplayName());
            }
        } catch (RuntimeException e) {
            log.warn("Could not resolve display name for user={}: {}", entry.getUserUid(), e.getMessage());
        }
    }

    private static void checkScore(String field, Integer value, Map<String, String> errors) {
        if (value != null && (value < 0 || value > 100)) {
            errors.put(field, "must be between 0 and 100");
        }
    }
}
