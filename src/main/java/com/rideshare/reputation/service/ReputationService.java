package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.rideshare.reputation.config.MetricsConfig;
import com.rideshare.reputation.engine.TrustScoreCalculator;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.exception.NotFoundException;
import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.AuditLogEntry;
import com.rideshare.reputation.model.ModerationAction;
import com.rideshare.reputation.model.MutationResult;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.model.RatingPatterns;
import com.rideshare.reputation.model.SideEffectOutcome;
import com.rideshare.reputation.model.TrustScoreBreakdown;
import com.rideshare.reputation.model.UserStatistics;
import com.rideshare.reputation.repository.RatingRepository;
import com.rideshare.reputation.repository.TrustScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for reputation mutations. Each mutation commits first and then
 * appends an audit entry on a best-effort basis; the outcome of that append is
 * returned alongside the result instead of failing the request.
 */
@Service
public class ReputationService {

    public static final String ACTION_RECALCULATE = "recalculate_trust_score";
    public static final String ENTITY_USER = "user";
    public static final String ENTITY_RATING = "rating";

    private static final Logger log = LoggerFactory.getLogger(ReputationService.class);

    private final StatisticsService statisticsService;
    private final TrustScoreCalculator calculator;
    private final TrustScoreRepository trustScoreRepo;
    private final RatingRepository ratingRepo;
    private final RatingService ratingService;
    private final AuditTrailService auditTrail;
    private final MetricsConfig metricsConfig;

    public ReputationService(StatisticsService statisticsService,
                             TrustScoreCalculator calculator,
                             TrustScoreRepository trustScoreRepo,
                             RatingRepository ratingRepo,
                             RatingService ratingService,
                             AuditTrailService auditTrail,
                             MetricsConfig metricsConfig) {
        this.statisticsService = statisticsService;
        this.calculator = calculator;
        this.trustScoreRepo = trustScoreRepo;
        this.ratingRepo = ratingRepo;
        this.ratingService = ratingService;
        this.auditTrail = auditTrail;
        this.metricsConfig = metricsConfig;
    }

    public MutationResult<TrustScoreBreakdown> recalculateTrustScore(String uid, String adminUid) {
        requireAdmin(adminUid);

        UserStatistics stats = statisticsService.getStatistics(uid);
        TrustScoreBreakdown prior = readScore(uid);
        TrustScoreBreakdown breakdown = calculator.calculate(stats);

        try {
            trustScoreRepo.save(breakdown, System.currentTimeMillis());
        } catch (AerospikeException e) {
            throw new InternalException("Failed to store trust score for " + uid, e);
        }

        metricsConfig.recordRecalculation(breakdown.getCategory().name(), breakdown.getTotal());
        log.info("Trust score recalculated: user={}, total={}, category={}, by={}",
                uid, breakdown.getTotal(), breakdown.getCategory().getLabel(), adminUid);

        SideEffectOutcome audit = auditTrail.recordBestEffort(adminUid, ACTION_RECALCULATE, ENTITY_USER, uid,
                prior != null ? scoreSnapshot(prior) : null, scoreSnapshot(breakdown));
        return MutationResult.of(breakdown, audit);
    }

    public TrustScoreBreakdown getBreakdown(String uid) {
        TrustScoreBreakdown breakdown = readScore(uid);
        if (breakdown == null) {
            throw new NotFoundException("No trust score calculated yet for user: " + uid);
        }
        return breakdown;
    }

    public MutationResult<Rating> moderateRating(String rideId, String raterUid,
                                                 ModerationAction action, String adminUid) {
        requireAdmin(adminUid);

        Rating rating;
        try {
            rating = ratingRepo.findByKey(rideId, raterUid);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read rating " + Rating.ratingId(rideId, raterUid), e);
        }
        if (rating == null) {
            throw NotFoundException.of("Rating", Rating.ratingId(rideId, raterUid));
        }

        return switch (action) {
            case HIDE -> hide(rating, adminUid);
            case DELETE -> delete(rating, adminUid);
        };
    }

    public RatingPatterns getPatterns(String userUid, String rideId) {
        return ratingService.getPatterns(userUid, rideId);
    }

    public PagedResponse<AuditLogEntry> listAuditLog(String adminUid, String entityType, String entityId,
                                                     String startDate, String endDate,
                                                     Integer page, Integer pageSize) {
        return auditTrail.list(adminUid, entityType, entityId, startDate, endDate, page, pageSize);
    }

    private MutationResult<Rating> hide(Rating rating, String adminUid) {
        if (!rating.isVisible()) {
            log.info("Rating {} already hidden, nothing to do", rating.getRatingId());
            return MutationResult.of(rating, auditTrail.skipped("rating already hidden"));
        }

        long now = System.currentTimeMillis();
        boolean hidden;
        try {
            hidden = ratingRepo.hide(rating.getRideId(), rating.getRaterUid(), now);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to hide rating " + rating.getRatingId(), e);
        }
        if (!hidden) {
            throw NotFoundException.of("Rating", rating.getRatingId());
        }

        Rating updated = rating.toBuilder().visible(false).updatedAt(now).build();
        metricsConfig.recordModeration(ModerationAction.HIDE.name());
        log.info("Rating hidden: {} by {}", rating.getRatingId(), adminUid);

        Map<String, Object> before = keySnapshot(rating);
        before.put("isVisible", true);
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("isVisible", false);

        SideEffectOutcome audit = auditTrail.recordBestEffort(adminUid, ModerationAction.HIDE.auditAction(),
                ENTITY_RATING, rating.getRatingId(), before, after);
        return MutationResult.of(updated, audit);
    }

    private MutationResult<Rating> delete(Rating rating, String adminUid) {
        boolean deleted;
        try {
            deleted = ratingRepo.delete(rating.getRideId(), rating.getRaterUid());
        } catch (AerospikeException e) {
            throw new InternalException("Failed to delete rating " + rating.getRatingId(), e);
        }
        if (!deleted) {
            throw NotFoundException.of("Rating", rating.getRatingId());
        }

        metricsConfig.recordModeration(ModerationAction.DELETE.name());
        log.info("Rating deleted: {} by {}", rating.getRatingId(), adminUid);

        Map<String, Object> before = keySnapshot(rating);
        before.put("score", rating.getScore());
        before.put("isVisible", rating.isVisible());

        SideEffectOutcome audit = auditTrail.recordBestEffort(adminUid, ModerationAction.DELETE.auditAction(),
                ENTITY_RATING, rating.getRatingId(), before, null);
        return MutationResult.of(rating, audit);
    }

    private TrustScoreBreakdown readScore(String uid) {
        try {
            return trustScoreRepo.findByUid(uid);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read trust score for " + uid, e);
        }
    }

    private static Map<String, Object> scoreSnapshot(TrustScoreBreakdown breakdown) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("total", breakdown.getTotal());
        snapshot.put("category", breakdown.getCategory().getLabel());
        return snapshot;
    }

    private static Map<String, Object> keySnapshot(Rating rating) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("rideId", rating.getRideId());
        snapshot.put("raterUid", rating.getRaterUid());
        snapshot.put("ratedUid", rating.getRatedUid());
        return snapshot;
    }

    static void requireAdmin(String adminUid) {
        if (adminUid == null || adminUid.isBlank()) {
            throw new ValidationException("Acting administrator is required",
                    Map.of("adminUid", "is required"));
        }
    }
}
