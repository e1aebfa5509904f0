package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.rideshare.reputation.config.MetricsConfig;
import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.engine.RatingPatternAnalyzer;
import com.rideshare.reputation.engine.TrustScoreCalculator;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.exception.NotFoundException;
import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.*;
import com.rideshare.reputation.repository.AuditLogRepository;
import com.rideshare.reputation.repository.RatingRepository;
import com.rideshare.reputation.repository.RideRepository;
import com.rideshare.reputation.repository.TrustScoreRepository;
import com.rideshare.reputation.repository.UserRepository;
import com.rideshare.reputation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.rideshare.reputation.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReputationServiceTest {

    @Mock private UserRepository userRepo;
    @Mock private RideRepository rideRepo;
    @Mock private RatingRepository ratingRepo;
    @Mock private TrustScoreRepository trustScoreRepo;
    @Mock private AuditLogRepository auditLogRepo;
    @Mock private MetricsConfig metricsConfig;

    private final Map<String, TrustScoreBreakdown> storedScores = new HashMap<>();
    private final Map<String, Rating> storedRatings = new LinkedHashMap<>();
    private final List<AuditLogEntry> auditLog = new ArrayList<>();

    private ReputationService service;

    @BeforeEach
    void setUp() {
        ReputationConfig config = TestDataFactory.defaultConfig();
        StatisticsService statisticsService = new StatisticsService(userRepo, rideRepo, ratingRepo, config);
        RatingService ratingService = new RatingService(ratingRepo, new RatingPatternAnalyzer(config), config);
        AuditTrailService auditTrail = new AuditTrailService(auditLogRepo, config, metricsConfig);
        service = new ReputationService(statisticsService, new TrustScoreCalculator(config), trustScoreRepo,
                ratingRepo, ratingService, auditTrail, metricsConfig);

        // In-memory stores behind the repository mocks
        when(trustScoreRepo.findByUid(anyString())).thenAnswer(inv -> storedScores.get(inv.<String>getArgument(0)));
        doAnswer(inv -> {
            TrustScoreBreakdown breakdown = inv.getArgument(0);
            storedScores.put(breakdown.getUserUid(), breakdown);
            return null;
        }).when(trustScoreRepo).save(any(), anyLong());

        when(ratingRepo.findByKey(anyString(), anyString())).thenAnswer(inv ->
                storedRatings.get(Rating.ratingId(inv.getArgument(0), inv.getArgument(1))));
        when(ratingRepo.findByRatedUid(anyString())).thenAnswer(inv -> storedRatings.values().stream()
                .filter(r -> r.getRatedUid().equals(inv.getArgument(0)))
                .toList());
        when(ratingRepo.hide(anyString(), anyString(), anyLong())).thenAnswer(inv -> {
            String id = Rating.ratingId(inv.getArgument(0), inv.getArgument(1));
            Rating rating = storedRatings.get(id);
            if (rating == null) return false;
            storedRatings.put(id, rating.toBuilder().visible(false).build());
            return true;
        });
        when(ratingRepo.delete(anyString(), anyString())).thenAnswer(inv ->
                storedRatings.remove(Rating.ratingId(inv.getArgument(0), inv.getArgument(1))) != null);

        doAnswer(inv -> auditLog.add(inv.getArgument(0))).when(auditLogRepo).append(any());

        when(userRepo.exists("U1")).thenReturn(true);
        when(rideRepo.findByParticipant("U1")).thenReturn(List.of(
                createCompletedRide("R1", "U1", "P1"),
                createCompletedRide("R2", "U1", "P2"),
                createCancelledRide("R3", "U1", "P3", "U1", 2, CancellationCategory.PERSONAL_EMERGENCY)));
    }

    @Test
    void recalculateTrustScore_firstTime_auditHasNoBefore() {
        storeRating(createRating("R1", "P1", "U1", 5));

        MutationResult<TrustScoreBreakdown> result = service.recalculateTrustScore("U1", "ADMIN");

        assertThat(result.result().getUserUid()).isEqualTo("U1");
        assertThat(storedScores).containsKey("U1");
        assertThat(result.sideEffect(AuditTrailService.SIDE_EFFECT_NAME).status())
                .isEqualTo(SideEffectOutcome.Status.SUCCEEDED);

        AuditLogEntry entry = auditLog.get(0);
        assertThat(entry.getAction()).isEqualTo("recalculate_trust_score");
        assertThat(entry.getEntityType()).isEqualTo("user");
        assertThat(entry.getEntityId()).isEqualTo("U1");
        assertThat(entry.getAdminUid()).isEqualTo("ADMIN");
        assertThat(entry.getDiff().getBefore()).isNull();
        assertThat(entry.getDiff().getAfter())
                .containsEntry("total", result.result().getTotal())
                .containsEntry("category", result.result().getCategory().getLabel());
    }

    @Test
    void recalculateTrustScore_twiceWithoutChanges_identicalBreakdownAndAuditPair() {
        storeRating(createRating("R1", "P1", "U1", 4));

        TrustScoreBreakdown first = service.recalculateTrustScore("U1", "ADMIN").result();
        TrustScoreBreakdown second = service.recalculateTrustScore("U1", "ADMIN").result();
        TrustScoreBreakdown third = service.recalculateTrustScore("U1", "ADMIN").result();

        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
        assertThat(auditLog).hasSize(3);
        assertThat(auditLog.get(1).getDiff().getBefore()).isEqualTo(auditLog.get(1).getDiff().getAfter());
        assertThat(auditLog.get(2).getDiff()).isEqualTo(auditLog.get(1).getDiff());
    }

    @Test
    void recalculateTrustScore_auditFailure_mutationStillCommitted() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT, "audit store down"))
                .when(auditLogRepo).append(any());

        MutationResult<TrustScoreBreakdown> result = service.recalculateTrustScore("U1", "ADMIN");

        assertThat(storedScores).containsKey("U1");
        assertThat(result.hasFailedSideEffects()).isTrue();
        assertThat(result.sideEffect("audit").status()).isEqualTo(SideEffectOutcome.Status.FAILED);
        verify(metricsConfig).recordSideEffect("audit", "failed");
    }

    @Test
    void recalculateTrustScore_storeFailure_throwsInternal() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT, "down"))
                .when(trustScoreRepo).save(any(), anyLong());

        assertThatThrownBy(() -> service.recalculateTrustScore("U1", "ADMIN"))
                .isInstanceOf(InternalException.class);
        assertThat(auditLog).isEmpty();
    }

    @Test
    void recalculateTrustScore_unknownUser_throwsNotFound() {
        when(userRepo.exists("GHOST")).thenReturn(false);

        assertThatThrownBy(() -> service.recalculateTrustScore("GHOST", "ADMIN"))
                .isInstanceOf(NotFoundException.class);
        assertThat(auditLog).isEmpty();
    }

    @Test
    void recalculateTrustScore_missingAdmin_throwsValidation() {
        assertThatThrownBy(() -> service.recalculateTrustScore("U1", " "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void getBreakdown_neverCalculated_throwsNotFound() {
        assertThatThrownBy(() -> service.getBreakdown("U1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void getBreakdown_returnsStoredScore() {
        service.recalculateTrustScore("U1", "ADMIN");
        assertThat(service.getBreakdown("U1")).isEqualTo(storedScores.get("U1"));
    }

    @Test
    void moderateRating_hide_setsInvisibleAndAudits() {
        storeRating(createRating("R1", "P1", "U1", 2));

        MutationResult<Rating> result = service.moderateRating("R1", "P1", ModerationAction.HIDE, "ADMIN");

        assertThat(result.result().isVisible()).isFalse();
        assertThat(storedRatings.get("R1:P1").isVisible()).isFalse();

        AuditLogEntry entry = auditLog.get(0);
        assertThat(entry.getAction()).isEqualTo("hide_rating");
        assertThat(entry.getEntityType()).isEqualTo("rating");
        assertThat(entry.getEntityId()).isEqualTo("R1:P1");
        assertThat(entry.getDiff().getBefore()).containsEntry("isVisible", true).containsEntry("rideId", "R1");
        assertThat(entry.getDiff().getAfter()).containsExactly(Map.entry("isVisible", false));
        verify(metricsConfig).recordModeration("HIDE");
    }

    @Test
    void moderateRating_hideAlreadyHidden_noWriteAndAuditSkipped() {
        storeRating(createRating("R1", "P1", "U1", 2, false, System.currentTimeMillis()));

        MutationResult<Rating> result = service.moderateRating("R1", "P1", ModerationAction.HIDE, "ADMIN");

        assertThat(result.sideEffect("audit").status()).isEqualTo(SideEffectOutcome.Status.SKIPPED);
        verify(ratingRepo, never()).hide(anyString(), anyString(), anyLong());
        assertThat(auditLog).isEmpty();
    }

    @Test
    void moderateRating_delete_removesAndAuditsWithoutAfter() {
        storeRating(createRating("R1", "P1", "U1", 1));

        service.moderateRating("R1", "P1", ModerationAction.DELETE, "ADMIN");

        assertThat(storedRatings).doesNotContainKey("R1:P1");
        AuditLogEntry entry = auditLog.get(0);
        assertThat(entry.getAction()).isEqualTo("delete_rating");
        assertThat(entry.getDiff().getBefore()).containsEntry("score", 1).containsEntry("isVisible", true);
        assertThat(entry.getDiff().getAfter()).isNull();
    }

    @Test
    void moderateRating_deletedRatingNoLongerAffectsScoreOrPatterns() {
        storeRating(createRating("R1", "P1", "U1", 5));
        storeRating(createRating("R2", "P2", "U1", 1));
        when(ratingRepo.findPopulation(eq("U1"), isNull())).thenAnswer(inv -> List.copyOf(storedRatings.values()));

        int before = service.recalculateTrustScore("U1", "ADMIN").result().getComponents().getRating();
        service.moderateRating("R2", "P2", ModerationAction.DELETE, "ADMIN");
        TrustScoreBreakdown after = service.recalculateTrustScore("U1", "ADMIN").result();

        assertThat(before).isEqualTo(18);
        assertThat(after.getComponents().getRating()).isEqualTo(30);
        assertThat(after.getCalculations().getRating().getTotalRatings()).isEqualTo(1);
        assertThat(service.getPatterns("U1", null).getDistribution().getOneStar()).isZero();
    }

    @Test
    void moderateRating_unknownRating_throwsNotFound() {
        assertThatThrownBy(() -> service.moderateRating("R9", "X", ModerationAction.DELETE, "ADMIN"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("R9:X");
        assertThat(auditLog).isEmpty();
    }

    @Test
    void moderateRating_auditFailure_stillReturnsResult() {
        storeRating(createRating("R1", "P1", "U1", 3));
        doThrow(new AerospikeException(ResultCode.SERVER_ERROR, "boom")).when(auditLogRepo).append(any());

        MutationResult<Rating> result = service.moderateRating("R1", "P1", ModerationAction.DELETE, "ADMIN");

        assertThat(storedRatings).isEmpty();
        assertThat(result.result().getRideId()).isEqualTo("R1");
        assertThat(result.hasFailedSideEffects()).isTrue();
    }

    @Test
    void listAuditLog_delegatesWithResolvedPaging() {
        PagedResponse<AuditLogEntry> page = new PagedResponse<>(List.of(), 0, 1, 50, 0);
        when(auditLogRepo.findByFilters(any(), eq(1), eq(50))).thenReturn(page);

        assertThat(service.listAuditLog("ADMIN", null, null, null, null, null, null)).isSameAs(page);

        ArgumentCaptor<AuditFilter> filter = ArgumentCaptor.forClass(AuditFilter.class);
        verify(auditLogRepo).findByFilters(filter.capture(), eq(1), eq(50));
        assertThat(filter.getValue().adminUid()).isEqualTo("ADMIN");
    }

    private void storeRating(Rating rating) {
        storedRatings.put(rating.getRatingId(), rating);
    }

    @Test
    void moderateRating_storageReadFault_becomesInternalError() {
        when(ratingRepo.findByKey("R1", "P1")).thenThrow(new AerospikeException(ResultCode.TIMEOUT));

        assertThatThrownBy(() -> service.moderateRating("R1", "P1", ModerationAction.HIDE, "ADMIN"))
                .isInstanceOf(InternalException.class)
                .hasMessageContaining("R1:P1");
        assertThat(auditLog).isEmpty();
    }

    @Test
    void getBreakdown_storageReadFault_becomesInternalError() {
        when(trustScoreRepo.findByUid("U1")).thenThrow(new AerospikeException(ResultCode.TIMEOUT));

        assertThatThrownBy(() -> service.getBreakdown("U1"))
                .isInstanceOf(InternalException.class);
    }
}
