package com.rideshare.reputation.service;

import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.TrustRankingEntry;
import com.rideshare.reputation.repository.TrustScoreRepository;
import com.rideshare.reputation.repository.UserRepository;
import com.rideshare.reputation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static com.rideshare.reputation.testutil.TestDataFactory.createRankingEntry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TrustRankingServiceTest {

    @Mock private TrustScoreRepository trustScoreRepo;
    @Mock private UserRepository userRepo;

    private TrustRankingService service;

    @BeforeEach
    void setUp() {
        service = new TrustRankingService(trustScoreRepo, userRepo, TestDataFactory.defaultConfig());
        when(trustScoreRepo.findAll()).thenReturn(List.of(
                createRankingEntry("U1", 45),
                createRankingEntry("U2", 92),
                createRankingEntry("U3", 67),
                createRankingEntry("U4", 12),
                createRankingEntry("U5", 67)));
        when(userRepo.findByUid(anyString())).thenAnswer(inv -> TestDataFactory.createUser(inv.getArgument(0)));
    }

    @Test
    void getRanking_highestFirstTiesByUid() {
        PagedResponse<TrustRankingEntry> result = service.getRanking(null, null, null, null);

        assertThat(result.data()).extracting(TrustRankingEntry::getUserUid)
                .containsExactly("U2", "U3", "U5", "U1", "U4");
        assertThat(result.total()).isEqualTo(5);
        assertThat(result.pageSize()).isEqualTo(50);
        assertThat(result.data().get(0).getDisplayName()).isEqualTo("User U2");
    }

    @Test
    void getRanking_boundsInclusive() {
        PagedResponse<TrustRankingEntry> result = service.getRanking(45, 67, null, null);

        assertThat(result.data()).extracting(TrustRankingEntry::getTotal).containsExactly(67, 67, 45);
    }

    @Test
    void getRanking_paginates() {
        PagedResponse<TrustRankingEntry> result = service.getRanking(null, null, 2, 2);

        assertThat(result.data()).extracting(TrustRankingEntry::getUserUid).containsExactly("U5", "U1");
        assertThat(result.totalPages()).isEqualTo(3);
    }

    @Test
    void getRanking_invalidBounds_rejected() {
        assertThatThrownBy(() -> service.getRanking(-1, 101, null, null))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getDetails())
                        .containsKeys("minScore", "maxScore"));
        assertThatThrownBy(() -> service.getRanking(80, 20, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void getRanking_displayNameLookupFailure_stillReturnsEntries() {
        when(userRepo.findByUid("U2")).thenThrow(new IllegalStateException("identity store down"));

        PagedResponse<TrustRankingEntry> result = service.getRanking(90, null, null, null);

        assertThat(result.data()).hasSize(1);
        assertThat(result.data().get(0).getDisplayName()).isNull();
    }

    @Test
    void getOutliers_strictThresholdsLowestFirst() {
        List<TrustRankingEntry> outliers = service.getOutliers(45, 67);

        assertThat(outliers).extracting(TrustRankingEntry::getUserUid).containsExactly("U4", "U2");
    }

    @Test
    void getOutliers_noThresholds_empty() {
        assertThat(service.getOutliers(null, null)).isEmpty();
        verify(trustScoreRepo, never()).findAll();
    }

    @Test
    void getOutliers_outOfRange_rejected() {
        assertThatThrownBy(() -> service.getOutliers(200, null))
                .isInstanceOf(ValidationException.class);
    }
}
