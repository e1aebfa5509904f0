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
@Schema(description = "Stored trust score of one user, as listed in rankings")
public class TrustRankingEntry {
    private String userUid;
    @Schema(description = "Display name from the identity store, null when unavailable")
    private String displayName;
    private int total;
    private TrustCategory category;
    @Schema(description = "When the score was last recalculated, epoch milliseconds")
    private long calculatedAt;
}
