package com.rideshare.reputation.controller;

import com.rideshare.reputation.model.MutationResult;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.TrustRankingEntry;
import com.rideshare.reputation.model.TrustScoreBreakdown;
import com.rideshare.reputation.service.ReputationService;
import com.rideshare.reputation.service.TrustRankingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Trust Scores", description = "Recalculate, inspect and rank user trust scores")
public class TrustScoreController {

    private final ReputationService reputationService;
    private final TrustRankingService rankingService;

    public TrustScoreController(ReputationService reputationService,
                                TrustRankingService rankingService) {
        this.reputationService = reputationService;
        this.rankingService = rankingService;
    }

    @PostMapping("/users/{uid}/trust/recalculate")
    @Operation(summary = "Recalculate a user's trust score",
               description = "Recomputes the score from current rides and ratings, replaces the stored " +
                       "breakdown and appends a best-effort audit entry.")
    public ResponseEntity<MutationResult<TrustScoreBreakdown>> recalculate(
            @PathVariable String uid,
            @Parameter(description = "UID of the acting administrator")
            @RequestHeader("X-Admin-Uid") String adminUid) {
        return ResponseEntity.ok(reputationService.recalculateTrustScore(uid, adminUid));
    }

    @GetMapping("/users/{uid}/trust/breakdown")
    @Operation(summary = "Get the stored trust score breakdown",
               description = "404 until the score has been calculated at least once")
    public ResponseEntity<TrustScoreBreakdown> getBreakdown(@PathVariable String uid) {
        return ResponseEntity.ok(reputationService.getBreakdown(uid));
    }

    @GetMapping("/trust/ranking")
    @Operation(summary = "Rank users by stored trust score",
               description = "Highest first. Optional inclusive score bounds, page-number pagination.")
    public ResponseEntity<PagedResponse<TrustRankingEntry>> getRanking(
            @Parameter(description = "Lowest score to include (0-100)") @RequestParam(required = false) Integer minScore,
            @Parameter(description = "Highest score to include (0-100)") @RequestParam(required = false) Integer maxScore,
            @Parameter(description = "1-based page number") @RequestParam(required = false) Integer page,
            @Parameter(description = "Page size, 1-100 (default 50)") @RequestParam(required = false) Integer pageSize) {
        return ResponseEntity.ok(rankingService.getRanking(minScore, maxScore, page, pageSize));
    }

    @GetMapping("/trust/outliers")
    @Operation(summary = "List trust score outliers",
               description = "Users scoring strictly below `below` or strictly above `above`, lowest first")
    public ResponseEntity<List<TrustRankingEntry>> getOutliers(
            @RequestParam(required = false) Integer below,
            @RequestParam(required = false) Integer above) {
        return ResponseEntity.ok(rankingService.getOutliers(below, above));
    }
}
