package com.rideshare.reputation.controller;

import com.rideshare.reputation.config.AerospikeConfig;
import com.rideshare.reputation.config.ReputationConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "Read-only view of the scoring and rating configuration")
public class ConfigController {

    private final ReputationConfig reputationConfig;
    private final AerospikeConfig aerospikeConfig;

    public ConfigController(ReputationConfig reputationConfig, AerospikeConfig aerospikeConfig) {
        this.reputationConfig = reputationConfig;
        this.aerospikeConfig = aerospikeConfig;
    }

    @Operation(summary = "Get trust scoring penalties and the late cancellation window")
    @GetMapping("/scoring")
    public ResponseEntity<Map<String, Object>> getScoring() {
        ReputationConfig.Scoring scoring = reputationConfig.getScoring();
        return ResponseEntity.ok(Map.of(
                "cancellationPenalty", scoring.getCancellationPenalty(),
                "lateCancellationPenalty", scoring.getLateCancellationPenalty(),
                "noShowPenalty", scoring.getNoShowPenalty(),
                "lateCancellationWindowHours", scoring.getLateCancellationWindowHours()
        ));
    }

    @Operation(summary = "Get rating policy and pattern thresholds")
    @GetMapping("/ratings")
    public ResponseEntity<Map<String, Object>> getRatings() {
        ReputationConfig.Ratings ratings = reputationConfig.getRatings();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("hiddenCountsTowardAverage", ratings.isHiddenCountsTowardAverage());
        result.put("hiddenRateThreshold", ratings.getHiddenRateThreshold());
        result.put("recentWindowDays", ratings.getRecentWindowDays());
        result.put("lowRatingThreshold", ratings.getLowRatingThreshold());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get Aerospike connection settings")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospike() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }
}
