package com.rideshare.reputation.controller;

import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.ModerationAction;
import com.rideshare.reputation.model.MutationResult;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.model.RatingPatterns;
import com.rideshare.reputation.service.CsvExportService;
import com.rideshare.reputation.service.RatingService;
import com.rideshare.reputation.service.ReputationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/ratings")
@Tag(name = "Ratings", description = "Rating listing, pattern analysis and moderation")
public class RatingController {

    private final RatingService ratingService;
    private final ReputationService reputationService;
    private final CsvExportService csvExportService;

    public RatingController(RatingService ratingService,
                            ReputationService reputationService,
                            CsvExportService csvExportService) {
        this.ratingService = ratingService;
        this.reputationService = reputationService;
        this.csvExportService = csvExportService;
    }

    @GetMapping
    @Operation(summary = "List ratings",
               description = "Newest first. `userUid` matches both the rater and the rated user.")
    public ResponseEntity<PagedResponse<Rating>> listRatings(
            @RequestParam(required = false) String rideId,
            @RequestParam(required = false) String userUid,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        return ResponseEntity.ok(ratingService.listRatings(rideId, userUid, page, pageSize));
    }

    @GetMapping("/export.csv")
    @Operation(summary = "Export all ratings as CSV", description = "Hidden ratings included, newest first")
    public ResponseEntity<String> exportCsv() {
        return CsvResponses.attachment("ratings-export", csvExportService.exportRatings());
    }

    @GetMapping("/patterns")
    @Operation(summary = "Analyze rating patterns",
               description = "Distribution, hidden count, recent low ratings and suspicious-pattern flags " +
                       "over the ratings a user received and/or the ratings of a ride")
    public ResponseEntity<RatingPatterns> getPatterns(
            @Parameter(description = "Rated user") @RequestParam(required = false) String userUid,
            @RequestParam(required = false) String rideId) {
        return ResponseEntity.ok(reputationService.getPatterns(userUid, rideId));
    }

    @PostMapping("/{ratingId}/hide")
    @Operation(summary = "Hide a rating", description = "ratingId is `rideId:raterUid`")
    public ResponseEntity<MutationResult<Rating>> hide(@PathVariable String ratingId,
                                                       @RequestHeader("X-Admin-Uid") String adminUid) {
        return moderate(ratingId, ModerationAction.HIDE, adminUid);
    }

    @DeleteMapping("/{ratingId}")
    @Operation(summary = "Delete a rating", description = "ratingId is `rideId:raterUid`. Deletion is permanent.")
    public ResponseEntity<MutationResult<Rating>> delete(@PathVariable String ratingId,
                                                         @RequestHeader("X-Admin-Uid") String adminUid) {
        return moderate(ratingId, ModerationAction.DELETE, adminUid);
    }

    @PostMapping("/{ratingId}/moderate")
    @Operation(summary = "Moderate a rating", description = "Body: {\"action\": \"hide\" | \"delete\"}")
    public ResponseEntity<MutationResult<Rating>> moderateRating(@PathVariable String ratingId,
                                                                 @RequestHeader("X-Admin-Uid") String adminUid,
                                                                 @RequestBody Map<String, String> body) {
        return moderate(ratingId, ModerationAction.fromString(body.get("action")), adminUid);
    }

    private ResponseEntity<MutationResult<Rating>> moderate(String ratingId, ModerationAction action,
                                                            String adminUid) {
        String[] parts = ratingId.split(":", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ValidationException("Invalid rating ID format",
                    Map.of("ratingId", "must be rideId:raterUid"));
        }
        return ResponseEntity.ok(reputationService.moderateRating(parts[0], parts[1], action, adminUid));
    }
}
