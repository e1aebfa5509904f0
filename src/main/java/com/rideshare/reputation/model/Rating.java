package com.rideshare.reputation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A rating one ride participant gave another. Identified by (rideId, raterUid).")
public class Rating {

    @Schema(description = "Ride ID", example = "RIDE-000123")
    private String rideId;

    @Schema(description = "UID of the user who wrote the rating", example = "user-pass-07")
    private String raterUid;

    @Schema(description = "UID of the user being rated", example = "user-rider-01")
    private String ratedUid;

    @Schema(description = "Role the rater had on the ride")
    private ParticipantRole raterRole;

    @Schema(description = "Star score, 1 to 5 inclusive", example = "4")
    private int score;

    private String review;

    private List<String> tags;

    @JsonProperty("isVisible")
    @Schema(description = "False once hidden by a moderator")
    private boolean visible;

    @Schema(description = "Creation time, epoch milliseconds")
    private long createdAt;

    @Schema(description = "Last update time, epoch milliseconds")
    private long updatedAt;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public String getRatingId() {
        return ratingId(rideId, raterUid);
    }

    public static String ratingId(String rideId, String raterUid) {
        return rideId + ":" + raterUid;
    }
}
