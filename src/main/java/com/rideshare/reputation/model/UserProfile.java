package com.rideshare.reputation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {
    private String uid;
    private String displayName;
    private String email;
    private String phoneNumber;
    private VerificationStatus riderVerificationStatus;
    @JsonProperty("isRiderVerified")
    private boolean riderVerified;
    private String verificationNote;
    private long createdAt;
    private long updatedAt;
}
