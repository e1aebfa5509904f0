package com.rideshare.reputation.controller;

import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.MutationResult;
import com.rideshare.reputation.model.UserProfile;
import com.rideshare.reputation.service.VerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/users")
@Tag(name = "Rider Verification", description = "Approve or reject rider verification requests")
public class VerificationController {

    private final VerificationService verificationService;

    public VerificationController(VerificationService verificationService) {
        this.verificationService = verificationService;
    }

    @PostMapping("/{uid}/verify-rider")
    @Operation(summary = "Decide a rider verification",
               description = "Body: {\"approved\": true|false, \"note\": \"optional, max 500 chars\"}. " +
                       "The user is notified when notifications are enabled.")
    public ResponseEntity<MutationResult<UserProfile>> verifyRider(@PathVariable String uid,
                                                                   @RequestHeader("X-Admin-Uid") String adminUid,
                                                                   @RequestBody Map<String, Object> body) {
        if (!(body.get("approved") instanceof Boolean approved)) {
            throw new ValidationException("approved is required",
                    Map.of("approved", "must be true or false"));
        }
        Object note = body.get("note");
        if (note != null && !(note instanceof String)) {
            throw new ValidationException("note must be a string", Map.of("note", "must be a string"));
        }
        return ResponseEntity.ok(verificationService.decideRiderVerification(uid, approved, (String) note, adminUid));
    }
}
