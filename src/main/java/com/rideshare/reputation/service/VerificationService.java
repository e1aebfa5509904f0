package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.rideshare.reputation.config.MetricsConfig;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.exception.NotFoundException;
import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.MutationResult;
import com.rideshare.reputation.model.SideEffectOutcome;
import com.rideshare.reputation.model.UserProfile;
import com.rideshare.reputation.model.VerificationStatus;
import com.rideshare.reputation.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class VerificationService {

    public static final int MAX_NOTE_LENGTH = 500;

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final UserRepository userRepo;
    private final AuditTrailService auditTrail;
    private final NotificationService notificationService;
    private final MetricsConfig metricsConfig;

    public VerificationService(UserRepository userRepo,
                               AuditTrailService auditTrail,
                               NotificationService notificationService,
                               MetricsConfig metricsConfig) {
        this.userRepo = userRepo;
        this.auditTrail = auditTrail;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Approves or rejects a user's rider verification, then audits and notifies.
     * Neither side effect can fail the decision once it is stored.
     */
    public MutationResult<UserProfile> decideRiderVerification(String uid, boolean approved,
                                                               String note, String adminUid) {
        ReputationService.requireAdmin(adminUid);
        if (note != null && note.length() > MAX_NOTE_LENGTH) {
            throw new ValidationException("Verification note is too long",
                    Map.of("note", "must be at most " + MAX_NOTE_LENGTH + " characters"));
        }

        UserProfile user;
        try {
            user = userRepo.findByUid(uid);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read user " + uid, e);
        }
        if (user == null) {
            throw NotFoundException.of("User", uid);
        }

        VerificationStatus status = approved ? VerificationStatus.APPROVED : VerificationStatus.REJECTED;
        long now = System.currentTimeMillis();
        boolean stored;
        try {
            stored = userRepo.updateVerification(uid, status, approved, note, now);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to store verification decision for " + uid, e);
        }
        if (!stored) {
            throw NotFoundException.of("User", uid);
        }

        UserProfile updated = user.toBuilder()
                .riderVerificationStatus(status)
                .riderVerified(approved)
                .verificationNote(note)
                .updatedAt(now)
                .build();
        metricsConfig.recordVerificationDecision(status.name());
        log.info("Rider verification {}: user={}, by={}", status, uid, adminUid);

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("riderVerificationStatus", nameOf(user.getRiderVerificationStatus()));
        before.put("isRiderVerified", user.isRiderVerified());
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("riderVerificationStatus", status.name());
        after.put("isRiderVerified", approved);
        if (note != null && !note.isBlank()) {
            after.put("note", note);
        }

        String action = approved ? "verify_rider_approved" : "verify_rider_rejected";
        SideEffectOutcome audit = auditTrail.recordBestEffort(adminUid, action,
                ReputationService.ENTITY_USER, uid, before, after);
        SideEffectOutcome notification = notificationService.notifyVerificationDecision(updated, approved, note);

        return MutationResult.of(updated, audit, notification);
    }

    private static String nameOf(VerificationStatus status) {
        return status != null ? status.name() : VerificationStatus.PENDING.name();
    }
}
