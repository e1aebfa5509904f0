package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.rideshare.reputation.config.MetricsConfig;
import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.exception.NotFoundException;
import com.rideshare.reputation.exception.ValidationException;
import com.rideshare.reputation.model.AuditFilter;
import com.rideshare.reputation.model.AuditLogEntry;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.SideEffectOutcome;
import com.rideshare.reputation.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of administrative actions.
 *
 * <p>{@link #append} is the primary operation and reports failures to its caller.
 * Mutating services use {@link #recordBestEffort} instead: the mutation has already
 * committed, so a lost audit entry is logged and metered but never surfaced as an error.
 */
@Service
public class AuditTrailService {

    public static final String SIDE_EFFECT_NAME = "audit";

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    private final AuditLogRepository auditLogRepo;
    private final ReputationConfig reputationConfig;
    private final MetricsConfig metricsConfig;

    public AuditTrailService(AuditLogRepository auditLogRepo,
                             ReputationConfig reputationConfig,
                             MetricsConfig metricsConfig) {
        this.auditLogRepo = auditLogRepo;
        this.reputationConfig = reputationConfig;
        this.metricsConfig = metricsConfig;
    }

    public AuditLogEntry append(String adminUid, String action, String entityType, String entityId,
                                Map<String, Object> before, Map<String, Object> after) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (isBlank(adminUid)) errors.put("adminUid", "is required");
        if (isBlank(action)) errors.put("action", "is required");
        if (isBlank(entityType)) errors.put("entityType", "is required");
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid audit entry", errors);
        }

        AuditLogEntry entry = AuditLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .adminUid(adminUid)
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .diff(before == null && after == null ? null : new AuditLogEntry.Diff(before, after))
                .createdAt(System.currentTimeMillis())
                .build();

        try {
            auditLogRepo.append(entry);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to append audit entry " + action, e);
        }
        log.debug("Audit entry appended: id={}, action={}, entity={}:{}",
                entry.getId(), action, entityType, entityId);
        return entry;
    }

    /**
     * Same as {@link #append} but never throws.
     */
    public SideEffectOutcome recordBestEffort(String adminUid, String action, String entityType, String entityId,
                                              Map<String, Object> before, Map<String, Object> after) {
        try {
            append(adminUid, action, entityType, entityId, before, after);
            metricsConfig.recordSideEffect(SIDE_EFFECT_NAME, "succeeded");
            return SideEffectOutcome.succeeded(SIDE_EFFECT_NAME);
        } catch (RuntimeException e) {
            metricsConfig.recordSideEffect(SIDE_EFFECT_NAME, "failed");
            log.error("Audit append failed after committed mutation: action={}, entity={}:{}, admin={}",
                    action, entityType, entityId, adminUid, e);
            return SideEffectOutcome.failed(SIDE_EFFECT_NAME, e.getMessage());
        }
    }

    public SideEffectOutcome skipped(String reason) {
        metricsConfig.recordSideEffect(SIDE_EFFECT_NAME, "skipped");
        return SideEffectOutcome.skipped(SIDE_EFFECT_NAME, reason);
    }

    public PagedResponse<AuditLogEntry> list(String adminUid, String entityType, String entityId,
                                             String startDate, String endDate,
                                             Integer page, Integer pageSize) {
        Map<String, String> errors = new LinkedHashMap<>();
        PageRequest pageRequest = PageRequest.resolve(page, pageSize, reputationConfig.getPaging(), errors);
        Long from = parseInstant("startDate", startDate, errors);
        Long to = parseInstant("endDate", endDate, errors);
        if (from != null && to != null && from > to) {
            errors.put("endDate", "must not be before startDate");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid audit log query", errors);
        }

        AuditFilter filter = new AuditFilter(emptyToNull(adminUid), emptyToNull(entityType),
                emptyToNull(entityId), from, to);
        try {
            return auditLogRepo.findByFilters(filter, pageRequest.page(), pageRequest.pageSize());
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read audit log", e);
        }
    }

    public AuditLogEntry getEntry(String id) {
        AuditLogEntry entry;
        try {
            entry = auditLogRepo.findById(id);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read audit log entry " + id, e);
        }
        if (entry == null) {
            throw NotFoundException.of("Audit log entry", id);
        }
        return entry;
    }

    private Long parseInstant(String field, String value, Map<String, String> errors) {
        if (isBlank(value)) return null;
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException e) {
            errors.put(field, "must be an ISO-8601 instant, e.g. 2024-01-31T00:00:00Z");
            return null;
        }
    }

    private static String emptyToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
