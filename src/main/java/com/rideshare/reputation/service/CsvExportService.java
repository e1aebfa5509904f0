package com.rideshare.reputation.service;

import com.aerospike.client.AerospikeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.rideshare.reputation.config.ReputationConfig;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.model.AuditFilter;
import com.rideshare.reputation.model.AuditLogEntry;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.model.Rating;
import com.rideshare.reputation.repository.AuditLogRepository;
import com.rideshare.reputation.repository.RatingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full CSV dumps of the audit log and of all ratings, newest first.
 * Values are quoted only when they contain a separator, a quote or a line break.
 */
@Service
public class CsvExportService {

    private static final Logger log = LoggerFactory.getLogger(CsvExportService.class);

    static final CsvSchema AUDIT_SCHEMA = CsvSchema.builder()
            .addColumn("ID")
            .addColumn("Admin UID")
            .addColumn("Action")
            .addColumn("Entity Type")
            .addColumn("Entity ID")
            .addColumn("Before State")
            .addColumn("After State")
            .addColumn("Created At")
            .build()
            .withHeader();

    static final CsvSchema RATING_SCHEMA = CsvSchema.builder()
            .addColumn("ID")
            .addColumn("Ride ID")
            .addColumn("Rater UID")
            .addColumn("Rated UID")
            .addColumn("Rater Role")
            .addColumn("Rating")
            .addColumn("Review")
            .addColumn("Tags")
            .addColumn("Visible")
            .addColumn("Created At")
            .addColumn("Updated At")
            .build()
            .withHeader();

    private final AuditLogRepository auditLogRepo;
    private final RatingRepository ratingRepo;
    private final ReputationConfig reputationConfig;
    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    public CsvExportService(AuditLogRepository auditLogRepo,
                            RatingRepository ratingRepo,
                            ReputationConfig reputationConfig) {
        this.auditLogRepo = auditLogRepo;
        this.ratingRepo = ratingRepo;
        this.reputationConfig = reputationConfig;
        this.csvMapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public String exportAuditLog() {
        List<AuditLogEntry> entries = readWholeAuditLog();

        List<Map<String, Object>> rows = new ArrayList<>(entries.size());
        for (AuditLogEntry entry : entries) {
            AuditLogEntry.Diff diff = entry.getDiff();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("ID", entry.getId());
            row.put("Admin UID", entry.getAdminUid());
            row.put("Action", entry.getAction());
            row.put("Entity Type", entry.getEntityType());
            row.put("Entity ID", entry.getEntityId());
            row.put("Before State", diff != null ? toJson(diff.getBefore()) : null);
            row.put("After State", diff != null ? toJson(diff.getAfter()) : null);
            row.put("Created At", Instant.ofEpochMilli(entry.getCreatedAt()).toString());
            rows.add(row);
        }

        log.info("Exporting {} audit log entries as CSV", rows.size());
        return write(AUDIT_SCHEMA, rows);
    }

    public String exportRatings() {
        List<Rating> ratings;
        try {
            ratings = ratingRepo.findByFilters(null, null);
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read ratings for export", e);
        }

        List<Map<String, Object>> rows = new ArrayList<>(ratings.size());
        for (Rating rating : ratings) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("ID", rating.getRatingId());
            row.put("Ride ID", rating.getRideId());
            row.put("Rater UID", rating.getRaterUid());
            row.put("Rated UID", rating.getRatedUid());
            row.put("Rater Role", rating.getRaterRole() != null ? rating.getRaterRole().name() : null);
            row.put("Rating", rating.getScore());
            row.put("Review", rating.getReview());
            row.put("Tags", rating.getTags() != null ? String.join(",", rating.getTags()) : null);
            row.put("Visible", rating.isVisible());
            row.put("Created At", Instant.ofEpochMilli(rating.getCreatedAt()).toString());
            row.put("Updated At", Instant.ofEpochMilli(rating.getUpdatedAt()).toString());
            rows.add(row);
        }

        log.info("Exporting {} ratings as CSV", rows.size());
        return write(RATING_SCHEMA, rows);
    }

    private List<AuditLogEntry> readWholeAuditLog() {
        int pageSize = reputationConfig.getPaging().getMaxPageSize();
        List<AuditLogEntry> entries = new ArrayList<>();
        int page = 1;
        try {
            PagedResponse<AuditLogEntry> current;
            do {
                current = auditLogRepo.findByFilters(AuditFilter.none(), page, pageSize);
                entries.addAll(current.data());
                page++;
            } while (page <= current.totalPages());
        } catch (AerospikeException e) {
            throw new InternalException("Failed to read audit log for export", e);
        }
        return entries;
    }

    private String toJson(Map<String, Object> snapshot) {
        if (snapshot == null) return null;
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new InternalException("Failed to serialize audit snapshot", e);
        }
    }

    private String write(CsvSchema schema, List<Map<String, Object>> rows) {
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new InternalException("Failed to write CSV export", e);
        }
    }
}
