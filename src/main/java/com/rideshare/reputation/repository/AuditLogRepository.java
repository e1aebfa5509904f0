package com.rideshare.reputation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rideshare.reputation.config.AerospikeConfig;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.model.AuditFilter;
import com.rideshare.reputation.model.AuditLogEntry;
import com.rideshare.reputation.model.PagedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only admin audit log. Entries are written with CREATE_ONLY and never updated or deleted.
 */
@Repository
public class AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditLogRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AuditLogRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void append(AuditLogEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, entry.getId());

        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("id", entry.getId()));
        bins.add(new Bin("adminUid", entry.getAdminUid()));
        bins.add(new Bin("action", entry.getAction()));
        bins.add(new Bin("entityType", entry.getEntityType()));
        if (entry.getEntityId() != null) {
            bins.add(new Bin("entityId", entry.getEntityId()));
        }
        if (entry.getDiff() != null) {
            bins.add(new Bin("diff", serializeDiff(entry)));
        }
        bins.add(new Bin("createdAt", entry.getCreatedAt()));

        client.put(createOnlyPolicy, key, bins.toArray(new Bin[0]));
    }

    public AuditLogEntry findById(String id) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Filtered, newest-first page of entries.
     */
    public PagedResponse<AuditLogEntry> findByFilters(AuditFilter filter, int page, int pageSize) {
        List<AuditLogEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    try {
                        AuditLogEntry entry = mapRecord(record);
                        if (filter.matches(entry)) {
                            synchronized (results) {
                                results.add(entry);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit log record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AuditLogEntry::getCreatedAt).reversed()
                .thenComparing(AuditLogEntry::getId));
        return PagedResponse.of(results, page, pageSize);
    }

    private String serializeDiff(AuditLogEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.getDiff());
        } catch (JsonProcessingException e) {
            throw new InternalException("Failed to serialize audit diff for " + entry.getAction(), e);
        }
    }

    private AuditLogEntry mapRecord(Record record) {
        String diffJson = record.getString("diff");
        AuditLogEntry.Diff diff = null;
        if (diffJson != null && !diffJson.isEmpty()) {
            try {
                diff = objectMapper.readValue(diffJson, AuditLogEntry.Diff.class);
            } catch (JsonProcessingException e) {
                throw new InternalException("Audit entry " + record.getString("id") + " has an unreadable diff", e);
            }
        }
        return AuditLogEntry.builder()
                .id(record.getString("id"))
                .adminUid(record.getString("adminUid"))
                .action(record.getString("action"))
                .entityType(record.getString("entityType"))
                .entityId(record.getString("entityId"))
                .diff(diff)
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
