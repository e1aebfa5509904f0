package com.rideshare.reputation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rideshare.reputation.config.AerospikeConfig;
import com.rideshare.reputation.exception.InternalException;
import com.rideshare.reputation.model.TrustCategory;
import com.rideshare.reputation.model.TrustRankingEntry;
import com.rideshare.reputation.model.TrustScoreBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Latest trust score per user. The whole breakdown lives in one record, so a save
 * replaces it in a single put and readers see either the old or the new score.
 */
@Repository
public class TrustScoreRepository {

    private static final Logger log = LoggerFactory.getLogger(TrustScoreRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public TrustScoreRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(TrustScoreBreakdown breakdown, long calculatedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRUST_SCORES, breakdown.getUserUid());

        String json;
        try {
            json = objectMapper.writeValueAsString(breakdown);
        } catch (JsonProcessingException e) {
            throw new InternalException("Failed to serialize trust score for " + breakdown.getUserUid(), e);
        }

        client.put(writePolicy, key,
                new Bin("userUid", breakdown.getUserUid()),
                new Bin("total", breakdown.getTotal()),
                new Bin("category", breakdown.getCategory().getLabel()),
                new Bin("breakdown", json),
                new Bin("calculatedAt", calculatedAt));
    }

    /**
     * @return the stored breakdown, or null if no score was ever calculated for the user
     */
    public TrustScoreBreakdown findByUid(String uid) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRUST_SCORES, uid);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        try {
            return objectMapper.readValue(record.getString("breakdown"), TrustScoreBreakdown.class);
        } catch (JsonProcessingException e) {
            throw new InternalException("Stored trust score for " + uid + " is unreadable", e);
        }
    }

    public List<TrustRankingEntry> findAll() {
        List<TrustRankingEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRUST_SCORES,
                (key, record) -> {
                    try {
                        TrustRankingEntry entry = TrustRankingEntry.builder()
                                .userUid(record.getString("userUid"))
                                .total(record.getInt("total"))
                                .category(TrustCategory.fromLabel(record.getString("category")))
                                .calculatedAt(record.getLong("calculatedAt"))
                                .build();
                        synchronized (results) {
                            results.add(entry);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read trust score record: {}", e.getMessage());
                    }
                }, "userUid", "total", "category", "calculatedAt");
        return results;
    }
}
