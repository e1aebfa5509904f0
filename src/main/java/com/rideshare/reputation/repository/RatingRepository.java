package com.rideshare.reputation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rideshare.reputation.config.AerospikeConfig;
import com.rideshare.reputation.model.ParticipantRole;
import com.rideshare.reputation.model.Rating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ratings keyed by {@code rideId:raterUid}. A key is written once and never reused after delete.
 */
@Repository
public class RatingRepository {

    private static final Logger log = LoggerFactory.getLogger(RatingRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy updateOnlyPolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public RatingRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.updateOnlyPolicy = new WritePolicy(writePolicy);
        this.updateOnlyPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Rating rating) {
        Key key = key(rating.getRideId(), rating.getRaterUid());

        client.put(writePolicy, key,
                new Bin("rideId", rating.getRideId()),
                new Bin("raterUid", rating.getRaterUid()),
                new Bin("ratedUid", rating.getRatedUid()),
                new Bin("raterRole", rating.getRaterRole().name()),
                new Bin("score", rating.getScore()),
                new Bin("review", rating.getReview()),
                new Bin("tags", serializeList(rating.getTags())),
                new Bin("isVisible", rating.isVisible()),
                new Bin("createdAt", rating.getCreatedAt()),
                new Bin("updatedAt", rating.getUpdatedAt()));
    }

    public Rating findByKey(String rideId, String raterUid) {
        Record record = client.get(readPolicy, key(rideId, raterUid));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Ratings received by a user, hidden ones included.
     */
    public List<Rating> findByRatedUid(String ratedUid) {
        return scan(rating -> ratedUid.equals(rating.getRatedUid()));
    }

    /**
     * Population for pattern analysis. Null filters are ignored; both present are AND-ed.
     */
    public List<Rating> findPopulation(String ratedUid, String rideId) {
        return scan(rating -> (ratedUid == null || ratedUid.equals(rating.getRatedUid()))
                && (rideId == null || rideId.equals(rating.getRideId())));
    }

    /**
     * Listing filter: {@code userUid} matches either side of the rating. Newest first.
     */
    public List<Rating> findByFilters(String rideId, String userUid) {
        List<Rating> results = scan(rating -> (rideId == null || rideId.equals(rating.getRideId()))
                && (userUid == null
                    || userUid.equals(rating.getRatedUid())
                    || userUid.equals(rating.getRaterUid())));
        results.sort(Comparator.comparingLong(Rating::getCreatedAt).reversed());
        return results;
    }

    /**
     * Marks the rating hidden. Never creates the record, so a deleted key stays deleted.
     * @return false if the rating does not exist
     */
    public boolean hide(String rideId, String raterUid, long updatedAt) {
        try {
            client.put(updateOnlyPolicy, key(rideId, raterUid),
                    new Bin("isVisible", false),
                    new Bin("updatedAt", updatedAt));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) return false;
            throw e;
        }
    }

    public boolean delete(String rideId, String raterUid) {
        return client.delete(writePolicy, key(rideId, raterUid));
    }

    private List<Rating> scan(Predicate<Rating> filter) {
        List<Rating> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RATINGS,
                (key, record) -> {
                    try {
                        Rating rating = mapRecord(record);
                        if (filter.test(rating)) {
                            synchronized (results) {
                                results.add(rating);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read rating record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key key(String rideId, String raterUid) {
        return new Key(namespace, AerospikeConfig.SET_RATINGS, Rating.ratingId(rideId, raterUid));
    }

    private Rating mapRecord(Record record) {
        return Rating.builder()
                .rideId(record.getString("rideId"))
                .raterUid(record.getString("raterUid"))
                .ratedUid(record.getString("ratedUid"))
                .raterRole(ParticipantRole.valueOf(record.getString("raterRole")))
                .score(record.getInt("score"))
                .review(record.getString("review"))
                .tags(deserializeList(record.getString("tags")))
                .visible(record.getBoolean("isVisible"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }

    private String serializeList(List<String> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize tags", e);
            return "[]";
        }
    }

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize tags", e);
            return Collections.emptyList();
        }
    }
}
