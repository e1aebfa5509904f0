package com.rideshare.reputation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.rideshare.reputation.config.AerospikeConfig;
import com.rideshare.reputation.model.CancellationCategory;
import com.rideshare.reputation.model.RideRecord;
import com.rideshare.reputation.model.RideStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class RideRepository {

    private static final Logger log = LoggerFactory.getLogger(RideRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public RideRepository(AerospikeClient client,
                          @Qualifier("aerospikeNamespace") String namespace,
                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(RideRecord ride) {
        Key key = new Key(namespace, AerospikeConfig.SET_RIDES, ride.getRideId());

        Bin rideIdBin = new Bin("rideId", ride.getRideId());
        Bin riderBin = new Bin("riderUid", ride.getRiderUid());
        Bin passengerBin = new Bin("passengerUid", ride.getPassengerUid());
        Bin statusBin = new Bin("status", ride.getStatus().name());
        Bin departAtBin = new Bin("departAt", ride.getDepartAt());
        Bin cancelledByBin = new Bin("cancelledByUid", ride.getCancelledByUid());
        Bin cancelledAtBin = new Bin("cancelledAt", ride.getCancelledAt());
        Bin categoryBin = new Bin("cancelCategory",
                ride.getCancellationCategory() != null ? ride.getCancellationCategory().name() : null);

        client.put(writePolicy, key,
                rideIdBin, riderBin, passengerBin, statusBin, departAtBin,
                cancelledByBin, cancelledAtBin, categoryBin);
    }

    /**
     * All rides where the user is either the rider or the passenger, in any status.
     */
    public List<RideRecord> findByParticipant(String uid) {
        List<RideRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RIDES,
                (key, record) -> {
                    try {
                        if (uid.equals(record.getString("riderUid"))
                                || uid.equals(record.getString("passengerUid"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read ride record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private RideRecord mapRecord(Record record) {
        String category = record.getString("cancelCategory");
        return RideRecord.builder()
                .rideId(record.getString("rideId"))
                .riderUid(record.getString("riderUid"))
                .passengerUid(record.getString("passengerUid"))
                .status(RideStatus.valueOf(record.getString("status")))
                .departAt(record.getLong("departAt"))
                .cancelledByUid(record.getString("cancelledByUid"))
                .cancelledAt(record.getLong("cancelledAt"))
                .cancellationCategory(category != null ? CancellationCategory.valueOf(category) : null)
                .build();
    }
}
