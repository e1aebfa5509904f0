package com.rideshare.reputation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.rideshare.reputation.config.AerospikeConfig;
import com.rideshare.reputation.model.UserProfile;
import com.rideshare.reputation.model.VerificationStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Identity store. Owned by the auth subsystem; this service only reads profiles
 * and writes the rider verification fields.
 */
@Repository
public class UserRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy updateOnlyPolicy;
    private final Policy readPolicy;

    public UserRepository(AerospikeClient client,
                          @Qualifier("aerospikeNamespace") String namespace,
                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.updateOnlyPolicy = new WritePolicy(writePolicy);
        this.updateOnlyPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        this.readPolicy = readPolicy;
    }

    public UserProfile findByUid(String uid) {
        Record record = client.get(readPolicy, key(uid));
        if (record == null) return null;
        return mapRecord(uid, record);
    }

    public boolean exists(String uid) {
        return client.exists(readPolicy, key(uid));
    }

    public void save(UserProfile user) {
        client.put(writePolicy, key(user.getUid()),
                new Bin("uid", user.getUid()),
                new Bin("displayName", user.getDisplayName()),
                new Bin("email", user.getEmail()),
                new Bin("phoneNumber", user.getPhoneNumber()),
                new Bin("verifStatus", statusName(user.getRiderVerificationStatus())),
                new Bin("riderVerified", user.isRiderVerified()),
                new Bin("verifNote", user.getVerificationNote()),
                new Bin("createdAt", user.getCreatedAt()),
                new Bin("updatedAt", user.getUpdatedAt()));
    }

    /**
     * Writes only the verification bins; the rest of the profile is left untouched.
     * @return false if the user no longer exists
     */
    public boolean updateVerification(String uid, VerificationStatus status, boolean verified,
                                      String note, long updatedAt) {
        try {
            client.put(updateOnlyPolicy, key(uid),
                    new Bin("verifStatus", status.name()),
                    new Bin("riderVerified", verified),
                    new Bin("verifNote", note),
                    new Bin("updatedAt", updatedAt));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) return false;
            throw e;
        }
    }

    private Key key(String uid) {
        return new Key(namespace, AerospikeConfig.SET_USERS, uid);
    }

    private String statusName(VerificationStatus status) {
        return status != null ? status.name() : VerificationStatus.PENDING.name();
    }

    private UserProfile mapRecord(String uid, Record record) {
        String status = record.getString("verifStatus");
        return UserProfile.builder()
                .uid(uid)
                .displayName(record.getString("displayName"))
                .email(record.getString("email"))
                .phoneNumber(record.getString("phoneNumber"))
                .riderVerificationStatus(status != null ? VerificationStatus.valueOf(status) : VerificationStatus.PENDING)
                .riderVerified(record.getBoolean("riderVerified"))
                .verificationNote(record.getString("verifNote"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
