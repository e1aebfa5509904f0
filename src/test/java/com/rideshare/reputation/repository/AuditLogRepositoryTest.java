package com.rideshare.reputation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.rideshare.reputation.model.AuditFilter;
import com.rideshare.reputation.model.AuditLogEntry;
import com.rideshare.reputation.model.PagedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditLogRepositoryTest {

    private static final String NS = "rideshare_test";

    @Mock private AerospikeClient client;

    private AuditLogRepository repository;
    private final List<Record> stored = new ArrayList<>();

    @BeforeEach
    void setUp() {
        repository = new AuditLogRepository(client, NS, new WritePolicy(), new Policy());
    }

    @Test
    void append_usesCreateOnlyAndSkipsAbsentOptionalBins() {
        AuditLogEntry entry = AuditLogEntry.builder()
                .id("A1").adminUid("ADMIN").action("export").entityType("audit_log").createdAt(10L)
                .build();

        repository.append(entry);

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Bin> bins = ArgumentCaptor.forClass(Bin.class);
        verify(client).put(policy.capture(), any(Key.class), bins.capture());
        assertThat(policy.getValue().recordExistsAction).isEqualTo(RecordExistsAction.CREATE_ONLY);
        assertThat(bins.getAllValues()).extracting(bin -> bin.name)
                .containsExactly("id", "adminUid", "action", "entityType", "createdAt");
    }

    @Test
    void findByFilters_matchesNewestFirstWithPageCount() {
        stubScan(
                record("A1", "ADMIN-1", "rating", "R1:P1", 1_000L),
                record("A2", "ADMIN-1", "rating", "R2:P1", 3_000L),
                record("A3", "ADMIN-2", "rating", "R1:P1", 2_000L),
                record("A4", "ADMIN-1", "user", "U1", 4_000L),
                record("A5", "ADMIN-1", "rating", "R3:P2", 5_000L));

        PagedResponse<AuditLogEntry> page = repository.findByFilters(
                new AuditFilter("ADMIN-1", "rating", null, 1_000L, 5_000L), 1, 2);

        assertThat(page.data()).extracting(AuditLogEntry::getId).containsExactly("A5", "A2");
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.totalPages()).isEqualTo(2);
    }

    @Test
    void findByFilters_entityIdExact() {
        stubScan(
                record("A1", "ADMIN-1", "rating", "R1:P1", 1_000L),
                record("A2", "ADMIN-2", "rating", "R1:P10", 2_000L));

        PagedResponse<AuditLogEntry> page = repository.findByFilters(
                new AuditFilter(null, null, "R1:P1", null, null), 1, 50);

        assertThat(page.data()).extracting(AuditLogEntry::getId).containsExactly("A1");
    }

    @Test
    void findByFilters_readsDiffBackInOrder() {
        stubScan(recordWithDiff("A1", "{\"before\":{\"total\":40,\"category\":\"Fair\"},\"after\":{\"total\":62,\"category\":\"Good\"}}"));

        AuditLogEntry entry = repository.findByFilters(AuditFilter.none(), 1, 50).data().get(0);

        assertThat(entry.getDiff().getBefore()).containsExactly(
                Map.entry("total", 40), Map.entry("category", "Fair"));
        assertThat(entry.getDiff().getAfter()).containsEntry("total", 62);
    }

    @Test
    void findById_missing_returnsNull() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.findById("nope")).isNull();
    }

    private void stubScan(Record... records) {
        stored.addAll(List.of(records));
        doAnswer(inv -> {
            ScanCallback callback = inv.getArgument(3);
            for (Record record : stored) {
                callback.scanCallback(new Key(NS, "admin_audit_log", record.getString("id")), record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq(NS), eq("admin_audit_log"), any(ScanCallback.class));
    }

    private static Record record(String id, String adminUid, String entityType, String entityId, long createdAt) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("id", id);
        bins.put("adminUid", adminUid);
        bins.put("action", "hide_rating");
        bins.put("entityType", entityType);
        bins.put("entityId", entityId);
        bins.put("createdAt", createdAt);
        return new Record(bins, 1, 0);
    }

    private static Record recordWithDiff(String id, String diffJson) {
        Map<String, Object> bins = new LinkedHashMap<>();
        bins.put("id", id);
        bins.put("adminUid", "ADMIN");
        bins.put("action", "recalculate_trust_score");
        bins.put("entityType", "user");
        bins.put("entityId", "U1");
        bins.put("diff", diffJson);
        bins.put("createdAt", 1L);
        return new Record(bins, 1, 0);
    }
}
