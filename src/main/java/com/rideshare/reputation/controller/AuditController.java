package com.rideshare.reputation.controller;

import com.rideshare.reputation.model.AuditLogEntry;
import com.rideshare.reputation.model.PagedResponse;
import com.rideshare.reputation.service.AuditTrailService;
import com.rideshare.reputation.service.CsvExportService;
import com.rideshare.reputation.service.ReputationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit Log", description = "Read-only view of the admin audit trail")
public class AuditController {

    private final ReputationService reputationService;
    private final AuditTrailService auditTrailService;
    private final CsvExportService csvExportService;

    public AuditController(ReputationService reputationService,
                           AuditTrailService auditTrailService,
                           CsvExportService csvExportService) {
        this.reputationService = reputationService;
        this.auditTrailService = auditTrailService;
        this.csvExportService = csvExportService;
    }

    @GetMapping
    @Operation(summary = "List audit log entries",
               description = "Newest first. Exact-match filters; the date range is inclusive.")
    public ResponseEntity<PagedResponse<AuditLogEntry>> listAuditLog(
            @RequestParam(required = false) String adminUid,
            @RequestParam(required = false) String entityType,
            @RequestParam(required = false) String entityId,
            @Parameter(description = "ISO-8601 instant, e.g. 2024-01-01T00:00:00Z")
            @RequestParam(required = false) String startDate,
            @Parameter(description = "ISO-8601 instant")
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        return ResponseEntity.ok(reputationService.listAuditLog(
                adminUid, entityType, entityId, startDate, endDate, page, pageSize));
    }

    @GetMapping("/export.csv")
    @Operation(summary = "Export the whole audit log as CSV",
               description = "Newest first. Before/after snapshots are JSON-encoded columns.")
    public ResponseEntity<String> exportCsv() {
        return CsvResponses.attachment("audit-log-export", csvExportService.exportAuditLog());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an audit log entry")
    public ResponseEntity<AuditLogEntry> getEntry(@PathVariable String id) {
        return ResponseEntity.ok(auditTrailService.getEntry(id));
    }
}
