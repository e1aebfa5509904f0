package com.rideshare.reputation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One immutable record of an administrative action. Never updated once written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Admin audit log entry")
public class AuditLogEntry {

    @Schema(description = "Entry ID (UUID)")
    private String id;

    @Schema(description = "UID of the administrator who acted", example = "admin-01")
    private String adminUid;

    @Schema(description = "Action name", example = "hide_rating")
    private String action;

    @Schema(description = "Kind of entity acted upon", example = "rating")
    private String entityType;

    @Schema(description = "Entity identifier, when the action targets one", example = "RIDE-000123:user-pass-07", nullable = true)
    private String entityId;

    @Schema(nullable = true)
    private Diff diff;

    @Schema(description = "Epoch milliseconds")
    private long createdAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Diff {
        private Map<String, Object> before;
        private Map<String, Object> after;
    }
}
