package com.rideshare.reputation.model;

/**
 * Exact-match filters plus an inclusive createdAt range. Null fields do not filter.
 */
public record AuditFilter(String adminUid, String entityType, String entityId, Long from, Long to) {

    public static AuditFilter none() {
        return new AuditFilter(null, null, null, null, null);
    }

    public boolean matches(AuditLogEntry entry) {
        if (adminUid != null && !adminUid.equals(entry.getAdminUid())) return false;
        if (entityType != null && !entityType.equals(entry.getEntityType())) return false;
        if (entityId != null && !entityId.equals(entry.getEntityId())) return false;
        if (from != null && entry.getCreatedAt() < from) return false;
        if (to != null && entry.getCreatedAt() > to) return false;
        return true;
    }
}
