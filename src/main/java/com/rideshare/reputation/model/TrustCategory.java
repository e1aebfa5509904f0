package com.rideshare.reputation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrustCategory {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor");

    private final String label;

    TrustCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static TrustCategory fromScore(int total) {
        if (total >= 80) return EXCELLENT;
        if (total >= 60) return GOOD;
        if (total >= 40) return FAIR;
        return POOR;
    }

    public static TrustCategory fromLabel(String label) {
        for (TrustCategory category : values()) {
            if (category.label.equalsIgnoreCase(label)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown trust category: " + label);
    }
}
