package com.rideshare.reputation.model;

public enum VerificationStatus {
    PENDING,
    APPROVED,
    REJECTED
}
