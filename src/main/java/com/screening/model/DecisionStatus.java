package com.screening.model;

/**
 * Automatic decision derived from a screening.
 */
public enum DecisionStatus {
    APPROVED,        // Onboarding may proceed
    REJECTED,        // Blocked
    MANUAL_REVIEW    // Needs human disposition
}
