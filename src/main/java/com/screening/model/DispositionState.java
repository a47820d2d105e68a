package com.screening.model;

/**
 * Persisted decision state of a subject.
 *
 * PENDING only exists between registration and the first screening.
 * After that a subject moves freely among the three decision states;
 * none of them is terminal, a fresh screening can always correct it.
 */
public enum DispositionState {
    PENDING,
    APPROVED,
    MANUAL_REVIEW,
    REJECTED;

    public static DispositionState from(DecisionStatus decision) {
        return switch (decision) {
            case APPROVED -> APPROVED;
            case MANUAL_REVIEW -> MANUAL_REVIEW;
            case REJECTED -> REJECTED;
        };
    }
}
