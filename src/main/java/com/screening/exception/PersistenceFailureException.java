package com.screening.exception;

import com.screening.engine.RiskAssessment;

/**
 * The disposition update for a screened subject could not be stored.
 *
 * Carries the computed assessment so the caller can retry the write
 * without screening again. The previous disposition is left untouched.
 */
public class PersistenceFailureException extends RuntimeException {

    private final String subjectId;
    private final transient RiskAssessment assessment;

    public PersistenceFailureException(String subjectId, RiskAssessment assessment, Throwable cause) {
        super("Failed to store disposition for subject " + subjectId + ": " + cause.getMessage(), cause);
        this.subjectId = subjectId;
        this.assessment = assessment;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public RiskAssessment getAssessment() {
        return assessment;
    }
}
