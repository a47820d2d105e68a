package com.screening.exception;

/**
 * No active subject exists with the given id.
 */
public class SubjectNotFoundException extends RuntimeException {

    private final String subjectId;

    public SubjectNotFoundException(String subjectId) {
        super("Subject not found: " + subjectId);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
