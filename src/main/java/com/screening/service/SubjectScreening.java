package com.screening.service;

import com.screening.engine.RiskAssessment;

/**
 * A subject screened and its disposition updated.
 */
public record SubjectScreening(String subjectId, RiskAssessment assessment, DispositionOutcome outcome) {
}
