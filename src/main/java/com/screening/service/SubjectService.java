package com.screening.service;

import com.screening.engine.IdentityRecord;
import com.screening.engine.RiskAssessment;
import com.screening.exception.PersistenceFailureException;
import com.screening.exception.SubjectNotFoundException;
import com.screening.model.Subject;
import com.screening.model.Subject.SubjectStatus;
import com.screening.repository.SubjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Lifecycle of screened subjects: onboarding, on-demand rescreen and soft delete.
 *
 * Onboarding stores the subject with a PENDING disposition first, then screens
 * it. If the disposition write fails the subject stays PENDING and the caller
 * gets the computed assessment back in a {@link PersistenceFailureException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubjectService {

    private final SubjectRepository subjectRepository;
    private final ScreeningService screeningService;
    private final DispositionTracker dispositionTracker;

    public SubjectScreening register(IdentityRecord identity) {
        String subjectId = UUID.randomUUID().toString();
        log.info("Registering {} subject: {}", identity.personType(), subjectId);

        Subject subject = new Subject();
        subject.setSubjectId(subjectId);
        subject.setPersonType(identity.personType());
        subject.setGivenName(identity.givenName());
        subject.setPaternalSurname(identity.paternalSurname());
        subject.setMaternalSurname(identity.maternalSurname());
        subject.setFullName(identity.fullName());
        subject.setTaxId(identity.taxId());
        subject.setStatus(SubjectStatus.ACTIVE);
        subjectRepository.save(subject);
        dispositionTracker.initialize(subjectId);

        return screenAndPersist(subjectId, identity);
    }

    public SubjectScreening rescreen(String subjectId) {
        Subject subject = findActive(subjectId);
        log.info("Rescreening subject on demand: {}", subjectId);
        return screenAndPersist(subjectId, subject.toIdentityRecord());
    }

    /**
     * Store an already computed assessment, e.g. to retry after a {@link PersistenceFailureException}.
     */
    public DispositionOutcome persist(String subjectId, RiskAssessment assessment) {
        try {
            return dispositionTracker.apply(subjectId, assessment);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to store disposition for subject {}", subjectId, e);
            throw new PersistenceFailureException(subjectId, assessment, e);
        }
    }

    @Transactional
    public void delete(String subjectId) {
        Subject subject = findActive(subjectId);
        subject.setStatus(SubjectStatus.DELETED);
        subjectRepository.save(subject);
        log.info("Subject {} deleted, excluded from further rescreening", subjectId);
    }

    public Subject findActive(String subjectId) {
        return subjectRepository.findBySubjectIdAndStatus(subjectId, SubjectStatus.ACTIVE)
                .orElseThrow(() -> new SubjectNotFoundException(subjectId));
    }

    private SubjectScreening screenAndPersist(String subjectId, IdentityRecord identity) {
        RiskAssessment assessment = screeningService.screen(identity);
        DispositionOutcome outcome = persist(subjectId, assessment);
        return new SubjectScreening(subjectId, assessment, outcome);
    }
}
