package com.screening.model;

import com.screening.engine.IdentityRecord;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An onboarded person or legal entity that is screened on registration and
 * rescreened periodically while active.
 *
 * Subjects are soft-deleted: a DELETED subject is skipped by rescreen batches
 * but its disposition and alert history stay in place.
 */
@Entity
@Table(name = "subjects",
       indexes = @Index(name = "idx_subject_status", columnList = "status"))
@Data
@NoArgsConstructor
public class Subject {

    @Id
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PersonType personType;

    private String givenName;

    private String paternalSurname;

    private String maternalSurname;

    /** Company name for legal entities, or the full name when parts are not split. */
    private String fullName;

    /** RFC, upper-cased. */
    @Column(length = 13)
    private String taxId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubjectStatus status = SubjectStatus.ACTIVE;

    @Column(nullable = false)
    private Instant registeredAt;

    private Instant lastUpdated;

    public enum SubjectStatus {
        ACTIVE,     // Included in rescreen batches
        DELETED     // Soft-deleted, never rescreened
    }

    /**
     * Identity as screened. Throws InvalidIdentityException when the stored
     * record has neither a usable name nor a tax id.
     */
    public IdentityRecord toIdentityRecord() {
        return new IdentityRecord(personType, givenName, paternalSurname, maternalSurname, fullName, taxId);
    }

    @PrePersist
    @PreUpdate
    protected void onUpdate() {
        if (registeredAt == null) {
            registeredAt = Instant.now();
        }
        lastUpdated = Instant.now();
    }
}
