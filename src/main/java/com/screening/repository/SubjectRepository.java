package com.screening.repository;

import com.screening.model.Subject;
import com.screening.model.Subject.SubjectStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubjectRepository extends JpaRepository<Subject, String> {

    /**
     * Subjects in the given status, in a stable order so batch logs are comparable between runs.
     */
    List<Subject> findByStatusOrderBySubjectIdAsc(SubjectStatus status);

    Optional<Subject> findBySubjectIdAndStatus(String subjectId, SubjectStatus status);
}
