package com.screening.repository;

import com.screening.model.ScreeningAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Alert audit trail. Rows are only ever inserted.
 */
@Repository
public interface ScreeningAlertRepository extends JpaRepository<ScreeningAlert, String> {

    List<ScreeningAlert> findBySubjectIdOrderByRaisedAtAsc(String subjectId);

    long countBySubjectId(String subjectId);
}
