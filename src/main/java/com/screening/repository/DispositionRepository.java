package com.screening.repository;

import com.screening.model.Disposition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DispositionRepository extends JpaRepository<Disposition, String> {

    List<Disposition> findByAlertActiveTrue();
}
