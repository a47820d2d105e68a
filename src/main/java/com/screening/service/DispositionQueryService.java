package com.screening.service;

import com.screening.config.RedisConfig;
import com.screening.exception.SubjectNotFoundException;
import com.screening.model.Disposition;
import com.screening.model.ScreeningAlert;
import com.screening.repository.DispositionRepository;
import com.screening.repository.ScreeningAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of dispositions.
 *
 * CACHING STRATEGY:
 * =================
 * - Region: dispositions (TTL 30 minutes, configured in RedisConfig)
 * - Cache key: subjectId
 * - Evicted by DispositionTracker after every disposition write
 *
 * Alert history is append-only and read straight from the database, as is
 * the list of dispositions with an open alert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispositionQueryService {

    private final DispositionRepository dispositionRepository;
    private final ScreeningAlertRepository alertRepository;

    @Cacheable(value = RedisConfig.DISPOSITIONS_CACHE, key = "#subjectId")
    public Disposition getDisposition(String subjectId) {
        log.debug("Cache miss - fetching disposition from database: {}", subjectId);
        return dispositionRepository.findById(subjectId)
                .orElseThrow(() -> new SubjectNotFoundException(subjectId));
    }

    public List<ScreeningAlert> getAlerts(String subjectId) {
        return alertRepository.findBySubjectIdOrderByRaisedAtAsc(subjectId);
    }

    public List<Disposition> getActiveAlerts() {
        return dispositionRepository.findByAlertActiveTrue();
    }
}
