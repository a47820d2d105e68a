package com.screening.controller;

import com.screening.engine.RiskAssessment;
import com.screening.model.Disposition;
import com.screening.model.ScreeningAlert;
import com.screening.service.DispositionQueryService;
import com.screening.service.SubjectScreening;
import com.screening.service.SubjectService;
import jakarta.validation.Valid;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Onboarded subjects and their dispositions.
 */
@RestController
@RequestMapping("/api/subjects")
@RequiredArgsConstructor
@Slf4j
public class SubjectController {

    private final SubjectService subjectService;
    private final DispositionQueryService dispositionQueryService;

    /**
     * Register a subject, screen it and store its disposition.
     *
     * POST /api/subjects
     */
    @PostMapping
    public ResponseEntity<SubjectScreeningResponse> register(@Valid @RequestBody IdentityRequest request) {
        log.info("Received subject registration for {} identity", request.getPersonType());
        SubjectScreening screening = subjectService.register(request.toIdentityRecord());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubjectScreeningResponse.from(screening));
    }

    /**
     * GET /api/subjects/{subjectId}/disposition
     */
    @GetMapping("/{subjectId}/disposition")
    public ResponseEntity<Disposition> getDisposition(@PathVariable String subjectId) {
        return ResponseEntity.ok(dispositionQueryService.getDisposition(subjectId));
    }

    /**
     * GET /api/subjects/{subjectId}/alerts
     */
    @GetMapping("/{subjectId}/alerts")
    public ResponseEntity<List<ScreeningAlert>> getAlerts(@PathVariable String subjectId) {
        return ResponseEntity.ok(dispositionQueryService.getAlerts(subjectId));
    }

    /**
     * Dispositions whose alert is still open, for the compliance dashboard.
     *
     * GET /api/subjects/alerts/active
     */
    @GetMapping("/alerts/active")
    public ResponseEntity<List<Disposition>> getActiveAlerts() {
        return ResponseEntity.ok(dispositionQueryService.getActiveAlerts());
    }

    /**
     * Screen one subject again against the active snapshot set.
     *
     * POST /api/subjects/{subjectId}/rescreen
     */
    @PostMapping("/{subjectId}/rescreen")
    public ResponseEntity<SubjectScreeningResponse> rescreen(@PathVariable String subjectId) {
        return ResponseEntity.ok(SubjectScreeningResponse.from(subjectService.rescreen(subjectId)));
    }

    /**
     * Soft delete; the subject is no longer rescreened.
     *
     * DELETE /api/subjects/{subjectId}
     */
    @DeleteMapping("/{subjectId}")
    public ResponseEntity<Void> delete(@PathVariable String subjectId) {
        subjectService.delete(subjectId);
        return ResponseEntity.noContent().build();
    }

    // ==================== DTOs ====================

    @Data
    public static class SubjectScreeningResponse {
        private String subjectId;
        private Disposition disposition;
        private boolean dispositionUpdated;
        private String alertId;
        private RiskAssessment assessment;

        static SubjectScreeningResponse from(SubjectScreening screening) {
            SubjectScreeningResponse response = new SubjectScreeningResponse();
            response.setSubjectId(screening.subjectId());
            response.setDisposition(screening.outcome().disposition());
            response.setDispositionUpdated(screening.outcome().updated());
            if (screening.outcome().alertRaised()) {
                response.setAlertId(screening.outcome().alert().getAlertId());
            }
            response.setAssessment(screening.assessment());
            return response;
        }
    }
}
