package com.screening.controller;

import com.screening.engine.RiskAssessment;
import com.screening.service.ScreeningService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Stateless screening.
 *
 * POST /api/screenings
 *
 * Example request:
 * {
 *   "personType": "INDIVIDUAL",
 *   "givenName": "Juan",
 *   "paternalSurname": "Pérez",
 *   "maternalSurname": "López"
 * }
 *
 * Returns the full assessment (score, tier, decision, per-source results,
 * alerts). Nothing is stored.
 */
@RestController
@RequestMapping("/api/screenings")
@RequiredArgsConstructor
@Slf4j
public class ScreeningController {

    private final ScreeningService screeningService;

    @PostMapping
    public ResponseEntity<RiskAssessment> screen(@Valid @RequestBody IdentityRequest request) {
        log.info("Received screening request for {} identity", request.getPersonType());
        return ResponseEntity.ok(screeningService.screen(request.toIdentityRecord()));
    }
}
