package com.screening.controller;

import com.screening.service.RescreenBatchResult;
import com.screening.service.RescreenScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Batch rescreen trigger for trusted internal callers (cron jobs, operators).
 *
 * POST /internal/rescreen with {@code Authorization: Bearer <shared secret>}.
 * Runs synchronously and returns the batch summary; 409 if a batch is running.
 */
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
@Slf4j
public class InternalRescreenController {

    private final SharedSecretVerifier sharedSecretVerifier;
    private final RescreenScheduler rescreenScheduler;

    @PostMapping("/rescreen")
    public ResponseEntity<RescreenBatchResult> rescreen(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        sharedSecretVerifier.verify(authorization);

        log.info("Internal rescreen triggered");
        return ResponseEntity.ok(rescreenScheduler.runBatch("internal"));
    }
}
