package com.screening.service;

import com.screening.engine.IdentityRecord;
import com.screening.engine.RiskAssessment;
import com.screening.engine.ScreeningEngine;
import com.screening.engine.snapshot.SnapshotRegistry;
import com.screening.engine.snapshot.SnapshotSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ad-hoc screening of an identity against the active snapshot set.
 * Nothing is persisted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScreeningService {

    private final ScreeningEngine screeningEngine;
    private final SnapshotRegistry snapshotRegistry;

    public RiskAssessment screen(IdentityRecord identity) {
        return screen(identity, snapshotRegistry.current());
    }

    public RiskAssessment screen(IdentityRecord identity, SnapshotSet snapshots) {
        RiskAssessment assessment = screeningEngine.screen(identity, snapshots);
        log.info("Screened {} identity: score={}, tier={}, decision={}, degraded={}",
                identity.personType(), assessment.score(), assessment.tier(),
                assessment.decision(), assessment.isDegraded());
        return assessment;
    }
}
