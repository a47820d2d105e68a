package com.screening.service;

import com.screening.concurrent.MdcContext;
import com.screening.config.ScreeningProperties;
import com.screening.engine.RiskAssessment;
import com.screening.engine.ScreeningEngine;
import com.screening.engine.snapshot.SnapshotRegistry;
import com.screening.engine.snapshot.SnapshotSet;
import com.screening.exception.BatchAlreadyRunningException;
import com.screening.model.Subject;
import com.screening.model.Subject.SubjectStatus;
import com.screening.repository.SubjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic rescreening of every active subject.
 *
 * TRIGGERS:
 * =========
 * - Cron: screening.rescreen.cron (default 02:00 daily), skipped when
 *   screening.rescreen.enabled is false
 * - POST /internal/rescreen (shared secret, see InternalRescreenController)
 *
 * HOW A BATCH RUNS:
 * -----------------
 * 1. Capture the current SnapshotSet once
 * 2. Load every ACTIVE subject, ordered by id
 * 3. Screen subjects on a fixed pool (screening.rescreen.parallelism threads)
 * 4. Apply each assessment through DispositionTracker in its own transaction
 * 5. Wait until screening.rescreen.deadline; subjects still queued are cancelled
 *
 * CONSISTENCY:
 * ------------
 * Every subject in a batch is screened against the same snapshot set, even if
 * a refresh lands meanwhile. The refreshed lists apply from the next batch.
 *
 * FAILURES:
 * ---------
 * - A subject that throws is logged with its id and counted in failed_count
 * - Cancelled subjects count as failed
 * - The batch itself always completes and returns a RescreenBatchResult
 *
 * Only one batch runs at a time per instance; a second trigger gets
 * {@link BatchAlreadyRunningException} (HTTP 409).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RescreenScheduler {

    private final SubjectRepository subjectRepository;
    private final SnapshotRegistry snapshotRegistry;
    private final ScreeningEngine screeningEngine;
    private final DispositionTracker dispositionTracker;
    private final ScreeningProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${screening.rescreen.cron:0 0 2 * * *}")
    public void scheduledRun() {
        if (!properties.getRescreen().isEnabled()) {
            log.debug("Scheduled rescreen disabled, skipping");
            return;
        }
        try {
            runBatch("scheduled");
        } catch (BatchAlreadyRunningException e) {
            log.warn("Scheduled rescreen skipped: {}", e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Rescreen all active subjects and wait for the batch to finish.
     *
     * @param trigger free-form label for logs ("scheduled", "internal", ...)
     * @throws BatchAlreadyRunningException if a batch is in progress
     */
    public RescreenBatchResult runBatch(String trigger) {
        if (!running.compareAndSet(false, true)) {
            throw new BatchAlreadyRunningException();
        }
        String batchId = UUID.randomUUID().toString();
        MDC.put("batchId", batchId);
        try {
            return execute(batchId, trigger);
        } finally {
            MDC.remove("batchId");
            running.set(false);
        }
    }

    private RescreenBatchResult execute(String batchId, String trigger) {
        Instant startedAt = clock.instant();
        SnapshotSet snapshots = snapshotRegistry.current();
        List<Subject> subjects = subjectRepository.findByStatusOrderBySubjectIdAsc(SubjectStatus.ACTIVE);

        log.info("========== RESCREEN BATCH {} STARTED ({}) ==========", batchId, trigger);
        log.info("Subjects: {}, snapshot version: {}", subjects.size(), snapshots.version());

        List<Callable<DispositionOutcome>> tasks = new ArrayList<>(subjects.size());
        for (Subject subject : subjects) {
            tasks.add(MdcContext.wrap(() -> rescreen(subject, snapshots)));
        }

        int processed = 0;
        int updated = 0;
        int alerts = 0;
        int failed = 0;

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.max(1, properties.getRescreen().getParallelism()),
                new CustomizableThreadFactory("rescreen-"));
        try {
            List<Future<DispositionOutcome>> futures = executor.invokeAll(
                    tasks, properties.getRescreen().getDeadline().toMillis(), TimeUnit.MILLISECONDS);

            for (int i = 0; i < futures.size(); i++) {
                String subjectId = subjects.get(i).getSubjectId();
                try {
                    DispositionOutcome outcome = futures.get(i).get();
                    processed++;
                    if (outcome.updated()) {
                        updated++;
                    }
                    if (outcome.alertRaised()) {
                        alerts++;
                    }
                } catch (CancellationException e) {
                    failed++;
                    log.error("Subject {} not rescreened before the batch deadline", subjectId);
                } catch (ExecutionException e) {
                    failed++;
                    log.error("Rescreen failed for subject {}", subjectId, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Rescreen batch " + batchId + " interrupted", e);
        } finally {
            executor.shutdownNow();
        }

        Instant finishedAt = clock.instant();
        log.info("========== RESCREEN BATCH {} FINISHED ==========", batchId);
        log.info("Processed: {}, updated: {}, alerts: {}, failed: {}", processed, updated, alerts, failed);

        return new RescreenBatchResult(batchId, trigger, subjects.size(), processed, updated, alerts, failed,
                snapshots.version(), startedAt, finishedAt);
    }

    private DispositionOutcome rescreen(Subject subject, SnapshotSet snapshots) {
        MDC.put("subjectId", subject.getSubjectId());
        try {
            RiskAssessment assessment = screeningEngine.screen(subject.toIdentityRecord(), snapshots);
            return dispositionTracker.apply(subject.getSubjectId(), assessment);
        } finally {
            MDC.remove("subjectId");
        }
    }
}
