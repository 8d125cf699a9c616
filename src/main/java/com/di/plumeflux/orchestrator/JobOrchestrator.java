package com.di.plumeflux.orchestrator;

import com.di.plumeflux.aspect.ErrorCategory;
import com.di.plumeflux.calibration.CalibrationArtifact;
import com.di.plumeflux.calibration.CalibrationPipeline;
import com.di.plumeflux.calibration.CalibrationRegistry;
import com.di.plumeflux.emission.EmissionMeasurement;
import com.di.plumeflux.emission.EmissionRatePipeline;
import com.di.plumeflux.exception.OrphanDataException;
import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.grouping.UnitKey;
import com.di.plumeflux.grouping.UnitState;
import com.di.plumeflux.ledger.LedgerEntry;
import com.di.plumeflux.ledger.LedgerOutcome;
import com.di.plumeflux.ledger.UnitLedger;
import com.di.plumeflux.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Decides what runs, when, and records how it ended.
 * <p>
 * All public methods except {@link #stateOf(UnitKey)} and the counters must be called from the
 * coordinating loop thread. Pipelines run on {@code workers}; their results are queued back and
 * applied on the next {@link #tick()}, so the ledger has a single writer.
 * <ul>
 *   <li>Units whose latest ledger outcome is terminal are skipped unless forced.</li>
 *   <li>One instance per key: a key already queued, running, retrying or waiting is coalesced.</li>
 *   <li>Calibration units are dispatched before emission units.</li>
 *   <li>Emission units without a covering calibration wait, recorded {@code DEFERRED}, until one is
 *       published.</li>
 *   <li>Transient failures back off exponentially up to the attempt limit.</li>
 * </ul>
 */
@Slf4j
public class JobOrchestrator {

    private static final Duration IDLE_PAUSE = Duration.ofMillis(50);

    private final UnitLedger ledger;
    private final CalibrationPipeline calibrationPipeline;
    private final EmissionRatePipeline emissionPipeline;
    private final CalibrationRegistry calibrations;
    private final FileArchiver archiver;
    private final RetryPolicy retryPolicy;
    private final Executor workers;
    private final int maxInFlight;
    private final Clock clock;

    private final Deque<Job> calibrationQueue = new ArrayDeque<>();
    private final Deque<Job> emissionQueue = new ArrayDeque<>();
    private final PriorityQueue<Job> retryQueue = new PriorityQueue<>(Comparator.comparing((Job j) -> j.dueAt));
    private final CalibrationWaitSet<Job> waiting = new CalibrationWaitSet<Job>(j -> j.unit.getAcquiredAt());
    private final Map<UnitKey, Job> active = new HashMap<>();
    private final Map<UnitKey, UnitState> states = new ConcurrentHashMap<>();
    private final Queue<Completion> completions = new ConcurrentLinkedQueue<>();
    private final Map<LedgerOutcome, Integer> outcomeCounts = new EnumMap<>(LedgerOutcome.class);
    private volatile int inFlight;
    private volatile boolean accepting = true;

    public JobOrchestrator(UnitLedger ledger, CalibrationPipeline calibrationPipeline,
                           EmissionRatePipeline emissionPipeline, CalibrationRegistry calibrations,
                           FileArchiver archiver, RetryPolicy retryPolicy, Executor workers, int maxInFlight,
                           Clock clock) {
        this.ledger = ledger;
        this.calibrationPipeline = calibrationPipeline;
        this.emissionPipeline = emissionPipeline;
        this.calibrations = calibrations;
        this.archiver = archiver;
        this.retryPolicy = retryPolicy;
        this.workers = workers;
        this.maxInFlight = Math.max(1, maxInFlight);
        this.clock = clock;
    }

    public SubmitResult submit(ProcessingUnit unit) {
        return submit(unit, false);
    }

    public SubmitResult submit(ProcessingUnit unit, boolean forced) {
        UnitKey key = unit.getKey();
        if (!accepting) {
            log.debug("[ORCHESTRATOR] {} rejected, shutting down", key);
            return SubmitResult.REJECTED;
        }
        if (active.containsKey(key)) {
            log.debug("[ORCHESTRATOR] {} already active, coalesced", key);
            return SubmitResult.COALESCED;
        }
        Optional<LedgerEntry> latest = ledger.latest(key.toString());
        if (!forced && latest.isPresent() && latest.get().getOutcome().isTerminal()) {
            log.debug("[ORCHESTRATOR] {} already {}, skipped", key, latest.get().getOutcome());
            return SubmitResult.ALREADY_DONE;
        }
        int priorAttempts = latest.filter(e -> e.getOutcome() == LedgerOutcome.DEFERRED)
                .map(LedgerEntry::getAttempts).orElse(0);
        Job job = new Job(unit, forced, priorAttempts);
        active.put(key, job);
        enqueue(job);
        log.info("[ORCHESTRATOR] {} accepted{}{}", key, forced ? " (forced)" : "",
                priorAttempts > 0 ? ", resuming after " + priorAttempts + " attempts" : "");
        return SubmitResult.ACCEPTED;
    }

    /** Applies finished work, releases due retries and dispatches as many units as slots allow. */
    public void tick() {
        applyCompletions();
        releaseDueRetries(clock.instant());
        dispatch();
        applyCompletions();
    }

    /** A surplus image: recorded so it is never routed again, and archived. */
    public void recordOrphan(OrphanDataException orphan) {
        Path archived = archiver.archive(orphan.getPath(), "orphaned");
        String key = "orphan:" + orphan.getPath().getFileName();
        append(LedgerEntry.builder()
                .unitKey(key)
                .outcome(LedgerOutcome.ORPHANED)
                .recordedAt(clock.instant())
                .files(List.of(orphan.getPath().toAbsolutePath().toString()))
                .outputRef(archived.toString())
                .lastError(orphan.getMessage())
                .errorCategory(ErrorCategory.categorize(orphan).name())
                .build());
        log.warn("[ORCHESTRATOR] {}", orphan.getMessage());
    }

    /** A pair that never completed: recorded and archived, never dispatched. */
    public void recordIncomplete(ProcessingUnit unit) {
        unit.memberPaths().forEach(p -> archiver.archive(p, "incomplete"));
        states.put(unit.getKey(), UnitState.INCOMPLETE);
        append(LedgerEntry.builder()
                .unitKey(unit.getKey().toString())
                .outcome(LedgerOutcome.INCOMPLETE)
                .recordedAt(clock.instant())
                .files(paths(unit))
                .build());
        log.warn("[ORCHESTRATOR] {} archived as incomplete", unit.getKey());
    }

    /**
     * Batch driver: ticks until nothing is queued, running or due for retry. Units still waiting
     * for a calibration stay deferred.
     */
    public void runUntilIdle() {
        while (!Thread.currentThread().isInterrupted()) {
            tick();
            if (inFlight == 0 && calibrationQueue.isEmpty() && emissionQueue.isEmpty()) {
                if (retryQueue.isEmpty()) {
                    return;
                }
                Duration untilDue = Duration.between(clock.instant(), retryQueue.peek().dueAt);
                pause(untilDue.isNegative() ? Duration.ZERO : untilDue);
            } else {
                pause(IDLE_PAUSE);
            }
        }
    }

    /**
     * Stops accepting work, waits up to {@code drainTimeout} for running units, then records every
     * queued, retrying or waiting unit as {@code DEFERRED} so the next run resumes it.
     */
    public void shutdown(Duration drainTimeout) {
        accepting = false;
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (inFlight > 0 && System.nanoTime() < deadline) {
            applyCompletions();
            if (inFlight > 0) {
                pause(IDLE_PAUSE);
            }
        }
        applyCompletions();
        if (inFlight > 0) {
            log.warn("[ORCHESTRATOR] {} units still running after {}; they will be picked up on restart",
                    inFlight, drainTimeout);
        }

        List<Job> pending = new ArrayList<>(calibrationQueue);
        pending.addAll(emissionQueue);
        pending.addAll(retryQueue);
        pending.addAll(waiting.drain());
        calibrationQueue.clear();
        emissionQueue.clear();
        retryQueue.clear();
        for (Job job : pending) {
            recordDeferred(job);
            active.remove(job.unit.getKey());
        }
        log.info("[ORCHESTRATOR] shutdown: {} units persisted as deferred, outcomes this run {}",
                pending.size(), outcomeCounts);
    }

    public UnitState stateOf(UnitKey key) {
        return states.get(key);
    }

    /** True when the file is a member of a unit that is queued, running, retrying or deferred. */
    public boolean isActiveFile(Path file) {
        Path target = file.toAbsolutePath().normalize();
        return active.values().stream()
                .flatMap(job -> job.unit.memberPaths().stream())
                .anyMatch(p -> p.toAbsolutePath().normalize().equals(target));
    }

    public int waitingCount() {
        return waiting.size();
    }

    public int outcomeCount(LedgerOutcome outcome) {
        return outcomeCounts.getOrDefault(outcome, 0);
    }

    public Map<LedgerOutcome, Integer> outcomeCounts() {
        return new EnumMap<>(outcomeCounts);
    }

    private void enqueue(Job job) {
        states.put(job.unit.getKey(), UnitState.READY);
        if (job.unit.isCalibration()) {
            calibrationQueue.addLast(job);
        } else {
            emissionQueue.addLast(job);
        }
    }

    private void dispatch() {
        while (inFlight < maxInFlight && !calibrationQueue.isEmpty()) {
            start(calibrationQueue.pollFirst(), null);
        }
        while (inFlight < maxInFlight && !emissionQueue.isEmpty()) {
            Job job = emissionQueue.pollFirst();
            Optional<CalibrationArtifact> covering = calibrations.findCovering(job.unit.getAcquiredAt());
            if (covering.isEmpty()) {
                defer(job);
                continue;
            }
            start(job, covering.get());
        }
    }

    private void start(Job job, CalibrationArtifact calibration) {
        UnitKey key = job.unit.getKey();
        job.attempts++;
        inFlight++;
        states.put(key, UnitState.DISPATCHED);
        log.info("[ORCHESTRATOR] dispatching {} (attempt {}/{})", key, job.attempts, retryPolicy.getMaxAttempts());
        try {
            workers.execute(() -> MdcPropagation.runWithUnitKey(key.toString(), () -> completions.add(run(job, calibration))));
        } catch (RejectedExecutionException e) {
            inFlight--;
            job.attempts--;
            log.warn("[ORCHESTRATOR] worker pool refused {}; requeued", key);
            if (job.unit.isCalibration()) {
                calibrationQueue.addFirst(job);
            } else {
                emissionQueue.addFirst(job);
            }
            states.put(key, UnitState.READY);
        }
    }

    /** Runs on a worker thread. */
    private Completion run(Job job, CalibrationArtifact calibration) {
        try {
            if (job.unit.isCalibration()) {
                return Completion.calibrated(job, calibrationPipeline.calibrate(job.unit));
            }
            return Completion.measured(job, emissionPipeline.compute(job.unit, calibration));
        } catch (RuntimeException | Error e) {
            return Completion.failed(job, e);
        }
    }

    private void applyCompletions() {
        Completion c;
        while ((c = completions.poll()) != null) {
            inFlight--;
            if (c.error != null) {
                onFailure(c.job, c.error);
            } else if (c.artifact != null) {
                onCalibrated(c.job, c.artifact);
            } else {
                onMeasured(c.job, c.measurement);
            }
        }
    }

    private void onCalibrated(Job job, CalibrationArtifact artifact) {
        calibrations.publish(artifact);
        succeed(job, artifact.getPath());
        List<Job> released = waiting.release(artifact.getValidFrom(), artifact.getValidTo());
        if (!released.isEmpty()) {
            log.info("[ORCHESTRATOR] {} released {} deferred units", job.unit.getKey(), released.size());
            released.forEach(this::enqueue);
        }
    }

    private void onMeasured(Job job, EmissionMeasurement measurement) {
        succeed(job, measurement.getUnitKey());
    }

    private void succeed(Job job, String outputRef) {
        UnitKey key = job.unit.getKey();
        active.remove(key);
        states.put(key, UnitState.SUCCEEDED);
        append(entry(job, LedgerOutcome.SUCCESS).outputRef(outputRef).build());
        log.info("[ORCHESTRATOR] {} succeeded after {} attempt(s)", key, job.attempts);
    }

    private void onFailure(Job job, Throwable error) {
        UnitKey key = job.unit.getKey();
        ErrorCategory category = ErrorCategory.categorize(error);
        job.lastError = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        job.lastCategory = category;

        switch (category.getDisposition()) {
            case RETRY:
                if (retryPolicy.canRetry(job.attempts)) {
                    Duration delay = retryPolicy.backoff(job.attempts);
                    job.dueAt = clock.instant().plus(delay);
                    retryQueue.add(job);
                    states.put(key, UnitState.READY);
                    log.warn("[ORCHESTRATOR] {} attempt {} failed ({}); retrying in {}",
                            key, job.attempts, job.lastError, delay);
                    return;
                }
                fail(job, category, "retries exhausted");
                return;
            case DEFER:
                defer(job);
                return;
            default:
                fail(job, category, category.getName());
        }
    }

    private void fail(Job job, ErrorCategory category, String why) {
        UnitKey key = job.unit.getKey();
        active.remove(key);
        states.put(key, UnitState.FAILED);
        append(entry(job, LedgerOutcome.FAILED)
                .lastError(job.lastError)
                .errorCategory(category.name())
                .build());
        log.error("[ORCHESTRATOR] {} FAILED after {} attempt(s), {}: {}", key, job.attempts, why, job.lastError);
    }

    private void defer(Job job) {
        waiting.add(job);
        states.put(job.unit.getKey(), UnitState.DEFERRED);
        if (!job.deferredRecorded) {
            recordDeferred(job);
            log.info("[ORCHESTRATOR] {} deferred, no calibration covers {}", job.unit.getKey(),
                    job.unit.getAcquiredAt());
        }
    }

    private void recordDeferred(Job job) {
        job.deferredRecorded = true;
        states.put(job.unit.getKey(), UnitState.DEFERRED);
        append(entry(job, LedgerOutcome.DEFERRED)
                .lastError(job.lastError)
                .errorCategory(job.lastCategory != null ? job.lastCategory.name() : null)
                .build());
    }

    private void releaseDueRetries(Instant now) {
        while (!retryQueue.isEmpty() && !retryQueue.peek().dueAt.isAfter(now)) {
            enqueue(retryQueue.poll());
        }
    }

    private LedgerEntry.LedgerEntryBuilder entry(Job job, LedgerOutcome outcome) {
        return LedgerEntry.builder()
                .unitKey(job.unit.getKey().toString())
                .outcome(outcome)
                .recordedAt(clock.instant())
                .attempts(job.attempts)
                .files(paths(job.unit))
                .forced(job.forced);
    }

    private void append(LedgerEntry entry) {
        ledger.append(entry);
        outcomeCounts.merge(entry.getOutcome(), 1, Integer::sum);
    }

    private static List<String> paths(ProcessingUnit unit) {
        return unit.memberPaths().stream()
                .map(p -> p.toAbsolutePath().normalize().toString())
                .collect(Collectors.toList());
    }

    private static void pause(Duration duration) {
        try {
            Thread.sleep(Math.max(1, duration.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Job {
        final ProcessingUnit unit;
        final boolean forced;
        int attempts;
        Instant dueAt = Instant.EPOCH;
        String lastError;
        ErrorCategory lastCategory;
        boolean deferredRecorded;

        Job(ProcessingUnit unit, boolean forced, int attempts) {
            this.unit = unit;
            this.forced = forced;
            this.attempts = attempts;
        }
    }

    private static final class Completion {
        final Job job;
        final CalibrationArtifact artifact;
        final EmissionMeasurement measurement;
        final Throwable error;

        private Completion(Job job, CalibrationArtifact artifact, EmissionMeasurement measurement, Throwable error) {
            this.job = job;
            this.artifact = artifact;
            this.measurement = measurement;
            this.error = error;
        }

        static Completion calibrated(Job job, CalibrationArtifact artifact) {
            return new Completion(job, artifact, null, null);
        }

        static Completion measured(Job job, EmissionMeasurement measurement) {
            return new Completion(job, null, measurement, null);
        }

        static Completion failed(Job job, Throwable error) {
            return new Completion(job, null, null, error);
        }
    }
}
