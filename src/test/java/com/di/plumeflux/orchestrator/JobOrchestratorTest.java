package com.di.plumeflux.orchestrator;

import com.di.plumeflux.MutableClock;
import com.di.plumeflux.calibration.CalibrationArtifact;
import com.di.plumeflux.calibration.CalibrationCurve;
import com.di.plumeflux.calibration.CalibrationPipeline;
import com.di.plumeflux.calibration.CalibrationRegistry;
import com.di.plumeflux.emission.EmissionMeasurement;
import com.di.plumeflux.emission.EmissionRatePipeline;
import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.exception.OrphanDataException;
import com.di.plumeflux.exception.TransientIoException;
import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.grouping.UnitState;
import com.di.plumeflux.ledger.JsonLinesUnitLedger;
import com.di.plumeflux.ledger.LedgerEntry;
import com.di.plumeflux.ledger.LedgerOutcome;
import com.di.plumeflux.observer.FileKind;
import com.di.plumeflux.observer.RawFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobOrchestrator Tests")
class JobOrchestratorTest {

    private static final Instant T1200 = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant T1210 = Instant.parse("2024-06-01T12:10:00Z");
    private static final RetryPolicy RETRY = new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(30), 2.0);

    @TempDir
    Path dir;

    private MutableClock clock;
    private JsonLinesUnitLedger ledger;
    private CalibrationRegistry registry;
    private final AtomicInteger calibrations = new AtomicInteger();
    private final AtomicInteger measurements = new AtomicInteger();
    private final List<String> dispatchOrder = new ArrayList<>();
    private Function<ProcessingUnit, CalibrationArtifact> calibrationBehaviour;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T1200.plus(Duration.ofMinutes(30)));
        ledger = new JsonLinesUnitLedger(dir.resolve("ledger.jsonl"), false);
        registry = new CalibrationRegistry();
        calibrationBehaviour = this::artifactFor;
    }

    @AfterEach
    void tearDown() {
        ledger.close();
    }

    private JobOrchestrator orchestrator(Executor executor, int maxInFlight) {
        CalibrationPipeline calibration = unit -> {
            calibrations.incrementAndGet();
            dispatchOrder.add(unit.getKey().toString());
            return calibrationBehaviour.apply(unit);
        };
        EmissionRatePipeline emission = (unit, artifact) -> {
            measurements.incrementAndGet();
            dispatchOrder.add(unit.getKey().toString());
            return EmissionMeasurement.builder()
                    .unitKey(unit.getKey().toString())
                    .acquiredAt(unit.getAcquiredAt())
                    .calibrationId(artifact.getId())
                    .build();
        };
        return new JobOrchestrator(ledger, calibration, emission, registry,
                new FileArchiver(dir, dir.resolve("archive"), false), RETRY, executor, maxInFlight, clock);
    }

    private JobOrchestrator orchestrator() {
        return orchestrator(Runnable::run, 2);
    }

    private CalibrationArtifact artifactFor(ProcessingUnit unit) {
        return CalibrationArtifact.builder()
                .id(unit.getKey().toString())
                .validFrom(unit.earliest())
                .validTo(unit.latest().plus(Duration.ofHours(1)))
                .createdAt(clock.instant())
                .curve(CalibrationCurve.builder().slope(1e18).method("test").build())
                .path(dir.resolve("doas_calibration_" + unit.getKey().toFileToken() + ".json").toString())
                .build();
    }

    private static RawFile raw(FileKind kind, Instant at, String name) {
        return RawFile.builder().path(Path.of("/watch", name)).kind(kind).acquiredAt(at).size(1).lastModified(at).build();
    }

    private static ProcessingUnit scan(Instant at) {
        return ProcessingUnit.scan(raw(FileKind.SCAN, at, "scan_" + at.getEpochSecond() + ".npy"));
    }

    private static ProcessingUnit pair(Instant at) {
        return ProcessingUnit.pair(raw(FileKind.IMAGE_ON, at, "on_" + at.getEpochSecond() + ".png"),
                raw(FileKind.IMAGE_OFF, at, "off_" + at.getEpochSecond() + ".png"));
    }

    private LedgerOutcome latest(ProcessingUnit unit) {
        return ledger.latest(unit.getKey().toString()).map(LedgerEntry::getOutcome).orElse(null);
    }

    // ============================================================================
    // Idempotence
    // ============================================================================

    @Test
    @DisplayName("Dispatching the same key twice yields one ledger entry and one artifact")
    void testIdempotence() {
        JobOrchestrator orchestrator = orchestrator();
        ProcessingUnit unit = scan(T1200);

        assertEquals(SubmitResult.ACCEPTED, orchestrator.submit(unit));
        assertEquals(SubmitResult.COALESCED, orchestrator.submit(scan(T1200)));
        orchestrator.tick();
        assertEquals(SubmitResult.ALREADY_DONE, orchestrator.submit(unit));
        orchestrator.tick();

        assertEquals(1, calibrations.get());
        assertEquals(1, ledger.history(unit.getKey().toString()).size());
        assertEquals(1, registry.size());
        assertEquals(UnitState.SUCCEEDED, orchestrator.stateOf(unit.getKey()));
    }

    @Test
    @DisplayName("A terminal outcome from an earlier run is honoured after restart")
    void testRestartSkipsDone() {
        JobOrchestrator first = orchestrator();
        first.submit(scan(T1200));
        first.tick();
        assertEquals(LedgerOutcome.SUCCESS, latest(scan(T1200)));

        JobOrchestrator second = orchestrator();
        assertEquals(SubmitResult.ALREADY_DONE, second.submit(scan(T1200)));
    }

    // ============================================================================
    // Priority and deferral
    // ============================================================================

    @Test
    @DisplayName("Calibration units are dispatched before emission units")
    void testCalibrationPriority() {
        List<Runnable> pending = new ArrayList<>();
        JobOrchestrator orchestrator = orchestrator(pending::add, 1);
        registry.publish(artifactFor(scan(T1200)));

        orchestrator.submit(pair(T1210));
        orchestrator.submit(scan(T1200.plus(Duration.ofMinutes(20))));
        orchestrator.tick();

        assertEquals(1, pending.size(), "one slot");
        pending.remove(0).run();
        assertEquals(List.of("scan:20240601T122000Z"), dispatchOrder);

        orchestrator.tick();
        pending.remove(0).run();
        orchestrator.tick();
        assertEquals("pair:20240601T121000Z", dispatchOrder.get(1));
    }

    @Test
    @DisplayName("No measurement without a covering calibration; publishing releases the waiting unit")
    void testDeferralAndRelease() {
        JobOrchestrator orchestrator = orchestrator();
        ProcessingUnit pair = pair(T1210);

        orchestrator.submit(pair);
        orchestrator.tick();
        assertEquals(0, measurements.get());
        assertEquals(LedgerOutcome.DEFERRED, latest(pair));
        assertEquals(UnitState.DEFERRED, orchestrator.stateOf(pair.getKey()));
        assertEquals(1, orchestrator.waitingCount());

        orchestrator.submit(scan(T1200));
        orchestrator.tick();
        orchestrator.tick();

        assertEquals(1, measurements.get());
        assertEquals(LedgerOutcome.SUCCESS, latest(pair));
        assertEquals(0, orchestrator.waitingCount());
    }

    @Test
    @DisplayName("A calibration only releases units inside its window")
    void testReleaseRespectsWindow() {
        JobOrchestrator orchestrator = orchestrator();
        ProcessingUnit inside = pair(T1210);
        ProcessingUnit outside = pair(Instant.parse("2024-06-01T13:10:00Z"));
        orchestrator.submit(inside);
        orchestrator.submit(outside);
        orchestrator.tick();

        orchestrator.submit(scan(T1200));
        orchestrator.tick();
        orchestrator.tick();

        assertEquals(LedgerOutcome.SUCCESS, latest(inside));
        assertEquals(LedgerOutcome.DEFERRED, latest(outside));
        assertEquals(1, orchestrator.waitingCount());
    }

    // ============================================================================
    // Failures and retries
    // ============================================================================

    @Test
    @DisplayName("Three transient failures end FAILED; a later submit runs only when forced")
    void testRetryExhaustion() {
        calibrationBehaviour = unit -> {
            throw new TransientIoException("spectrum locked");
        };
        JobOrchestrator orchestrator = orchestrator();
        ProcessingUnit unit = scan(T1200);

        orchestrator.submit(unit);
        orchestrator.tick();
        assertEquals(1, calibrations.get());
        orchestrator.tick();
        assertEquals(1, calibrations.get(), "backoff not elapsed");

        clock.advance(Duration.ofSeconds(2));
        orchestrator.tick();
        assertEquals(2, calibrations.get());
        clock.advance(Duration.ofSeconds(3));
        orchestrator.tick();
        assertEquals(2, calibrations.get(), "second backoff is 4s");
        clock.advance(Duration.ofSeconds(1));
        orchestrator.tick();
        assertEquals(3, calibrations.get());

        LedgerEntry failed = ledger.latest(unit.getKey().toString()).orElseThrow();
        assertEquals(LedgerOutcome.FAILED, failed.getOutcome());
        assertEquals(3, failed.getAttempts());
        assertEquals("TRANSIENT_IO", failed.getErrorCategory());
        assertEquals(1, ledger.history(unit.getKey().toString()).size());

        calibrationBehaviour = this::artifactFor;
        assertEquals(SubmitResult.ALREADY_DONE, orchestrator.submit(unit));
        assertEquals(SubmitResult.ACCEPTED, orchestrator.submit(unit, true));
        orchestrator.tick();
        LedgerEntry rerun = ledger.latest(unit.getKey().toString()).orElseThrow();
        assertEquals(LedgerOutcome.SUCCESS, rerun.getOutcome());
        assertTrue(rerun.isForced());
    }

    @Test
    @DisplayName("Non-transient failures are not retried")
    void testMalformedFailsAtOnce() {
        calibrationBehaviour = unit -> {
            throw new MalformedDataException("bad header");
        };
        JobOrchestrator orchestrator = orchestrator();
        orchestrator.submit(scan(T1200));
        orchestrator.tick();
        clock.advance(Duration.ofMinutes(5));
        orchestrator.tick();

        assertEquals(1, calibrations.get());
        assertEquals(LedgerOutcome.FAILED, latest(scan(T1200)));
        assertEquals(UnitState.FAILED, orchestrator.stateOf(scan(T1200).getKey()));
    }

    // ============================================================================
    // Shutdown, orphans and incomplete units
    // ============================================================================

    @Test
    @DisplayName("Shutdown persists waiting and retrying units as deferred with their attempts")
    void testShutdownPersistsPending() {
        calibrationBehaviour = unit -> {
            throw new TransientIoException("locked");
        };
        JobOrchestrator orchestrator = orchestrator();
        orchestrator.submit(scan(T1200));
        orchestrator.submit(pair(Instant.parse("2024-06-01T15:00:00Z")));
        orchestrator.tick();

        orchestrator.shutdown(Duration.ofSeconds(1));

        LedgerEntry retrying = ledger.latest(scan(T1200).getKey().toString()).orElseThrow();
        assertEquals(LedgerOutcome.DEFERRED, retrying.getOutcome());
        assertEquals(1, retrying.getAttempts());
        assertEquals(LedgerOutcome.DEFERRED, latest(pair(Instant.parse("2024-06-01T15:00:00Z"))));
        assertEquals(SubmitResult.REJECTED, orchestrator.submit(scan(T1210)));

        JobOrchestrator restarted = orchestrator();
        restarted.submit(scan(T1200));
        restarted.tick();
        clock.advance(Duration.ofSeconds(4));
        restarted.tick();
        assertEquals(3, ledger.latest(scan(T1200).getKey().toString()).orElseThrow().getAttempts());
        assertEquals(LedgerOutcome.FAILED, latest(scan(T1200)));
    }

    @Test
    @DisplayName("Orphans and incomplete units are recorded and their files consumed")
    void testOrphanAndIncomplete() {
        JobOrchestrator orchestrator = orchestrator();
        Path orphan = Path.of("/watch/img_on_20240601_1210_b.png");
        orchestrator.recordOrphan(new OrphanDataException(orphan, "surplus"));

        ProcessingUnit lone = ProcessingUnit.incomplete(raw(FileKind.IMAGE_ON,
                Instant.parse("2024-06-01T13:10:00Z"), "img_on_20240601_1310.png"));
        orchestrator.recordIncomplete(lone);

        assertTrue(ledger.isFileConsumed(orphan));
        assertTrue(ledger.isFileConsumed(Path.of("/watch/img_on_20240601_1310.png")));
        assertEquals(LedgerOutcome.INCOMPLETE, latest(lone));
        assertEquals(UnitState.INCOMPLETE, orchestrator.stateOf(lone.getKey()));
        assertEquals(0, measurements.get());
    }
}
