package com.di.plumeflux.watcher;

import com.di.plumeflux.MutableClock;
import com.di.plumeflux.TestFiles;
import com.di.plumeflux.calibration.CalibrationArtifactStore;
import com.di.plumeflux.calibration.CalibrationRegistry;
import com.di.plumeflux.calibration.DifferentialAbsorptionFitter;
import com.di.plumeflux.calibration.DoasCalibrationPipeline;
import com.di.plumeflux.calibration.NpySpectrumReader;
import com.di.plumeflux.config.PipelineProperties;
import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.emission.EmissionSeriesWriter;
import com.di.plumeflux.emission.FluxCalculator;
import com.di.plumeflux.emission.ImageIntensityReader;
import com.di.plumeflux.emission.PlumeEmissionRatePipeline;
import com.di.plumeflux.grouping.GroupingRouter;
import com.di.plumeflux.ledger.JsonLinesUnitLedger;
import com.di.plumeflux.ledger.LedgerEntry;
import com.di.plumeflux.ledger.LedgerOutcome;
import com.di.plumeflux.observer.DirectoryObserver;
import com.di.plumeflux.observer.FilenameClassifier;
import com.di.plumeflux.orchestrator.FileArchiver;
import com.di.plumeflux.orchestrator.JobOrchestrator;
import com.di.plumeflux.orchestrator.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full watcher cycle over a real directory: observer, router, orchestrator, both pipelines and the
 * ledger, driven by a mutable clock and a same-thread executor.
 */
@DisplayName("Watcher scenarios")
class WatcherScenarioTest {

    private static final Duration QUIESCENCE = Duration.ofSeconds(3);

    @TempDir
    Path base;

    private Path watchRoot;
    private StationConfig station;
    private MutableClock clock;
    private Station running;

    @BeforeEach
    void setUp() throws IOException {
        watchRoot = Files.createDirectories(base.resolve("watch"));
        station = new StationConfig();
        station.setBaseDir(base);
        station.setWatchRoot("watch");
        station.setCalibrationDir("out/doas");
        station.setEmissionDir("out/emission");
        station.setArchiveDir("out/archive");
        station.getEmission().setPcsLineLengthM(1000.0);
        station.getEmission().setPlumeSpeedMs(8.0);
        station.getGrouping().setMoveArchivedFiles(true);
        station.getRetry().setInitialBackoff(Duration.ofSeconds(1));
        clock = new MutableClock(Instant.parse("2024-06-01T14:00:00Z"));
        running = new Station();
    }

    @AfterEach
    void tearDown() {
        running.close();
    }

    /** One process lifetime over the shared directories and ledger file. */
    private final class Station implements AutoCloseable {
        final JsonLinesUnitLedger ledger = new JsonLinesUnitLedger(station.ledgerFilePath(), false);
        final CalibrationRegistry registry = new CalibrationRegistry();
        final CalibrationArtifactStore store = new CalibrationArtifactStore(station.calibrationDirPath());
        final FilenameClassifier classifier = new FilenameClassifier(station.getFiles(), station.zoneId());
        final GroupingRouter router = new GroupingRouter(station.getGrouping().getPairingTolerance(),
                station.getGrouping().getPairingPolicy(), station.getGrouping().getMaxIncompleteAge(), classifier, clock);
        final JobOrchestrator orchestrator;
        final WatcherLoop loop;
        final WatcherService service;
        final ExecutorService workers = Executors.newSingleThreadExecutor();

        Station() {
            registry.publishAll(store.loadAll());
            DoasCalibrationPipeline calibration = new DoasCalibrationPipeline(new NpySpectrumReader(1),
                    new DifferentialAbsorptionFitter(station.getCalibration()), store,
                    station.getCalibration().getValidity(), clock);
            PlumeEmissionRatePipeline emission = new PlumeEmissionRatePipeline(new ImageIntensityReader(null, null),
                    new FluxCalculator(station.getEmission()),
                    new EmissionSeriesWriter(station.emissionDirPath(), station.zoneId()), "flow_glob", clock);
            orchestrator = new JobOrchestrator(ledger, calibration, emission, registry,
                    new FileArchiver(watchRoot, station.archiveDirPath(), true),
                    RetryPolicy.from(station.getRetry()), Runnable::run, 2, clock);
            DirectoryObserver observer = new DirectoryObserver(watchRoot, classifier, QUIESCENCE, ".lock", clock);
            loop = new WatcherLoop(observer, router, orchestrator, ledger, clock);
            service = new WatcherService(loop, orchestrator, router, ledger, workers, station, new PipelineProperties());
        }

        /** Polls until files written so far have been seen twice, then runs a few more cycles. */
        void settle() {
            loop.cycle();
            for (int i = 0; i < 3; i++) {
                clock.advance(QUIESCENCE);
                loop.cycle();
            }
        }

        @Override
        public void close() {
            ledger.close();
            workers.shutdownNow();
        }
    }

    private Station restart() {
        running.close();
        running = new Station();
        return running;
    }

    private LedgerOutcome outcome(String key) {
        return running.ledger.latest(key).map(LedgerEntry::getOutcome).orElse(null);
    }

    private long measurementFiles() throws IOException {
        Path units = base.resolve("out/emission/units");
        if (!Files.exists(units)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(units)) {
            return files.count();
        }
    }

    @Test
    @DisplayName("Scan at 12:00 then pair at 12:10: calibration [12:00, 13:00) and one measurement")
    void testCalibrationThenMeasurement() throws IOException {
        TestFiles.writeSpectrum(watchRoot.resolve("scan_20240601_1200.npy"), 301, 0.3);
        TestFiles.writeImage(watchRoot.resolve("img_on_20240601_1210.png"), 100);
        TestFiles.writeImage(watchRoot.resolve("img_off_20240601_1210.png"), 180);

        running.settle();

        assertEquals(LedgerOutcome.SUCCESS, outcome("scan:20240601T120000Z"));
        assertEquals(LedgerOutcome.SUCCESS, outcome("pair:20240601T121000Z"));
        assertEquals(1, measurementFiles());
        assertEquals(Instant.parse("2024-06-01T13:00:00Z"),
                running.registry.findCovering(Instant.parse("2024-06-01T12:10:00Z")).orElseThrow().getValidTo());
    }

    @Test
    @DisplayName("A pair that arrives before its calibration is deferred, then measured once the scan lands")
    void testPairBeforeScan() throws IOException {
        TestFiles.writeImage(watchRoot.resolve("img_on_20240601_1210.png"), 100);
        TestFiles.writeImage(watchRoot.resolve("img_off_20240601_1210.png"), 180);
        running.settle();
        assertEquals(LedgerOutcome.DEFERRED, outcome("pair:20240601T121000Z"));
        assertEquals(0, measurementFiles());

        TestFiles.writeSpectrum(watchRoot.resolve("scan_20240601_1200.npy"), 301, 0.3);
        running.settle();

        assertEquals(LedgerOutcome.SUCCESS, outcome("pair:20240601T121000Z"));
        assertEquals(1, measurementFiles());
    }

    @Test
    @DisplayName("Touching a file of a deferred pair does not orphan it; the pair is measured once")
    void testReemittedDeferredPair() throws IOException {
        TestFiles.writeImage(watchRoot.resolve("img_on_20240601_1210.png"), 100);
        Path off = TestFiles.writeImage(watchRoot.resolve("img_off_20240601_1210.png"), 180);
        running.settle();
        assertEquals(LedgerOutcome.DEFERRED, outcome("pair:20240601T121000Z"));

        // long enough for the router to forget the pair; only the orchestrator still holds it
        clock.advance(station.getGrouping().getMaxIncompleteAge().multipliedBy(2));
        running.loop.cycle();
        Files.setLastModifiedTime(off, FileTime.from(Files.getLastModifiedTime(off).toInstant().plusSeconds(60)));
        running.settle();

        assertNull(outcome("orphan:img_off_20240601_1210.png"));
        assertTrue(Files.exists(off));

        TestFiles.writeSpectrum(watchRoot.resolve("scan_20240601_1200.npy"), 301, 0.3);
        running.settle();

        assertEquals(LedgerOutcome.SUCCESS, outcome("pair:20240601T121000Z"));
        assertEquals(1, measurementFiles());
    }

    @Test
    @DisplayName("A lone on-band image is archived incomplete and never measured")
    void testLoneImage() throws IOException {
        TestFiles.writeSpectrum(watchRoot.resolve("scan_20240601_1200.npy"), 301, 0.3);
        TestFiles.writeImage(watchRoot.resolve("img_on_20240601_1310.png"), 100);
        running.settle();
        assertNull(outcome("pair:20240601T131000Z"));

        clock.advance(station.getGrouping().getMaxIncompleteAge().multipliedBy(2));
        running.loop.cycle();

        assertEquals(LedgerOutcome.INCOMPLETE, outcome("pair:20240601T131000Z"));
        assertTrue(Files.exists(base.resolve("out/archive/incomplete/img_on_20240601_1310.png")));
        assertFalse(Files.exists(watchRoot.resolve("img_on_20240601_1310.png")));
        assertEquals(0, measurementFiles());
    }

    @Test
    @DisplayName("A third image within tolerance of a formed pair is orphaned and archived")
    void testOrphan() throws IOException {
        TestFiles.writeSpectrum(watchRoot.resolve("scan_20240601_1200.npy"), 301, 0.3);
        TestFiles.writeImage(watchRoot.resolve("img_on_20240601_121000.png"), 100);
        TestFiles.writeImage(watchRoot.resolve("img_on_20240601_121001.png"), 110);
        TestFiles.writeImage(watchRoot.resolve("img_off_20240601_121001.png"), 180);

        running.settle();

        // the off image pairs with the earlier on image; the later on image arrives after the pair formed
        assertEquals(LedgerOutcome.SUCCESS, outcome("pair:20240601T121000Z"));
        assertEquals(LedgerOutcome.ORPHANED, outcome("orphan:img_on_20240601_121001.png"));
        assertTrue(Files.exists(base.resolve("out/archive/orphaned/img_on_20240601_121001.png")));
        assertEquals(1, measurementFiles());
    }

    @Test
    @DisplayName("After a restart nothing already handled is processed again")
    void testRestartIsIdempotent() throws IOException {
        TestFiles.writeSpectrum(watchRoot.resolve("scan_20240601_1200.npy"), 301, 0.3);
        TestFiles.writeImage(watchRoot.resolve("img_on_20240601_1210.png"), 100);
        TestFiles.writeImage(watchRoot.resolve("img_off_20240601_1210.png"), 180);
        running.settle();
        int entries = running.ledger.history("pair:20240601T121000Z").size();

        Station second = restart();
        second.settle();

        assertEquals(entries, second.ledger.history("pair:20240601T121000Z").size());
        assertEquals(1, second.ledger.history("scan:20240601T120000Z").size());
        assertEquals(1, second.registry.size(), "artifact reloaded from disk");
        assertEquals(1, measurementFiles());
    }

    @Test
    @DisplayName("A malformed scan fails once and is only retried by an explicit re-run")
    void testFailedScanRerun() throws IOException {
        Path scan = TestFiles.touch(watchRoot.resolve("scan_20240601_1200.npy"), "garbage");
        running.settle();
        assertEquals(LedgerOutcome.FAILED, outcome("scan:20240601T120000Z"));

        TestFiles.writeSpectrum(scan, 301, 0.3);
        running.settle();
        assertEquals(LedgerOutcome.FAILED, outcome("scan:20240601T120000Z"), "consumed files are not re-routed");

        running.service.rerun(List.of("scan:20240601T120000Z", "pair:20991231T000000Z"));
        running.loop.cycle();

        LedgerEntry latest = running.ledger.latest("scan:20240601T120000Z").orElseThrow();
        assertEquals(LedgerOutcome.SUCCESS, latest.getOutcome());
        assertTrue(latest.isForced());
        try (Stream<Path> files = Files.list(base.resolve("out/doas"))) {
            List<String> artifacts = files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(".json"))
                    .collect(Collectors.toList());
            assertEquals(List.of("doas_calibration_scan_20240601T120000Z.json"), artifacts);
        }
    }
}
