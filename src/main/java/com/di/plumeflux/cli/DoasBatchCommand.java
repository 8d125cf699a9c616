package com.di.plumeflux.cli;

import com.di.plumeflux.config.PipelineProperties;
import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.ledger.LedgerOutcome;
import com.di.plumeflux.ledger.UnitLedger;
import com.di.plumeflux.observer.FileKind;
import com.di.plumeflux.observer.RawFile;
import com.di.plumeflux.orchestrator.JobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code doas}: calibrates every scan in the spectra directory. Scans are grouped into windows of
 * the calibration validity (aligned to the epoch), one artifact per window.
 *
 * <p>A window that was already calibrated is skipped unless it has gained scans since; it is then
 * recalibrated from all of its scans and the new artifact supersedes the old one.
 */
@Slf4j
@RequiredArgsConstructor
public class DoasBatchCommand {

    private final BatchInputScanner scanner;
    private final JobOrchestrator orchestrator;
    private final UnitLedger ledger;
    private final StationConfig station;
    private final PipelineProperties properties;

    public int run(boolean force) {
        List<RawFile> scans = scanner.scan(station.spectraDirPath(), kind -> kind == FileKind.SCAN, true);
        List<ProcessingUnit> units = groupIntoWindows(scans, station.getCalibration().getValidity());
        int submitted = 0;
        for (ProcessingUnit unit : units) {
            if (force) {
                orchestrator.submit(unit, true);
                submitted++;
                continue;
            }
            long fresh = unit.memberPaths().stream().filter(p -> !ledger.isFileConsumed(p)).count();
            if (fresh == 0) {
                log.debug("[DOAS] window {} unchanged, skipped", unit.getKey());
                continue;
            }
            boolean calibrated = ledger.latest(unit.getKey().toString())
                    .map(e -> e.getOutcome().isTerminal())
                    .orElse(false);
            if (calibrated) {
                log.info("[DOAS] window {} has {} new scans; recalibrating", unit.getKey(), fresh);
            }
            orchestrator.submit(unit, calibrated);
            submitted++;
        }
        log.info("[DOAS] {} scans in {} calibration windows, {} submitted", scans.size(), units.size(), submitted);

        orchestrator.runUntilIdle();
        orchestrator.shutdown(properties.getDrainTimeout());
        int failed = orchestrator.outcomeCount(LedgerOutcome.FAILED);
        log.info("[DOAS] done: {} calibrated, {} failed", orchestrator.outcomeCount(LedgerOutcome.SUCCESS), failed);
        return failed > 0 ? 1 : 0;
    }

    static List<ProcessingUnit> groupIntoWindows(List<RawFile> scans, Duration window) {
        long windowMs = window.toMillis();
        Map<Long, List<RawFile>> buckets = new TreeMap<>();
        for (RawFile scan : scans) {
            long bucket = Math.floorDiv(scan.getAcquiredAt().toEpochMilli(), windowMs);
            buckets.computeIfAbsent(bucket, b -> new ArrayList<>()).add(scan);
        }
        List<ProcessingUnit> units = new ArrayList<>();
        buckets.forEach((bucket, members) ->
                units.add(ProcessingUnit.scanWindow(Instant.ofEpochMilli(bucket * windowMs), members)));
        return units;
    }
}
