package com.di.plumeflux.cli;

import com.di.plumeflux.calibration.CalibrationArtifact;
import com.di.plumeflux.calibration.CalibrationArtifactStore;
import com.di.plumeflux.calibration.CalibrationRegistry;
import com.di.plumeflux.config.PipelineProperties;
import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.grouping.GroupingRouter;
import com.di.plumeflux.grouping.RoutingResult;
import com.di.plumeflux.ledger.LedgerOutcome;
import com.di.plumeflux.observer.FileKind;
import com.di.plumeflux.observer.RawFile;
import com.di.plumeflux.orchestrator.JobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code pyplis}: computes emission rates for every image pair in the image directory, using the
 * calibrations found in {@code --doas_results} and the station's calibration directory. Pairs no
 * calibration covers are left deferred.
 */
@Slf4j
@RequiredArgsConstructor
public class PyplisBatchCommand {

    private final BatchInputScanner scanner;
    private final GroupingRouter router;
    private final JobOrchestrator orchestrator;
    private final CalibrationArtifactStore artifactStore;
    private final CalibrationRegistry registry;
    private final StationConfig station;
    private final PipelineProperties properties;

    public int run(Path doasResults, boolean force) {
        List<CalibrationArtifact> loaded = artifactStore.loadAll();
        registry.publishAll(loaded);
        if (doasResults != null) {
            List<CalibrationArtifact> extra = artifactStore.loadFrom(doasResults);
            registry.publishAll(extra);
            log.info("[PYPLIS] {} calibrations from {}", extra.size(), doasResults);
        }
        log.info("[PYPLIS] {} calibrations available", registry.size());

        List<RawFile> images = scanner.scan(station.imageDirPath(), FileKind::isImage, force);
        int pairs = 0;
        for (RawFile image : images) {
            RoutingResult result = router.route(image);
            result.getOrphans().forEach(orchestrator::recordOrphan);
            if (result.getReady().isPresent()) {
                orchestrator.submit(result.getReady().get(), force);
                pairs++;
            }
        }
        router.drainIncomplete().forEach(orchestrator::recordIncomplete);
        log.info("[PYPLIS] {} images formed {} pairs", images.size(), pairs);

        orchestrator.runUntilIdle();
        int deferred = orchestrator.waitingCount();
        orchestrator.shutdown(properties.getDrainTimeout());
        int failed = orchestrator.outcomeCount(LedgerOutcome.FAILED);
        log.info("[PYPLIS] done: {} measured, {} failed, {} without calibration",
                orchestrator.outcomeCount(LedgerOutcome.SUCCESS), failed, deferred);
        return failed > 0 ? 1 : 0;
    }
}
