package com.di.plumeflux.watcher;

import com.di.plumeflux.grouping.GroupingRouter;
import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.grouping.RoutingResult;
import com.di.plumeflux.ledger.UnitLedger;
import com.di.plumeflux.observer.DirectoryObserver;
import com.di.plumeflux.observer.RawFile;
import com.di.plumeflux.orchestrator.JobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * One pass of the coordinating loop: poll, route, evict stale partials, tick the orchestrator.
 * Files already consumed by a terminal ledger outcome, or belonging to a unit the orchestrator
 * still holds, never reach the router again; a re-emitted file is not a new arrival.
 */
@Slf4j
@RequiredArgsConstructor
public class WatcherLoop {

    private final DirectoryObserver observer;
    private final GroupingRouter router;
    private final JobOrchestrator orchestrator;
    private final UnitLedger ledger;
    private final Clock clock;

    public void cycle() {
        List<RawFile> stable = observer.poll();
        for (RawFile file : stable) {
            if (ledger.isFileConsumed(file.getPath())) {
                log.debug("[WATCHER] {} already handled", file.fileName());
                continue;
            }
            if (orchestrator.isActiveFile(file.getPath())) {
                log.debug("[WATCHER] {} re-emitted while its unit is pending; ignored", file.fileName());
                continue;
            }
            RoutingResult result = router.route(file);
            result.getOrphans().forEach(orchestrator::recordOrphan);
            result.getReady().ifPresent(orchestrator::submit);
        }
        for (ProcessingUnit incomplete : router.evictIncomplete(clock.instant())) {
            orchestrator.recordIncomplete(incomplete);
        }
        orchestrator.tick();
    }
}
