package com.di.plumeflux.watcher;

import com.di.plumeflux.config.PipelineProperties;
import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.grouping.GroupingRouter;
import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.grouping.UnitKey;
import com.di.plumeflux.ledger.LedgerEntry;
import com.di.plumeflux.ledger.UnitLedger;
import com.di.plumeflux.orchestrator.JobOrchestrator;
import com.di.plumeflux.orchestrator.SubmitResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Long-running mode. A single scheduled thread runs {@link WatcherLoop#cycle()} every poll interval;
 * on context shutdown the loop stops, running units drain and pending ones are persisted.
 */
@Slf4j
public class WatcherService {

    private final WatcherLoop loop;
    private final JobOrchestrator orchestrator;
    private final GroupingRouter router;
    private final UnitLedger ledger;
    private final ExecutorService workers;
    private final StationConfig station;
    private final PipelineProperties properties;
    private ScheduledExecutorService scheduler;

    public WatcherService(WatcherLoop loop, JobOrchestrator orchestrator, GroupingRouter router, UnitLedger ledger,
                          ExecutorService workers, StationConfig station, PipelineProperties properties) {
        this.loop = loop;
        this.orchestrator = orchestrator;
        this.router = router;
        this.ledger = ledger;
        this.workers = workers;
        this.station = station;
        this.properties = properties;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "watcher-loop");
            t.setDaemon(false);
            return t;
        });
        long intervalMs = station.getObserver().getPollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::safeCycle, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[WATCHER] station '{}' watching {} every {} ms", station.getStationName(),
                station.watchRootPath(), intervalMs);
    }

    /** Queues forced re-runs of recorded units; runs on the loop thread with the next cycle. */
    public void rerun(List<String> unitKeys) {
        Runnable task = () -> unitKeys.forEach(this::rerunOne);
        if (scheduler != null) {
            scheduler.execute(task);
        } else {
            task.run();
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (this) {
            if (scheduler == null) {
                return;
            }
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(properties.getDrainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[WATCHER] loop did not stop within {}", properties.getDrainTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        log.info("[WATCHER] stopping; draining running units");
        orchestrator.shutdown(properties.getDrainTimeout());
        workers.shutdown();
        ledger.close();
    }

    private void safeCycle() {
        try {
            loop.cycle();
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task; log and try again next interval
            log.error("[WATCHER] cycle failed: {}", e.getMessage(), e);
        }
    }

    private void rerunOne(String rawKey) {
        UnitKey key;
        try {
            key = UnitKey.parse(rawKey.trim());
        } catch (RuntimeException e) {
            log.warn("[WATCHER] cannot re-run '{}': {}", rawKey, e.getMessage());
            return;
        }
        Optional<LedgerEntry> latest = ledger.latest(key.toString());
        if (latest.isEmpty()) {
            log.warn("[WATCHER] cannot re-run {}: not in the ledger", key);
            return;
        }
        try {
            List<Path> files = latest.get().getFiles().stream().map(Path::of).collect(Collectors.toList());
            ProcessingUnit unit = router.rebuild(key, files);
            SubmitResult result = orchestrator.submit(unit, true);
            log.info("[WATCHER] re-run of {}: {}", key, result);
        } catch (RuntimeException e) {
            log.warn("[WATCHER] cannot re-run {}: {}", key, e.getMessage());
        }
    }
}
