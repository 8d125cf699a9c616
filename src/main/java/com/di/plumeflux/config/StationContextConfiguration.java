package com.di.plumeflux.config;

import com.di.plumeflux.calibration.CalibrationArtifactStore;
import com.di.plumeflux.calibration.CalibrationFitter;
import com.di.plumeflux.calibration.CalibrationPipeline;
import com.di.plumeflux.calibration.CalibrationRegistry;
import com.di.plumeflux.calibration.DifferentialAbsorptionFitter;
import com.di.plumeflux.calibration.DoasCalibrationPipeline;
import com.di.plumeflux.calibration.NpySpectrumReader;
import com.di.plumeflux.cli.BatchInputScanner;
import com.di.plumeflux.cli.CommandLineArgs;
import com.di.plumeflux.cli.DoasBatchCommand;
import com.di.plumeflux.cli.PipelineCommand;
import com.di.plumeflux.cli.PipelineCommandRunner;
import com.di.plumeflux.cli.PyplisBatchCommand;
import com.di.plumeflux.emission.EmissionRatePipeline;
import com.di.plumeflux.emission.EmissionSeriesWriter;
import com.di.plumeflux.emission.FluxCalculator;
import com.di.plumeflux.emission.ImageIntensityReader;
import com.di.plumeflux.emission.PlumeEmissionRatePipeline;
import com.di.plumeflux.exception.ConfigurationException;
import com.di.plumeflux.grouping.GroupingRouter;
import com.di.plumeflux.ledger.JsonLinesUnitLedger;
import com.di.plumeflux.ledger.UnitLedger;
import com.di.plumeflux.observer.DirectoryObserver;
import com.di.plumeflux.observer.FilenameClassifier;
import com.di.plumeflux.orchestrator.FileArchiver;
import com.di.plumeflux.orchestrator.JobOrchestrator;
import com.di.plumeflux.orchestrator.RetryPolicy;
import com.di.plumeflux.util.MdcPropagation;
import com.di.plumeflux.watcher.WatcherLoop;
import com.di.plumeflux.watcher.WatcherService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the pipeline from the station file named by {@code --config_path}. Anything wrong with
 * that file fails context startup with a {@link ConfigurationException}.
 */
@Slf4j
@Configuration
public class StationContextConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineCommand pipelineCommand(ApplicationArguments arguments) {
        List<String> positional = arguments.getNonOptionArgs();
        return PipelineCommand.parse(positional.isEmpty() ? null : positional.get(0));
    }

    @Bean
    public StationConfig stationConfig(ApplicationArguments arguments, StationConfigLoader loader,
                                       PipelineCommand command) {
        List<String> values = arguments.getOptionValues(CommandLineArgs.CONFIG_PATH);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new ConfigurationException("--" + CommandLineArgs.CONFIG_PATH + " is required");
        }
        StationConfig config = loader.load(Path.of(values.get(0)));
        loader.validateFor(config, command);
        return config;
    }

    @Bean
    public FilenameClassifier filenameClassifier(StationConfig station) {
        return new FilenameClassifier(station.getFiles(), station.zoneId());
    }

    @Bean(destroyMethod = "close")
    public UnitLedger unitLedger(StationConfig station, PipelineProperties properties) {
        return new JsonLinesUnitLedger(station.ledgerFilePath(), properties.isFsyncLedger());
    }

    @Bean
    public GroupingRouter groupingRouter(StationConfig station, FilenameClassifier classifier, Clock clock) {
        StationConfig.GroupingSettings grouping = station.getGrouping();
        return new GroupingRouter(grouping.getPairingTolerance(), grouping.getPairingPolicy(),
                grouping.getMaxIncompleteAge(), classifier, clock);
    }

    @Bean
    public CalibrationRegistry calibrationRegistry() {
        return new CalibrationRegistry();
    }

    @Bean
    public CalibrationArtifactStore calibrationArtifactStore(StationConfig station) {
        return new CalibrationArtifactStore(station.calibrationDirPath());
    }

    @Bean
    public CalibrationFitter calibrationFitter(StationConfig station) {
        return new DifferentialAbsorptionFitter(station.getCalibration());
    }

    @Bean
    public CalibrationPipeline calibrationPipeline(StationConfig station, CalibrationFitter fitter,
                                                   CalibrationArtifactStore store, Clock clock) {
        StationConfig.CalibrationSettings calibration = station.getCalibration();
        return new DoasCalibrationPipeline(new NpySpectrumReader(calibration.getReadAttempts()), fitter, store,
                calibration.getValidity(), clock);
    }

    @Bean
    public EmissionSeriesWriter emissionSeriesWriter(StationConfig station, ApplicationArguments arguments) {
        List<String> override = arguments.getOptionValues(CommandLineArgs.OUTPUT_DIRECTORY);
        Path dir = override != null && !override.isEmpty() && !override.get(0).isBlank()
                ? Path.of(override.get(0))
                : station.emissionDirPath();
        return new EmissionSeriesWriter(dir, station.zoneId());
    }

    @Bean
    public EmissionRatePipeline emissionRatePipeline(StationConfig station, EmissionSeriesWriter writer, Clock clock) {
        StationConfig.EmissionSettings emission = station.getEmission();
        return new PlumeEmissionRatePipeline(
                new ImageIntensityReader(emission.getRoiTopRow(), emission.getRoiBottomRow()),
                new FluxCalculator(emission), writer, emission.getFlowMode(), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineWorkers(StationConfig station) {
        AtomicInteger seq = new AtomicInteger();
        return MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(station.getWorkers(), r -> {
            Thread t = new Thread(r, "pipeline-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }));
    }

    @Bean
    public JobOrchestrator jobOrchestrator(StationConfig station, UnitLedger ledger, CalibrationPipeline calibration,
                                           EmissionRatePipeline emission, CalibrationRegistry registry,
                                           ExecutorService pipelineWorkers, Clock clock) {
        FileArchiver archiver = new FileArchiver(station.watchRootPath(), station.archiveDirPath(),
                station.getGrouping().isMoveArchivedFiles());
        return new JobOrchestrator(ledger, calibration, emission, registry, archiver,
                RetryPolicy.from(station.getRetry()), pipelineWorkers, station.getWorkers(), clock);
    }

    @Bean
    public BatchInputScanner batchInputScanner(FilenameClassifier classifier, UnitLedger ledger, StationConfig station) {
        return new BatchInputScanner(classifier, ledger, station.getFiles().getLockSuffix());
    }

    @Bean
    @Lazy
    public DoasBatchCommand doasBatchCommand(BatchInputScanner scanner, JobOrchestrator orchestrator,
                                             UnitLedger ledger, StationConfig station,
                                             PipelineProperties properties) {
        return new DoasBatchCommand(scanner, orchestrator, ledger, station, properties);
    }

    @Bean
    @Lazy
    public PyplisBatchCommand pyplisBatchCommand(BatchInputScanner scanner, GroupingRouter router,
                                                 JobOrchestrator orchestrator, CalibrationArtifactStore store,
                                                 CalibrationRegistry registry, StationConfig station,
                                                 PipelineProperties properties) {
        return new PyplisBatchCommand(scanner, router, orchestrator, store, registry, station, properties);
    }

    @Bean
    @Lazy
    public WatcherService watcherService(StationConfig station, FilenameClassifier classifier, GroupingRouter router,
                                         JobOrchestrator orchestrator, UnitLedger ledger,
                                         ExecutorService pipelineWorkers, CalibrationRegistry registry,
                                         CalibrationArtifactStore store, PipelineProperties properties, Clock clock) {
        registry.publishAll(store.loadAll());
        DirectoryObserver observer = new DirectoryObserver(station.watchRootPath(), classifier,
                station.getObserver().getQuiescence(), station.getFiles().getLockSuffix(), clock);
        WatcherLoop loop = new WatcherLoop(observer, router, orchestrator, ledger, clock);
        return new WatcherService(loop, orchestrator, router, ledger, pipelineWorkers, station, properties);
    }

    @Bean
    public PipelineCommandRunner pipelineCommandRunner(PipelineCommand command, ApplicationArguments arguments,
                                                       ObjectProvider<DoasBatchCommand> doas,
                                                       ObjectProvider<PyplisBatchCommand> pyplis,
                                                       ObjectProvider<WatcherService> watcher) {
        return new PipelineCommandRunner(command, arguments, doas, pyplis, watcher);
    }
}
