package com.di.plumeflux.cli;

import com.di.plumeflux.watcher.WatcherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Dispatches the parsed subcommand to its driver. */
@Slf4j
@RequiredArgsConstructor
public class PipelineCommandRunner {

    private final PipelineCommand command;
    private final ApplicationArguments arguments;
    private final ObjectProvider<DoasBatchCommand> doas;
    private final ObjectProvider<PyplisBatchCommand> pyplis;
    private final ObjectProvider<WatcherService> watcher;

    /** Exit code for batch commands; 0 once the watcher has started. */
    public int run() {
        boolean force = arguments.containsOption(CommandLineArgs.FORCE);
        log.info("[RUNNER] command={} force={}", command.getCommandName(), force);
        switch (command) {
            case DOAS:
                return doas.getObject().run(force);
            case PYPLIS:
                return pyplis.getObject().run(optionPath(CommandLineArgs.DOAS_RESULTS), force);
            case WATCHER:
                WatcherService service = watcher.getObject();
                List<String> rerun = optionValues(CommandLineArgs.RERUN);
                if (!rerun.isEmpty()) {
                    service.rerun(rerun);
                }
                service.start();
                return 0;
            default:
                throw new IllegalStateException("Unhandled command " + command);
        }
    }

    public boolean isLongRunning() {
        return command.isLongRunning();
    }

    private Path optionPath(String name) {
        List<String> values = arguments.getOptionValues(name);
        return values == null || values.isEmpty() || values.get(0).isBlank() ? null : Path.of(values.get(0));
    }

    private List<String> optionValues(String name) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toList());
    }
}
