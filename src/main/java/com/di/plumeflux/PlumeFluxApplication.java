package com.di.plumeflux;

import com.di.plumeflux.cli.CommandLineArgs;
import com.di.plumeflux.cli.PipelineCommandRunner;
import com.di.plumeflux.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point: {@code plumeflux <doas|pyplis|watcher> --config_path station.yml [options]}.
 * Batch commands exit when done; {@code watcher} keeps running until the process is stopped.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class PlumeFluxApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx;
        try {
            ctx = SpringApplication.run(PlumeFluxApplication.class, CommandLineArgs.normalize(args));
        } catch (RuntimeException e) {
            ConfigurationException config = findConfigurationError(e);
            if (config != null) {
                log.error("[STARTUP] configuration error: {}", config.getMessage());
                System.exit(config.getExitCode());
            }
            log.error("[STARTUP] failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        PipelineCommandRunner runner = ctx.getBean(PipelineCommandRunner.class);
        int exitCode = runner.run();
        if (!runner.isLongRunning()) {
            System.exit(SpringApplication.exit(ctx, () -> exitCode));
        }
    }

    static ConfigurationException findConfigurationError(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof ConfigurationException) {
                return (ConfigurationException) cur;
            }
            if (cur.getCause() == cur) {
                break;
            }
        }
        return null;
    }
}
