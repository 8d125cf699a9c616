package com.di.plumeflux.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Process-level settings from {@code application.yml}; station settings live in the station YAML. */
@Data
@ConfigurationProperties(prefix = "plumeflux.pipeline")
public class PipelineProperties {

    /** How long shutdown waits for running units before persisting the rest as deferred. */
    private Duration drainTimeout = Duration.ofMinutes(2);

    /** Force the ledger to disk after every entry. */
    private boolean fsyncLedger = true;
}
