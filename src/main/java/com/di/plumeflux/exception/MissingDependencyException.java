package com.di.plumeflux.exception;

import java.time.Instant;

/**
 * No calibration artifact covers the acquisition time of an image pair yet. The unit is deferred,
 * not failed.
 */
public class MissingDependencyException extends PipelineException {

    private final Instant acquiredAt;

    public MissingDependencyException(Instant acquiredAt) {
        super("No calibration covers " + acquiredAt);
        this.acquiredAt = acquiredAt;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }
}
