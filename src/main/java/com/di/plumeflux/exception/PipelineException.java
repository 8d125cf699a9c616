package com.di.plumeflux.exception;

/**
 * Base type for every per-unit and startup error raised by the pipeline.
 * <p>
 * Subclasses map one-to-one onto an {@link com.di.plumeflux.aspect.ErrorCategory}, which decides
 * whether a unit is retried, failed, deferred or archived.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
