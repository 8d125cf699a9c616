package com.di.plumeflux.exception;

/**
 * File locked, still being written or temporarily unreadable. The orchestrator retries the unit
 * with capped exponential backoff.
 */
public class TransientIoException extends PipelineException {

    public TransientIoException(String message) {
        super(message);
    }

    public TransientIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
