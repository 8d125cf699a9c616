package com.di.plumeflux.exception;

/**
 * Plume geometry or wind data needed to turn column densities into a flux is not configured.
 */
public class FluxInputUnavailableException extends PipelineException {

    public FluxInputUnavailableException(String message) {
        super(message);
    }
}
