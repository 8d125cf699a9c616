package com.di.plumeflux.exception;

/**
 * The DOAS fit did not converge or too few usable reference spectra were available.
 */
public class CalibrationFitException extends PipelineException {

    public CalibrationFitException(String message) {
        super(message);
    }
}
