package com.di.plumeflux.calibration;

import java.util.List;

/**
 * Turns reference spectra into a calibration curve.
 *
 * @throws com.di.plumeflux.exception.CalibrationFitException when too few spectra are usable or the
 *                                                            fit does not converge
 */
public interface CalibrationFitter {

    CalibrationCurve fit(List<Spectrum> spectra);
}
