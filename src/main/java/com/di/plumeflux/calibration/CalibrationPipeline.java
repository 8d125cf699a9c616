package com.di.plumeflux.calibration;

import com.di.plumeflux.grouping.ProcessingUnit;

/** Scan unit in, published-ready calibration artifact out. */
public interface CalibrationPipeline {

    CalibrationArtifact calibrate(ProcessingUnit scanUnit);
}
