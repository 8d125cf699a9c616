package com.di.plumeflux.emission;

import com.di.plumeflux.calibration.CalibrationArtifact;
import com.di.plumeflux.grouping.ProcessingUnit;

/** Image pair plus covering calibration in, emission measurement out. */
public interface EmissionRatePipeline {

    EmissionMeasurement compute(ProcessingUnit pairUnit, CalibrationArtifact calibration);
}
