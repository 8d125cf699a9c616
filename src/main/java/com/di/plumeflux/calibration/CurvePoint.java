package com.di.plumeflux.calibration;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** One scan's contribution to a calibration curve. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurvePoint {
    private Instant acquiredAt;
    private String source;
    /** Differential optical depth in the fit window. */
    private double opticalDepth;
    /** Retrieved SO2 column density, molecules/cm^2. */
    private double columnDensity;
}
