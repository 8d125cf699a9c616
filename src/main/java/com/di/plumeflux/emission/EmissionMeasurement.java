package com.di.plumeflux.emission;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** SO2 emission rate for one image pair, tied to the calibration used to compute it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmissionMeasurement {
    private String unitKey;
    private Instant acquiredAt;
    private double fluxKgPerS;
    private double fluxErrKgPerS;
    private double plumeSpeedMs;
    private double plumeSpeedErrMs;
    /** Integrated column amount along the cross-section, kg/m. */
    private double icaKgPerM;
    /** Mean column density along the cross-section, molecules/cm^2. */
    private double columnDensity;
    private double apparentAbsorbance;
    private String calibrationId;
    private String onImage;
    private String offImage;
    private String flowMode;
    private Instant computedAt;
}
