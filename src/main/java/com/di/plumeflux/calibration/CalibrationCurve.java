package com.di.plumeflux.calibration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear map from apparent absorbance to column density: {@code cd = slope * tau + intercept}
 * (molecules/cm^2).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationCurve {
    private double slope;
    private double intercept;
    private double slopeStdErr;
    private String method;
    @Builder.Default
    private List<CurvePoint> points = new ArrayList<>();

    public double columnDensity(double apparentAbsorbance) {
        return slope * apparentAbsorbance + intercept;
    }

    /** Relative slope uncertainty, 0 when the slope is exactly determined. */
    public double relativeError() {
        return slope == 0 ? 0 : Math.abs(slopeStdErr / slope);
    }
}
