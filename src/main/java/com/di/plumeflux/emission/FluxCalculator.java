package com.di.plumeflux.emission;

import com.di.plumeflux.calibration.CalibrationCurve;
import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.exception.FluxInputUnavailableException;
import com.di.plumeflux.exception.MalformedDataException;
import lombok.Value;

/**
 * Emission rate from apparent absorbance:
 * <pre>
 * tau  = ln(I_off / I_on)
 * cd   = curve(tau)                               molecules/cm^2
 * ica  = cd * 1e4 * pcsLength * molarMass / N_A   kg/m
 * flux = ica * plumeSpeed                         kg/s
 * </pre>
 * The flux error combines the curve's relative slope error with the relative speed error.
 */
public class FluxCalculator {

    static final double AVOGADRO = 6.02214076e23;
    private static final double CM2_PER_M2 = 1.0e4;

    private final StationConfig.EmissionSettings settings;

    public FluxCalculator(StationConfig.EmissionSettings settings) {
        this.settings = settings;
    }

    public Result compute(double onIntensity, double offIntensity, CalibrationCurve curve) {
        Double pcsLength = settings.getPcsLineLengthM();
        Double speed = settings.getPlumeSpeedMs();
        if (pcsLength == null || pcsLength <= 0) {
            throw new FluxInputUnavailableException("No plume cross-section length configured (emission.pcs-line-length-m)");
        }
        if (speed == null || speed <= 0) {
            throw new FluxInputUnavailableException("No plume speed available (emission.plume-speed-ms)");
        }
        if (!(onIntensity > 0) || !(offIntensity > 0)) {
            throw new MalformedDataException("Non-positive image intensity: on=" + onIntensity + ", off=" + offIntensity);
        }

        double tau = Math.log(offIntensity / onIntensity);
        double columnDensity = curve.columnDensity(tau);
        double integratedAmount = columnDensity * CM2_PER_M2 * pcsLength * settings.getMolarMassKgPerMol() / AVOGADRO;
        double flux = integratedAmount * speed;

        double relSpeedErr = settings.getPlumeSpeedErrorMs() / speed;
        double relErr = Math.sqrt(Math.pow(curve.relativeError(), 2) + relSpeedErr * relSpeedErr);
        return new Result(tau, columnDensity, integratedAmount, flux, Math.abs(flux) * relErr, speed,
                settings.getPlumeSpeedErrorMs());
    }

    @Value
    public static class Result {
        double apparentAbsorbance;
        double columnDensity;
        /** Integrated column amount along the cross-section. */
        double icaKgPerM;
        double fluxKgPerS;
        double fluxErrKgPerS;
        double plumeSpeedMs;
        double plumeSpeedErrMs;
    }
}
