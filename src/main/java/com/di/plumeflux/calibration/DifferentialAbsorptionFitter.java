package com.di.plumeflux.calibration;

import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.exception.CalibrationFitException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Default fitter. For each scan the differential optical depth in the fit window is
 * {@code ln(I_max / I_min)}; the column density follows from the effective cross section. The
 * curve slope is the mean column density per unit optical depth over all usable scans, with its
 * standard error as uncertainty.
 */
@Slf4j
public class DifferentialAbsorptionFitter implements CalibrationFitter {

    static final String METHOD = "differential-absorption";
    private static final int MIN_WINDOW_POINTS = 3;

    private final double windowMinNm;
    private final double windowMaxNm;
    private final double crossSection;
    private final int minSpectra;

    public DifferentialAbsorptionFitter(StationConfig.CalibrationSettings settings) {
        this.windowMinNm = settings.getFitWindowMinNm();
        this.windowMaxNm = settings.getFitWindowMaxNm();
        this.crossSection = settings.getCrossSection();
        this.minSpectra = settings.getMinSpectra();
    }

    @Override
    public CalibrationCurve fit(List<Spectrum> spectra) {
        List<CurvePoint> points = new ArrayList<>();
        for (Spectrum spectrum : spectra) {
            double tau = opticalDepth(spectrum);
            if (Double.isNaN(tau) || tau <= 0) {
                log.debug("[DOAS] {} unusable in {}-{} nm", spectrum.getSource().getFileName(), windowMinNm, windowMaxNm);
                continue;
            }
            points.add(new CurvePoint(spectrum.getAcquiredAt(), spectrum.getSource().getFileName().toString(),
                    tau, tau / crossSection));
        }
        if (points.size() < minSpectra || points.isEmpty()) {
            throw new CalibrationFitException(String.format("%d of %d spectra usable, at least %d required",
                    points.size(), spectra.size(), Math.max(1, minSpectra)));
        }

        double sum = 0;
        for (CurvePoint p : points) {
            sum += p.getColumnDensity() / p.getOpticalDepth();
        }
        double slope = sum / points.size();
        double variance = 0;
        for (CurvePoint p : points) {
            double d = p.getColumnDensity() / p.getOpticalDepth() - slope;
            variance += d * d;
        }
        double stdErr = points.size() > 1 ? Math.sqrt(variance / (points.size() - 1)) / Math.sqrt(points.size()) : 0;

        if (!Double.isFinite(slope) || slope <= 0 || !Double.isFinite(stdErr)) {
            throw new CalibrationFitException("Fit did not converge: slope=" + slope + ", stdErr=" + stdErr);
        }
        return CalibrationCurve.builder()
                .slope(slope)
                .intercept(0)
                .slopeStdErr(stdErr)
                .method(METHOD)
                .points(points)
                .build();
    }

    /** NaN when the window holds too few points or a non-positive intensity. */
    double opticalDepth(Spectrum spectrum) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int count = 0;
        for (int i = 0; i < spectrum.length(); i++) {
            double wl = spectrum.getWavelengths()[i];
            if (wl < windowMinNm || wl > windowMaxNm) {
                continue;
            }
            double intensity = spectrum.getIntensities()[i];
            if (!(intensity > 0)) {
                return Double.NaN;
            }
            min = Math.min(min, intensity);
            max = Math.max(max, intensity);
            count++;
        }
        return count < MIN_WINDOW_POINTS ? Double.NaN : Math.log(max / min);
    }
}
