package com.di.plumeflux.calibration;

import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.exception.CalibrationFitException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DifferentialAbsorptionFitter Tests")
class DifferentialAbsorptionFitterTest {

    private static Spectrum spectrum(String name, double... intensities) {
        double[] wl = new double[intensities.length];
        for (int i = 0; i < wl.length; i++) {
            wl[i] = 310.0 + i;
        }
        return new Spectrum(Path.of(name), Instant.parse("2024-06-01T12:00:00Z"), wl, intensities);
    }

    private static DifferentialAbsorptionFitter fitter(int minSpectra) {
        StationConfig.CalibrationSettings settings = new StationConfig.CalibrationSettings();
        settings.setMinSpectra(minSpectra);
        return new DifferentialAbsorptionFitter(settings);
    }

    @Test
    @DisplayName("Slope is column density per unit optical depth")
    void testFit() {
        CalibrationCurve curve = fitter(1).fit(List.of(
                spectrum("a.npy", 1000, 800, 900, 1000),
                spectrum("b.npy", 1000, 600, 700, 1000)));

        assertEquals(1.0 / 5.0e-19, curve.getSlope(), 1e6);
        assertEquals(0.0, curve.getIntercept());
        assertEquals(2, curve.getPoints().size());
        assertEquals(Math.log(1000.0 / 600.0), curve.getPoints().get(1).getOpticalDepth(), 1e-12);
        assertEquals(2.0e18, curve.columnDensity(1.0), 1e6);
    }

    @Test
    @DisplayName("Too few usable spectra fail the fit")
    void testTooFewSpectra() {
        assertThrows(CalibrationFitException.class, () -> fitter(2).fit(List.of(spectrum("a.npy", 1000, 800, 900))));
        assertThrows(CalibrationFitException.class, () -> fitter(1).fit(List.of()));
    }

    @Test
    @DisplayName("Flat, short or non-positive windows are unusable")
    void testUnusable() {
        DifferentialAbsorptionFitter fitter = fitter(1);
        assertTrue(Double.isNaN(fitter.opticalDepth(spectrum("short.npy", 1000, 900))));
        assertTrue(Double.isNaN(fitter.opticalDepth(spectrum("neg.npy", 1000, -1, 900))));
        assertEquals(0.0, fitter.opticalDepth(spectrum("flat.npy", 500, 500, 500)));
        assertThrows(CalibrationFitException.class, () -> fitter.fit(List.of(spectrum("flat.npy", 500, 500, 500))));
    }
}
