package com.di.plumeflux.calibration;

import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/** One spectrometer scan: wavelengths in nm and the matching intensities. */
@Value
public class Spectrum {
    Path source;
    Instant acquiredAt;
    double[] wavelengths;
    double[] intensities;

    public int length() {
        return wavelengths.length;
    }
}
