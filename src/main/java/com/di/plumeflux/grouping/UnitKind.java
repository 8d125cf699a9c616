package com.di.plumeflux.grouping;

import com.di.plumeflux.exception.MalformedDataException;

public enum UnitKind {
    /** A single spectrometer scan (watcher mode). */
    SCAN("scan", true),
    /** All scans of one validity window (batch mode). */
    SCAN_WINDOW("scanwin", true),
    /** An on-band image with its off-band partner. */
    IMAGE_PAIR("pair", false);

    private final String prefix;
    private final boolean calibration;

    UnitKind(String prefix, boolean calibration) {
        this.prefix = prefix;
        this.calibration = calibration;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isCalibration() {
        return calibration;
    }

    public static UnitKind fromPrefix(String prefix) {
        for (UnitKind kind : values()) {
            if (kind.prefix.equals(prefix)) {
                return kind;
            }
        }
        throw new MalformedDataException("Unknown unit kind prefix: " + prefix);
    }
}
