package com.di.plumeflux.observer;

/** Detected type of an acquisition file. */
public enum FileKind {
    SCAN,
    IMAGE_ON,
    IMAGE_OFF;

    public boolean isImage() {
        return this != SCAN;
    }

    public FileKind partnerBand() {
        switch (this) {
            case IMAGE_ON:
                return IMAGE_OFF;
            case IMAGE_OFF:
                return IMAGE_ON;
            default:
                throw new IllegalStateException("Scans have no partner band");
        }
    }
}
