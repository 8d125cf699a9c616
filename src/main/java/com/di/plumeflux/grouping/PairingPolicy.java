package com.di.plumeflux.grouping;

/** How an image picks its partner when several opposite-band images are within tolerance. */
public enum PairingPolicy {
    /** Smallest timestamp difference; ties go to the earlier acquisition. */
    CLOSEST,
    /** The partner that arrived first, regardless of timestamp distance. */
    FIRST_ARRIVAL
}
