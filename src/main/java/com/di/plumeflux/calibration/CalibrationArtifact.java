package com.di.plumeflux.calibration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A published calibration: curve plus the half-open window {@code [validFrom, validTo)} it covers.
 * Artifacts are never deleted; a newer overlapping one takes precedence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationArtifact {
    /** Unit key of the scans it came from. */
    private String id;
    private Instant validFrom;
    private Instant validTo;
    private Instant createdAt;
    @Builder.Default
    private List<String> sourceFiles = new ArrayList<>();
    private CalibrationCurve curve;
    /** Where the artifact was written; set by the store. */
    private String path;

    @JsonIgnore
    public boolean covers(Instant t) {
        return !t.isBefore(validFrom) && t.isBefore(validTo);
    }
}
