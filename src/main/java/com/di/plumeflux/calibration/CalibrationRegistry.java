package com.di.plumeflux.calibration;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Published calibration artifacts. For a timestamp the newest artifact (by creation time) whose
 * window contains it wins; superseded artifacts stay available for audit.
 */
@Slf4j
public class CalibrationRegistry {

    private final List<CalibrationArtifact> artifacts = new CopyOnWriteArrayList<>();

    public void publish(CalibrationArtifact artifact) {
        artifacts.removeIf(a -> a.getId() != null && a.getId().equals(artifact.getId())
                && a.getCreatedAt().equals(artifact.getCreatedAt()));
        artifacts.add(artifact);
        log.info("[CALIBRATION] published {} valid [{}, {})", artifact.getId(), artifact.getValidFrom(),
                artifact.getValidTo());
    }

    public void publishAll(List<CalibrationArtifact> loaded) {
        loaded.forEach(this::publish);
    }

    public Optional<CalibrationArtifact> findCovering(Instant t) {
        return artifacts.stream()
                .filter(a -> a.covers(t))
                .max(Comparator.comparing(CalibrationArtifact::getCreatedAt)
                        .thenComparing(CalibrationArtifact::getValidFrom));
    }

    public List<CalibrationArtifact> all() {
        return new ArrayList<>(artifacts);
    }

    public int size() {
        return artifacts.size();
    }
}
