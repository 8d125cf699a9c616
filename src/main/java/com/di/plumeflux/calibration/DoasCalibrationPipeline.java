package com.di.plumeflux.calibration;

import com.di.plumeflux.aspect.LogUnitEvent;
import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.observer.RawFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads every scan of a unit, fits the curve and writes the artifact. The artifact covers
 * {@code [earliest scan, latest scan + validity)}.
 */
@Slf4j
@RequiredArgsConstructor
public class DoasCalibrationPipeline implements CalibrationPipeline {

    private final NpySpectrumReader reader;
    private final CalibrationFitter fitter;
    private final CalibrationArtifactStore store;
    private final Duration validity;
    private final Clock clock;

    @Override
    @LogUnitEvent(eventType = "DOAS_CALIBRATION", stage = "calibration")
    public CalibrationArtifact calibrate(ProcessingUnit scanUnit) {
        if (!scanUnit.isCalibration()) {
            throw new MalformedDataException("Not a scan unit: " + scanUnit.getKey());
        }
        List<Spectrum> spectra = scanUnit.getMembers().stream()
                .map(reader::read)
                .collect(Collectors.toList());
        CalibrationCurve curve = fitter.fit(spectra);

        CalibrationArtifact artifact = CalibrationArtifact.builder()
                .id(scanUnit.getKey().toString())
                .validFrom(scanUnit.earliest())
                .validTo(scanUnit.latest().plus(validity))
                .createdAt(clock.instant())
                .sourceFiles(scanUnit.getMembers().stream()
                        .map(RawFile::getPath).map(Object::toString).collect(Collectors.toList()))
                .curve(curve)
                .build();
        store.write(artifact, scanUnit.getKey().toFileToken());
        log.info("[DOAS] {} calibrated from {} scans, slope={}", scanUnit.getKey(), curve.getPoints().size(),
                curve.getSlope());
        return artifact;
    }
}
