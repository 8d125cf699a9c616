package com.di.plumeflux.emission;

import com.di.plumeflux.aspect.LogUnitEvent;
import com.di.plumeflux.calibration.CalibrationArtifact;
import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.exception.MissingDependencyException;
import com.di.plumeflux.grouping.ProcessingUnit;
import com.di.plumeflux.observer.FileKind;
import com.di.plumeflux.observer.RawFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

@Slf4j
@RequiredArgsConstructor
public class PlumeEmissionRatePipeline implements EmissionRatePipeline {

    private final ImageIntensityReader reader;
    private final FluxCalculator calculator;
    private final EmissionSeriesWriter writer;
    private final String flowMode;
    private final Clock clock;

    @Override
    @LogUnitEvent(eventType = "EMISSION_RATE", stage = "emission")
    public EmissionMeasurement compute(ProcessingUnit pairUnit, CalibrationArtifact calibration) {
        RawFile on = pairUnit.member(FileKind.IMAGE_ON)
                .orElseThrow(() -> new MalformedDataException(pairUnit.getKey() + " has no on-band image"));
        RawFile off = pairUnit.member(FileKind.IMAGE_OFF)
                .orElseThrow(() -> new MalformedDataException(pairUnit.getKey() + " has no off-band image"));
        if (calibration == null || !calibration.covers(pairUnit.getAcquiredAt())) {
            throw new MissingDependencyException(pairUnit.getAcquiredAt());
        }

        FluxCalculator.Result result = calculator.compute(
                reader.meanIntensity(on.getPath()), reader.meanIntensity(off.getPath()), calibration.getCurve());

        EmissionMeasurement measurement = EmissionMeasurement.builder()
                .unitKey(pairUnit.getKey().toString())
                .acquiredAt(pairUnit.getAcquiredAt())
                .fluxKgPerS(result.getFluxKgPerS())
                .fluxErrKgPerS(result.getFluxErrKgPerS())
                .plumeSpeedMs(result.getPlumeSpeedMs())
                .plumeSpeedErrMs(result.getPlumeSpeedErrMs())
                .icaKgPerM(result.getIcaKgPerM())
                .columnDensity(result.getColumnDensity())
                .apparentAbsorbance(result.getApparentAbsorbance())
                .calibrationId(calibration.getId())
                .onImage(on.getPath().toString())
                .offImage(off.getPath().toString())
                .flowMode(flowMode)
                .computedAt(clock.instant())
                .build();
        writer.write(measurement, pairUnit.getKey().toFileToken());
        log.info("[EMISSION] {} flux={} kg/s (+/- {}) using {}", pairUnit.getKey(),
                String.format("%.4f", measurement.getFluxKgPerS()),
                String.format("%.4f", measurement.getFluxErrKgPerS()), calibration.getId());
        return measurement;
    }
}
