package com.di.plumeflux.emission;

import com.di.plumeflux.exception.TransientIoException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Persists measurements: one JSON file per unit ({@code units/emission_<unit token>.json}) and a
 * row in the daily series {@code <yyyyMMdd>_EmissionRates_<flow mode>.csv}. Days follow the
 * station zone. The series holds one row per unit key; a re-run replaces the unit's row.
 */
@Slf4j
public class EmissionSeriesWriter {

    static final String HEADER = "datetime,flux_(kg/s),flux_err,velo_eff_(m/s),velo_eff_err,ICA_mass_(kg/m),"
            + "column_density_(molec/cm2),apparent_absorbance,calibration_id,unit_key";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;
    private final DateTimeFormatter dayFormat;
    private final DateTimeFormatter rowTimeFormat;

    public EmissionSeriesWriter(Path directory, ZoneId zone) {
        this.directory = directory;
        this.dayFormat = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(zone);
        this.rowTimeFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(zone);
    }

    /** Writes both outputs and returns the JSON file. */
    public synchronized Path write(EmissionMeasurement m, String fileToken) {
        Path json = directory.resolve("units").resolve("emission_" + fileToken + ".json");
        Path series = seriesFile(m);
        try {
            Files.createDirectories(json.getParent());
            Path tmp = Files.createTempFile(json.getParent(), "emission_", ".tmp");
            MAPPER.writeValue(tmp.toFile(), m);
            replace(tmp, json);
            upsertRow(series, m);
        } catch (IOException e) {
            throw new TransientIoException("Cannot write emission output for " + m.getUnitKey(), e);
        }
        log.debug("[EMISSION] {} -> {} and {}", m.getUnitKey(), json.getFileName(), series.getFileName());
        return json;
    }

    Path seriesFile(EmissionMeasurement m) {
        return directory.resolve(dayFormat.format(m.getAcquiredAt()) + "_EmissionRates_" + m.getFlowMode() + ".csv");
    }

    private void upsertRow(Path series, EmissionMeasurement m) throws IOException {
        List<String> rows = new ArrayList<>();
        if (Files.exists(series)) {
            rows.addAll(Files.readAllLines(series, StandardCharsets.UTF_8));
        }
        if (rows.isEmpty()) {
            rows.add(HEADER);
        }
        String row = format(m);
        String keySuffix = "," + m.getUnitKey();
        boolean replaced = false;
        for (int i = 1; i < rows.size(); i++) {
            if (rows.get(i).endsWith(keySuffix)) {
                rows.set(i, row);
                replaced = true;
                break;
            }
        }
        if (replaced) {
            log.info("[EMISSION] replaced series row for {} in {}", m.getUnitKey(), series.getFileName());
        } else {
            rows.add(row);
        }

        Path tmp = Files.createTempFile(directory, "series_", ".tmp");
        Files.write(tmp, rows, StandardCharsets.UTF_8);
        replace(tmp, series);
    }

    private String format(EmissionMeasurement m) {
        return String.format(Locale.ROOT, "%s,%.6e,%.6e,%.3f,%.3f,%.6e,%.6e,%.6f,%s,%s",
                rowTimeFormat.format(m.getAcquiredAt()),
                m.getFluxKgPerS(), m.getFluxErrKgPerS(),
                m.getPlumeSpeedMs(), m.getPlumeSpeedErrMs(),
                m.getIcaKgPerM(),
                m.getColumnDensity(), m.getApparentAbsorbance(),
                m.getCalibrationId(), m.getUnitKey());
    }

    private static void replace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
