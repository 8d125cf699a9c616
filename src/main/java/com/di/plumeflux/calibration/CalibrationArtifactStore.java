package com.di.plumeflux.calibration;

import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.exception.TransientIoException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes calibration artifacts as {@code doas_calibration_<unit token>.json} and reads them back.
 * Writes go to a temp file first and are moved into place, so readers never see a partial file.
 */
@Slf4j
public class CalibrationArtifactStore {

    static final String PREFIX = "doas_calibration_";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;

    public CalibrationArtifactStore(Path directory) {
        this.directory = directory;
    }

    public Path write(CalibrationArtifact artifact, String fileToken) {
        Path target = directory.resolve(PREFIX + fileToken + ".json");
        artifact.setPath(target.toString());
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, PREFIX, ".tmp");
            MAPPER.writeValue(tmp.toFile(), artifact);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TransientIoException("Cannot write calibration artifact " + target, e);
        }
        log.info("[DOAS] wrote {} valid [{}, {})", target.getFileName(), artifact.getValidFrom(), artifact.getValidTo());
        return target;
    }

    public CalibrationArtifact read(Path file) {
        try {
            CalibrationArtifact artifact = MAPPER.readValue(file.toFile(), CalibrationArtifact.class);
            if (artifact.getValidFrom() == null || artifact.getValidTo() == null || artifact.getCurve() == null) {
                throw new MalformedDataException("Incomplete calibration artifact " + file);
            }
            artifact.setPath(file.toString());
            return artifact;
        } catch (IOException e) {
            throw new MalformedDataException("Unreadable calibration artifact " + file, e);
        }
    }

    /** All artifacts in the store's directory. */
    public List<CalibrationArtifact> loadAll() {
        return loadFrom(directory);
    }

    /** Artifacts from a single file or every artifact file in a directory; unreadable files are skipped. */
    public List<CalibrationArtifact> loadFrom(Path location) {
        if (location == null || !Files.exists(location)) {
            return List.of();
        }
        if (Files.isRegularFile(location)) {
            return List.of(read(location));
        }
        List<Path> files;
        try (Stream<Path> list = Files.list(location)) {
            files = list.filter(p -> p.getFileName().toString().startsWith(PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransientIoException("Cannot list calibration artifacts in " + location, e);
        }
        List<CalibrationArtifact> artifacts = new ArrayList<>();
        for (Path file : files) {
            try {
                artifacts.add(read(file));
            } catch (MalformedDataException e) {
                log.warn("[DOAS] skipping {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return artifacts;
    }
}
