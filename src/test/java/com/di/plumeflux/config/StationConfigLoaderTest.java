package com.di.plumeflux.config;

import com.di.plumeflux.cli.PipelineCommand;
import com.di.plumeflux.exception.ConfigurationException;
import com.di.plumeflux.grouping.PairingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StationConfigLoader Tests")
class StationConfigLoaderTest {

    @TempDir
    Path dir;

    private final StationConfigLoader loader = new StationConfigLoader(Map.of("WATCH", "incoming")::get);

    private Path write(String yaml) throws IOException {
        Path file = dir.resolve("station.yml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    @DisplayName("Should read kebab-case keys, durations and resolve paths against the config directory")
    void testLoad() throws IOException {
        Path file = write(String.join("\n",
                "station-name: lascar",
                "watch-root: ${WATCH}",
                "calibration-dir: out/doas",
                "emission-dir: out/emission",
                "grouping:",
                "  pairing-tolerance: PT5S",
                "  pairing-policy: FIRST_ARRIVAL",
                "retry:",
                "  max-attempts: 4",
                "emission:",
                "  pcs-line-length-m: 1200",
                ""));

        StationConfig config = loader.load(file);

        assertEquals("lascar", config.getStationName());
        assertEquals(dir.toAbsolutePath().resolve("incoming"), config.watchRootPath());
        assertEquals(dir.toAbsolutePath().resolve("out/doas"), config.calibrationDirPath());
        assertEquals(dir.toAbsolutePath().resolve("out/ledger.jsonl"), config.ledgerFilePath());
        assertEquals(Duration.ofSeconds(5), config.getGrouping().getPairingTolerance());
        assertEquals(PairingPolicy.FIRST_ARRIVAL, config.getGrouping().getPairingPolicy());
        assertEquals(4, config.getRetry().getMaxAttempts());
        assertEquals(Double.valueOf(1200.0), config.getEmission().getPcsLineLengthM());
        assertNull(config.getEmission().getPlumeSpeedMs());
        assertEquals(Duration.ofHours(1), config.getCalibration().getValidity());
    }

    @Test
    @DisplayName("Missing file is a configuration error with exit code 2")
    void testMissingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.load(dir.resolve("nope.yml")));
        assertEquals(2, e.getExitCode());
    }

    @Test
    @DisplayName("Invalid YAML is a configuration error")
    void testInvalidYaml() throws IOException {
        Path file = write("watch-root: [unclosed\n");
        assertThrows(ConfigurationException.class, () -> loader.load(file));
    }

    @Test
    @DisplayName("Unset environment variable without default is a configuration error")
    void testUnsetVariable() {
        assertThrows(ConfigurationException.class, () -> loader.resolveEnvVars("root: ${NOT_SET_ANYWHERE}"));
        assertEquals("root: /data", loader.resolveEnvVars("root: ${NOT_SET_ANYWHERE:/data}"));
    }

    @Test
    @DisplayName("Watcher requires an existing watch root")
    void testWatcherNeedsWatchRoot() throws IOException {
        StationConfig config = loader.load(write("watch-root: missing\ncalibration-dir: out/doas\nemission-dir: out/em\n"));
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.validateFor(config, PipelineCommand.WATCHER));
        assertTrue(e.getMessage().contains("watch-root"));
    }

    @Test
    @DisplayName("Validation creates output directories")
    void testValidationCreatesOutputs() throws IOException {
        Files.createDirectories(dir.resolve("incoming"));
        StationConfig config = loader.load(write("watch-root: ${WATCH}\ncalibration-dir: out/doas\nemission-dir: out/em\n"));

        loader.validateFor(config, PipelineCommand.WATCHER);

        assertTrue(Files.isDirectory(dir.resolve("out/doas")));
        assertTrue(Files.isDirectory(dir.resolve("out/em")));
    }

    @Test
    @DisplayName("Image patterns without a band group are rejected")
    void testPatternWithoutBand() throws IOException {
        Files.createDirectories(dir.resolve("incoming"));
        StationConfig config = loader.load(write(String.join("\n",
                "watch-root: ${WATCH}",
                "calibration-dir: out/doas",
                "emission-dir: out/em",
                "files:",
                "  image-patterns: ['^img_(?<ts>\\d{8})\\.png$']",
                "")));
        assertThrows(ConfigurationException.class, () -> loader.validateFor(config, PipelineCommand.WATCHER));
    }

    @Test
    @DisplayName("Non-positive durations are rejected")
    void testNonPositiveDuration() throws IOException {
        Files.createDirectories(dir.resolve("incoming"));
        StationConfig config = loader.load(write(
                "watch-root: ${WATCH}\ncalibration-dir: out/doas\nemission-dir: out/em\nobserver:\n  quiescence: PT0S\n"));
        assertThrows(ConfigurationException.class, () -> loader.validateFor(config, PipelineCommand.WATCHER));
    }
}
