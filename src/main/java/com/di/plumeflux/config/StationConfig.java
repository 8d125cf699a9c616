package com.di.plumeflux.config;

import com.di.plumeflux.grouping.PairingPolicy;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Station configuration read from the YAML file given with {@code --config_path}.
 * <p>
 * Relative paths are resolved against the directory holding the config file. Durations accept
 * ISO-8601 ({@code PT5S}) or plain seconds.
 *
 * <pre>
 * watch-root: /mnt/station/data
 * calibration-dir: ./out/doas
 * emission-dir: ./out/emission
 * ledger-file: ./out/ledger.jsonl
 * grouping:
 *   pairing-tolerance: PT2S
 *   max-incomplete-age: PT10M
 * retry:
 *   max-attempts: 3
 * </pre>
 */
@Data
public class StationConfig {

    private String stationName = "station";

    private String watchRoot;
    private String calibrationDir;
    private String emissionDir;
    /** Where orphaned and incomplete files go when {@code grouping.move-archived-files} is on. */
    private String archiveDir;
    /** Defaults to {@code ledger.jsonl} inside the calibration directory's parent. */
    private String ledgerFile;
    /** Batch {@code doas} input; falls back to {@link #watchRoot}. */
    private String spectraDir;
    /** Batch {@code pyplis} input; falls back to {@link #watchRoot}. */
    private String imageDir;

    /** Zone of the local timestamps in acquisition filenames. */
    private String timezone = "UTC";

    /** Worker threads shared by the calibration and emission pipelines. */
    private int workers = 2;

    private FileNaming files = new FileNaming();
    private ObserverSettings observer = new ObserverSettings();
    private GroupingSettings grouping = new GroupingSettings();
    private RetrySettings retry = new RetrySettings();
    private CalibrationSettings calibration = new CalibrationSettings();
    private EmissionSettings emission = new EmissionSettings();

    @JsonIgnore
    private Path baseDir = Path.of(".");

    public Path resolvePath(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Path p = Path.of(value.trim());
        return p.isAbsolute() ? p.normalize() : baseDir.resolve(p).normalize();
    }

    public Path watchRootPath() {
        return resolvePath(watchRoot);
    }

    public Path calibrationDirPath() {
        return resolvePath(calibrationDir);
    }

    public Path emissionDirPath() {
        return resolvePath(emissionDir);
    }

    public Path archiveDirPath() {
        return resolvePath(archiveDir);
    }

    public Path spectraDirPath() {
        return spectraDir != null && !spectraDir.isBlank() ? resolvePath(spectraDir) : watchRootPath();
    }

    public Path imageDirPath() {
        return imageDir != null && !imageDir.isBlank() ? resolvePath(imageDir) : watchRootPath();
    }

    public Path ledgerFilePath() {
        if (ledgerFile != null && !ledgerFile.isBlank()) {
            return resolvePath(ledgerFile);
        }
        Path cal = calibrationDirPath();
        Path parent = cal != null && cal.getParent() != null ? cal.getParent() : baseDir;
        return parent.resolve("ledger.jsonl");
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    /** Filename conventions. Patterns must define a {@code ts} group; image patterns also a {@code band} group. */
    @Data
    public static class FileNaming {
        private List<String> scanPatterns = new ArrayList<>(List.of(
                "^scan_(?<ts>\\d{8}_\\d{4}(?:\\d{2})?)(?:_.*)?\\.npy$",
                "^(?<ts>\\d{4}-\\d{2}-\\d{2}T\\d{6})_.*\\.npy$"));
        private List<String> imagePatterns = new ArrayList<>(List.of(
                "^img_(?<band>[A-Za-z]+)_(?<ts>\\d{8}_\\d{4}(?:\\d{2})?)(?:_.*)?\\.png$",
                "^(?<ts>\\d{4}-\\d{2}-\\d{2}T\\d{6})_(?<band>fltr[A-Za-z]+)_.*\\.png$"));
        private List<String> scanExtensions = new ArrayList<>(List.of(".npy"));
        private List<String> imageExtensions = new ArrayList<>(List.of(".png"));
        /** Tried in order, first that parses wins. */
        private List<String> timestampFormats = new ArrayList<>(List.of(
                "yyyyMMdd_HHmmss",
                "yyyyMMdd_HHmm",
                "yyyy-MM-dd'T'HHmmss"));
        private Map<String, List<String>> bandTags = new LinkedHashMap<>(Map.of(
                "on", List.of("on", "fltrA"),
                "off", List.of("off", "fltrB")));
        /** Non-measurement acquisitions (darks, test frames) that never enter a unit. */
        private List<String> skipTokens = new ArrayList<>(List.of("Dark", "Test"));
        private String lockSuffix = ".lock";
    }

    @Data
    public static class ObserverSettings {
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration quiescence = Duration.ofSeconds(3);
    }

    @Data
    public static class GroupingSettings {
        private Duration pairingTolerance = Duration.ofSeconds(2);
        private PairingPolicy pairingPolicy = PairingPolicy.CLOSEST;
        private Duration maxIncompleteAge = Duration.ofMinutes(10);
        private boolean moveArchivedFiles = false;
    }

    @Data
    public static class RetrySettings {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofMinutes(1);
        private double multiplier = 2.0;
    }

    @Data
    public static class CalibrationSettings {
        /** Validity of an artifact past its last scan. */
        private Duration validity = Duration.ofHours(1);
        private double fitWindowMinNm = 310.0;
        private double fitWindowMaxNm = 320.0;
        private int minSpectra = 1;
        /** Effective SO2 absorption cross section in the fit window (cm^2/molecule). */
        private double crossSection = 5.0e-19;
        /** Re-reads of a locked spectrum before the read counts as a transient failure. */
        private int readAttempts = 3;
    }

    @Data
    public static class EmissionSettings {
        /** Length of the plume cross-section line in metres; null means not configured. */
        private Double pcsLineLengthM;
        /** Plume speed in m/s; null means no wind data. */
        private Double plumeSpeedMs;
        private double plumeSpeedErrorMs = 0.0;
        /** SO2 molar mass in kg/mol. */
        private double molarMassKgPerMol = 0.064066;
        private Integer roiTopRow;
        private Integer roiBottomRow;
        private String flowMode = "flow_glob";
    }
}
