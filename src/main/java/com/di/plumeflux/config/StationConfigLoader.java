package com.di.plumeflux.config;

import com.di.plumeflux.cli.PipelineCommand;
import com.di.plumeflux.exception.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the station YAML named by {@code --config_path}, resolves {@code ${VAR}} /
 * {@code ${VAR:default}} placeholders from the environment and validates the result for the
 * command about to run. Every problem surfaces as a {@link ConfigurationException}.
 */
@Slf4j
@Service
public class StationConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?\\}");

    private final Function<String, String> environment;

    public StationConfigLoader() {
        this(System::getenv);
    }

    public StationConfigLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    public StationConfig load(Path configPath) {
        if (configPath == null) {
            throw new ConfigurationException("--config_path is required");
        }
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Config file not found: " + configPath);
        }
        String raw;
        try {
            raw = Files.readString(configPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Config file unreadable: " + configPath, e);
        }

        StationConfig config;
        try {
            config = YAML_MAPPER.readValue(resolveEnvVars(raw), StationConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid station config " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Station config is empty: " + configPath);
        }
        Path parent = configPath.toAbsolutePath().getParent();
        config.setBaseDir(parent != null ? parent : Path.of("."));
        log.info("[CONFIG] loaded station '{}' from {}", config.getStationName(), configPath);
        return config;
    }

    /**
     * Checks everything the given command depends on and creates the output directories.
     */
    public void validateFor(StationConfig config, PipelineCommand command) {
        requireZone(config);
        requirePatterns(config.getFiles().getScanPatterns(), "files.scan-patterns", false);
        requirePatterns(config.getFiles().getImagePatterns(), "files.image-patterns", true);
        requireTimestampFormats(config.getFiles().getTimestampFormats());
        requireBandTags(config);
        requirePositive(config.getObserver().getPollInterval(), "observer.poll-interval");
        requirePositive(config.getObserver().getQuiescence(), "observer.quiescence");
        requirePositive(config.getGrouping().getPairingTolerance(), "grouping.pairing-tolerance");
        requirePositive(config.getGrouping().getMaxIncompleteAge(), "grouping.max-incomplete-age");
        requirePositive(config.getRetry().getInitialBackoff(), "retry.initial-backoff");
        requirePositive(config.getRetry().getMaxBackoff(), "retry.max-backoff");
        requirePositive(config.getCalibration().getValidity(), "calibration.validity");
        if (config.getRetry().getMaxAttempts() < 1) {
            throw new ConfigurationException("retry.max-attempts must be >= 1");
        }
        if (config.getRetry().getMultiplier() < 1.0) {
            throw new ConfigurationException("retry.multiplier must be >= 1.0");
        }
        if (config.getWorkers() < 1) {
            throw new ConfigurationException("workers must be >= 1");
        }

        switch (command) {
            case WATCHER:
                requireReadableDir(config.watchRootPath(), "watch-root");
                break;
            case DOAS:
                requireReadableDir(config.spectraDirPath(), "spectra-dir");
                break;
            case PYPLIS:
                requireReadableDir(config.imageDirPath(), "image-dir");
                break;
            default:
                break;
        }
        requireWritableDir(config.calibrationDirPath(), "calibration-dir");
        requireWritableDir(config.emissionDirPath(), "emission-dir");
        if (config.getGrouping().isMoveArchivedFiles()) {
            requireWritableDir(config.archiveDirPath(), "archive-dir");
        }
        Path ledgerParent = config.ledgerFilePath().toAbsolutePath().getParent();
        if (ledgerParent != null) {
            requireWritableDir(ledgerParent, "ledger-file directory");
        }
    }

    String resolveEnvVars(String text) {
        Matcher m = ENV_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = environment.apply(m.group(1).trim());
            if (value == null) {
                value = m.group(2);
            }
            if (value == null) {
                throw new ConfigurationException("Environment variable not set and no default: " + m.group(1));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static void requireZone(StationConfig config) {
        try {
            config.zoneId();
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown timezone: " + config.getTimezone(), e);
        }
    }

    private static void requirePatterns(List<String> patterns, String key, boolean needsBand) {
        if (patterns == null || patterns.isEmpty()) {
            throw new ConfigurationException(key + " must list at least one pattern");
        }
        for (String p : patterns) {
            try {
                Pattern.compile(p);
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException(key + " has an invalid regex: " + p, e);
            }
            if (!p.contains("(?<ts>")) {
                throw new ConfigurationException(key + " pattern lacks a (?<ts>...) group: " + p);
            }
            if (needsBand && !p.contains("(?<band>")) {
                throw new ConfigurationException(key + " pattern lacks a (?<band>...) group: " + p);
            }
        }
    }

    private static void requireTimestampFormats(List<String> formats) {
        if (formats == null || formats.isEmpty()) {
            throw new ConfigurationException("files.timestamp-formats must not be empty");
        }
        for (String f : formats) {
            try {
                DateTimeFormatter.ofPattern(f);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid timestamp format: " + f, e);
            }
        }
    }

    private static void requireBandTags(StationConfig config) {
        var tags = config.getFiles().getBandTags();
        if (tags == null || tags.get("on") == null || tags.get("off") == null) {
            throw new ConfigurationException("files.band-tags must define both 'on' and 'off'");
        }
    }

    private static void requirePositive(Duration d, String key) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new ConfigurationException(key + " must be a positive duration");
        }
    }

    private static void requireReadableDir(Path dir, String key) {
        if (dir == null) {
            throw new ConfigurationException(key + " is required");
        }
        if (!Files.isDirectory(dir) || !Files.isReadable(dir)) {
            throw new ConfigurationException(key + " is not an accessible directory: " + dir);
        }
    }

    private static void requireWritableDir(Path dir, String key) {
        if (dir == null) {
            throw new ConfigurationException(key + " is required");
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ConfigurationException(key + " cannot be created: " + dir, e);
        }
        if (!Files.isWritable(dir)) {
            throw new ConfigurationException(key + " is not writable: " + dir);
        }
    }
}
