package com.di.plumeflux.observer;

import com.di.plumeflux.config.StationConfig;
import com.di.plumeflux.util.AcquisitionTimeParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies acquisition files by name.
 * <ul>
 *   <li>Unknown extension: ignored silently.</li>
 *   <li>Known extension carrying a skip token (darks, test frames): ignored at debug level.</li>
 *   <li>Known extension but no pattern, unparseable timestamp or unknown band tag: warned as
 *       naming drift and ignored.</li>
 * </ul>
 */
@Slf4j
public class FilenameClassifier {

    private final List<Pattern> scanPatterns;
    private final List<Pattern> imagePatterns;
    private final List<String> scanExtensions;
    private final List<String> imageExtensions;
    private final List<String> skipTokens;
    private final Map<String, FileKind> bandByTag;
    private final AcquisitionTimeParser timeParser;

    public FilenameClassifier(StationConfig.FileNaming naming, ZoneId zone) {
        this.scanPatterns = compile(naming.getScanPatterns());
        this.imagePatterns = compile(naming.getImagePatterns());
        this.scanExtensions = lower(naming.getScanExtensions());
        this.imageExtensions = lower(naming.getImageExtensions());
        this.skipTokens = List.copyOf(naming.getSkipTokens());
        this.bandByTag = new java.util.HashMap<>();
        naming.getBandTags().getOrDefault("on", List.of())
                .forEach(tag -> bandByTag.put(tag.toLowerCase(Locale.ROOT), FileKind.IMAGE_ON));
        naming.getBandTags().getOrDefault("off", List.of())
                .forEach(tag -> bandByTag.put(tag.toLowerCase(Locale.ROOT), FileKind.IMAGE_OFF));
        this.timeParser = new AcquisitionTimeParser(naming.getTimestampFormats(), zone);
    }

    /** True when the extension is one the station produces; only such files are tracked for stability. */
    public boolean isCandidate(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return scanExtensions.stream().anyMatch(name::endsWith) || imageExtensions.stream().anyMatch(name::endsWith);
    }

    public Optional<RawFile> classify(Path path, long size, Instant lastModified) {
        if (!isCandidate(path)) {
            return Optional.empty();
        }
        String name = path.getFileName().toString();
        for (String token : skipTokens) {
            if (name.contains(token)) {
                log.debug("[CLASSIFY] skipping {} (token '{}')", name, token);
                return Optional.empty();
            }
        }

        boolean scanExt = scanExtensions.stream().anyMatch(name.toLowerCase(Locale.ROOT)::endsWith);
        List<Pattern> patterns = scanExt ? scanPatterns : imagePatterns;
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(name);
            if (!m.matches()) {
                continue;
            }
            Optional<Instant> acquiredAt = timeParser.parse(m.group("ts"));
            if (acquiredAt.isEmpty()) {
                log.warn("[CLASSIFY] naming drift: '{}' matched {} but timestamp '{}' fits none of {}",
                        name, pattern.pattern(), m.group("ts"), timeParser.getPatterns());
                return Optional.empty();
            }
            FileKind kind = FileKind.SCAN;
            if (!scanExt) {
                kind = bandByTag.get(m.group("band").toLowerCase(Locale.ROOT));
                if (kind == null) {
                    log.warn("[CLASSIFY] naming drift: '{}' has unknown band tag '{}'", name, m.group("band"));
                    return Optional.empty();
                }
            }
            return Optional.of(RawFile.builder()
                    .path(path)
                    .kind(kind)
                    .acquiredAt(acquiredAt.get())
                    .size(size)
                    .lastModified(lastModified)
                    .build());
        }
        log.warn("[CLASSIFY] naming drift: '{}' has a recognized extension but matches no pattern", name);
        return Optional.empty();
    }

    /** Classifies a file on disk without any stability check; for batch commands and re-runs. */
    public Optional<RawFile> classify(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return classify(path, attrs.size(), attrs.lastModifiedTime().toInstant());
    }

    private static List<Pattern> compile(List<String> patterns) {
        return patterns.stream().map(Pattern::compile).collect(Collectors.toList());
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
    }
}
