package com.di.plumeflux.cli;

import com.di.plumeflux.exception.ConfigurationException;
import com.di.plumeflux.ledger.UnitLedger;
import com.di.plumeflux.observer.FileKind;
import com.di.plumeflux.observer.FilenameClassifier;
import com.di.plumeflux.observer.LockFiles;
import com.di.plumeflux.observer.RawFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists already-complete acquisition files for the batch commands, oldest first. There is no
 * stability wait; files with a lock sibling are still skipped.
 */
@Slf4j
@RequiredArgsConstructor
public class BatchInputScanner {

    private final FilenameClassifier classifier;
    private final UnitLedger ledger;
    private final String lockSuffix;

    public List<RawFile> scan(Path dir, Predicate<FileKind> kinds, boolean includeConsumed) {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.filter(Files::isRegularFile).filter(classifier::isCandidate).sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list input directory " + dir + ": " + e.getMessage(), e);
        }
        List<RawFile> files = new ArrayList<>();
        int consumed = 0;
        for (Path path : paths) {
            if (LockFiles.isLocked(path, lockSuffix)) {
                log.warn("[BATCH] {} is locked, skipped", path.getFileName());
                continue;
            }
            if (!includeConsumed && ledger.isFileConsumed(path)) {
                consumed++;
                continue;
            }
            Optional<RawFile> file = classify(path);
            file.filter(f -> kinds.test(f.getKind())).ifPresent(files::add);
        }
        files.sort(Comparator.comparing(RawFile::getAcquiredAt).thenComparing(RawFile::getKind));
        log.info("[BATCH] {} input files in {} ({} already handled)", files.size(), dir, consumed);
        return files;
    }

    private Optional<RawFile> classify(Path path) {
        try {
            return classifier.classify(path);
        } catch (IOException e) {
            log.warn("[BATCH] cannot stat {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
