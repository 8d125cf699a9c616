package com.di.plumeflux.observer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Polls the watch root recursively and emits files once they stop changing.
 * <p>
 * A file is emitted when two polls at least {@code quiescence} apart see the same size and
 * modification time, no sibling lock file exists and the size is non-zero. The first poll is a
 * full scan, so files that were already on disk at startup are seeded like any other. A file is
 * emitted again only if its size or mtime changes afterwards.
 * <p>
 * Not thread-safe; owned by the coordinating loop.
 */
@Slf4j
public class DirectoryObserver {

    private final Path root;
    private final FilenameClassifier classifier;
    private final Duration quiescence;
    private final String lockSuffix;
    private final Clock clock;

    private final Map<Path, Snapshot> candidates = new HashMap<>();
    private final Map<Path, Snapshot> emitted = new HashMap<>();
    private boolean initialScanDone;

    public DirectoryObserver(Path root, FilenameClassifier classifier, Duration quiescence,
                             String lockSuffix, Clock clock) {
        this.root = root;
        this.classifier = classifier;
        this.quiescence = quiescence;
        this.lockSuffix = lockSuffix;
        this.clock = clock;
    }

    /**
     * One polling pass. Returns files that became stable since the previous pass, in acquisition order.
     */
    public List<RawFile> poll() {
        Instant now = clock.instant();
        List<Path> present = listCandidates();
        if (!initialScanDone) {
            log.info("[OBSERVER] initial scan of {} found {} candidate files", root, present.size());
            initialScanDone = true;
        }

        Set<Path> seen = new HashSet<>(present);
        candidates.keySet().retainAll(seen);
        emitted.keySet().retainAll(seen);

        List<RawFile> stable = new ArrayList<>();
        for (Path path : present) {
            Snapshot current = snapshot(path, now);
            if (current == null) {
                candidates.remove(path);
                continue;
            }
            if (LockFiles.isLocked(path, lockSuffix) || current.size == 0) {
                candidates.remove(path);
                continue;
            }
            Snapshot previous = candidates.get(path);
            if (previous == null || !previous.sameContent(current)) {
                candidates.put(path, current);
                continue;
            }
            if (Duration.between(previous.firstSeen, now).compareTo(quiescence) < 0) {
                continue;
            }
            Snapshot last = emitted.get(path);
            if (last != null && last.sameContent(current)) {
                continue;
            }
            emitted.put(path, current);
            Optional<RawFile> classified = classifier.classify(path, current.size, current.lastModified);
            classified.ifPresent(stable::add);
        }

        stable.sort((a, b) -> a.getAcquiredAt().compareTo(b.getAcquiredAt()));
        if (!stable.isEmpty()) {
            log.debug("[OBSERVER] {} stable files this poll", stable.size());
        }
        return stable;
    }

    private List<Path> listCandidates() {
        if (!Files.isDirectory(root)) {
            log.warn("[OBSERVER] watch root {} is not accessible", root);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(classifier::isCandidate)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            // a directory vanished mid-walk; the next poll sees the settled tree
            log.warn("[OBSERVER] scan of {} interrupted: {}", root, e.getMessage());
            return new ArrayList<>(candidates.keySet());
        }
    }

    private static Snapshot snapshot(Path path, Instant now) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return new Snapshot(attrs.size(), attrs.lastModifiedTime().toInstant(), now);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            log.warn("[OBSERVER] cannot stat {}: {}", path, e.getMessage());
            return null;
        }
    }

    private static final class Snapshot {
        final long size;
        final Instant lastModified;
        final Instant firstSeen;

        Snapshot(long size, Instant lastModified, Instant firstSeen) {
            this.size = size;
            this.lastModified = lastModified;
            this.firstSeen = firstSeen;
        }

        boolean sameContent(Snapshot other) {
            return size == other.size && Objects.equals(lastModified, other.lastModified);
        }
    }
}
