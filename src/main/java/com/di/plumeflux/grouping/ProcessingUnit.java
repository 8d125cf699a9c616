package com.di.plumeflux.grouping;

import com.di.plumeflux.observer.FileKind;
import com.di.plumeflux.observer.RawFile;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A ready unit of work: one or more scans, or an on/off image pair. The acquisition time is the
 * key timestamp (earliest scan, or the on-band image of a pair).
 */
@Value
public class ProcessingUnit {

    UnitKey key;
    List<RawFile> members;

    public ProcessingUnit(UnitKey key, List<RawFile> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Unit " + key + " has no members");
        }
        this.key = key;
        this.members = members.stream()
                .sorted(Comparator.comparing(RawFile::getAcquiredAt).thenComparing(RawFile::getKind))
                .collect(Collectors.toUnmodifiableList());
    }

    public static ProcessingUnit scan(RawFile scan) {
        return new ProcessingUnit(UnitKey.of(UnitKind.SCAN, scan.getAcquiredAt()), List.of(scan));
    }

    public static ProcessingUnit scanWindow(Instant windowKey, List<RawFile> scans) {
        return new ProcessingUnit(UnitKey.of(UnitKind.SCAN_WINDOW, windowKey), scans);
    }

    public static ProcessingUnit pair(RawFile on, RawFile off) {
        return new ProcessingUnit(UnitKey.of(UnitKind.IMAGE_PAIR, on.getAcquiredAt()), List.of(on, off));
    }

    /** A partial pair that aged out; keyed by the image it has. */
    public static ProcessingUnit incomplete(RawFile image) {
        return new ProcessingUnit(UnitKey.of(UnitKind.IMAGE_PAIR, image.getAcquiredAt()), List.of(image));
    }

    public Instant getAcquiredAt() {
        return key.getTimestamp();
    }

    public boolean isCalibration() {
        return key.isCalibration();
    }

    public Optional<RawFile> member(FileKind kind) {
        return members.stream().filter(f -> f.getKind() == kind).findFirst();
    }

    public Instant earliest() {
        return members.get(0).getAcquiredAt();
    }

    public Instant latest() {
        return members.get(members.size() - 1).getAcquiredAt();
    }

    public List<Path> memberPaths() {
        return members.stream().map(RawFile::getPath).collect(Collectors.toList());
    }

    /** A pair is complete only with both bands. */
    public boolean isComplete() {
        if (key.getKind() != UnitKind.IMAGE_PAIR) {
            return true;
        }
        return member(FileKind.IMAGE_ON).isPresent() && member(FileKind.IMAGE_OFF).isPresent();
    }
}
