package com.di.plumeflux.grouping;

import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.exception.OrphanDataException;
import com.di.plumeflux.observer.FileKind;
import com.di.plumeflux.observer.FilenameClassifier;
import com.di.plumeflux.observer.RawFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assembles classified files into processing units.
 * <p>
 * Scans become ready at once. Images wait as partials until an opposite-band image within the
 * pairing tolerance arrives; the pair is then ready and every other partial inside the pair's
 * window is surplus. A late image within tolerance of a pair already formed is surplus too,
 * unless it is one of that pair's own files seen again; such a re-emission is ignored, as is a
 * second sighting of a waiting partial.
 * Partials older than {@code maxIncompleteAge} (measured from arrival) are handed back by
 * {@link #evictIncomplete(Instant)}.
 * <p>
 * Not thread-safe; owned by the coordinating loop.
 */
@Slf4j
public class GroupingRouter {

    private final Duration tolerance;
    private final PairingPolicy policy;
    private final Duration maxIncompleteAge;
    private final FilenameClassifier classifier;
    private final Clock clock;

    private final List<Partial> partials = new ArrayList<>();
    private final List<FormedPair> recentPairs = new ArrayList<>();
    private long arrivalSeq;

    public GroupingRouter(Duration tolerance, PairingPolicy policy, Duration maxIncompleteAge,
                          FilenameClassifier classifier, Clock clock) {
        this.tolerance = tolerance;
        this.policy = policy;
        this.maxIncompleteAge = maxIncompleteAge;
        this.classifier = classifier;
        this.clock = clock;
    }

    public RoutingResult route(RawFile file) {
        if (file.getKind() == FileKind.SCAN) {
            return RoutingResult.ready(ProcessingUnit.scan(file), List.of());
        }

        Path path = file.getPath().toAbsolutePath().normalize();
        if (partials.stream().anyMatch(p -> p.path.equals(path))) {
            log.debug("[ROUTER] {} already waiting", file.fileName());
            return RoutingResult.nothing();
        }
        for (FormedPair pair : recentPairs) {
            if (pair.members.contains(path)) {
                log.debug("[ROUTER] {} re-emitted, already in pair {}", file.fileName(), pair.key);
                return RoutingResult.nothing();
            }
        }
        for (FormedPair pair : recentPairs) {
            if (pair.isWithin(file.getAcquiredAt(), tolerance)) {
                log.warn("[ROUTER] {} arrived after pair {} was formed", file.fileName(), pair.key);
                return RoutingResult.orphaned(new OrphanDataException(file.getPath(),
                        "late surplus image for " + pair.key));
            }
        }

        Optional<Partial> partner = choosePartner(file);
        if (partner.isEmpty()) {
            partials.add(new Partial(file, clock.instant(), arrivalSeq++));
            log.debug("[ROUTER] {} waiting for its {} partner", file.fileName(), file.getKind().partnerBand());
            return RoutingResult.nothing();
        }

        partials.remove(partner.get());
        RawFile other = partner.get().file;
        RawFile on = file.getKind() == FileKind.IMAGE_ON ? file : other;
        RawFile off = file.getKind() == FileKind.IMAGE_OFF ? file : other;
        ProcessingUnit unit = ProcessingUnit.pair(on, off);
        FormedPair formed = new FormedPair(unit.getKey(), on, off, clock.instant());
        recentPairs.add(formed);

        List<OrphanDataException> orphans = new ArrayList<>();
        Iterator<Partial> it = partials.iterator();
        while (it.hasNext()) {
            Partial p = it.next();
            if (formed.isWithin(p.file.getAcquiredAt(), tolerance)) {
                it.remove();
                log.warn("[ROUTER] {} is surplus to pair {}", p.file.fileName(), unit.getKey());
                orphans.add(new OrphanDataException(p.file.getPath(), "surplus image for " + unit.getKey()));
            }
        }
        log.info("[ROUTER] pair {} ready: {} + {}", unit.getKey(), on.fileName(), off.fileName());
        return RoutingResult.ready(unit, orphans);
    }

    /** Removes and returns partials that waited too long for a partner. */
    public List<ProcessingUnit> evictIncomplete(Instant now) {
        recentPairs.removeIf(p -> !p.formedAt.plus(maxIncompleteAge).isAfter(now));
        List<ProcessingUnit> expired = new ArrayList<>();
        Iterator<Partial> it = partials.iterator();
        while (it.hasNext()) {
            Partial p = it.next();
            if (!p.arrivedAt.plus(maxIncompleteAge).isAfter(now)) {
                it.remove();
                log.warn("[ROUTER] {} has no partner after {}; incomplete", p.file.fileName(), maxIncompleteAge);
                expired.add(ProcessingUnit.incomplete(p.file));
            }
        }
        return expired;
    }

    /** Batch end: every remaining partial is incomplete. */
    public List<ProcessingUnit> drainIncomplete() {
        List<ProcessingUnit> remaining = partials.stream()
                .map(p -> ProcessingUnit.incomplete(p.file))
                .collect(Collectors.toList());
        partials.clear();
        recentPairs.clear();
        return remaining;
    }

    public int partialCount() {
        return partials.size();
    }

    /** Rebuilds a unit from the files recorded for it, e.g. for a forced re-run. */
    public ProcessingUnit rebuild(UnitKey key, List<Path> files) {
        List<RawFile> members = new ArrayList<>();
        for (Path path : files) {
            try {
                members.add(classifier.classify(path).orElseThrow(() ->
                        new MalformedDataException("Recorded file no longer classifies: " + path)));
            } catch (IOException e) {
                throw new MalformedDataException("Recorded file unreadable: " + path, e);
            }
        }
        ProcessingUnit unit = new ProcessingUnit(key, members);
        if (!unit.isComplete()) {
            throw new MalformedDataException("Cannot rebuild " + key + " from " + files);
        }
        return unit;
    }

    private Optional<Partial> choosePartner(RawFile file) {
        FileKind wanted = file.getKind().partnerBand();
        List<Partial> eligible = partials.stream()
                .filter(p -> p.file.getKind() == wanted)
                .filter(p -> distance(p.file, file).compareTo(tolerance) <= 0)
                .collect(Collectors.toList());
        if (eligible.isEmpty()) {
            return Optional.empty();
        }
        Comparator<Partial> order = policy == PairingPolicy.FIRST_ARRIVAL
                ? Comparator.comparingLong(p -> p.seq)
                : Comparator.<Partial, Duration>comparing(p -> distance(p.file, file))
                        .thenComparing(p -> p.file.getAcquiredAt())
                        .thenComparingLong(p -> p.seq);
        return eligible.stream().min(order);
    }

    private static Duration distance(RawFile a, RawFile b) {
        return Duration.between(a.getAcquiredAt(), b.getAcquiredAt()).abs();
    }

    private static final class Partial {
        final RawFile file;
        final Path path;
        final Instant arrivedAt;
        final long seq;

        Partial(RawFile file, Instant arrivedAt, long seq) {
            this.file = file;
            this.path = file.getPath().toAbsolutePath().normalize();
            this.arrivedAt = arrivedAt;
            this.seq = seq;
        }
    }

    private static final class FormedPair {
        final UnitKey key;
        final Instant onAt;
        final Instant offAt;
        final List<Path> members;
        final Instant formedAt;

        FormedPair(UnitKey key, RawFile on, RawFile off, Instant formedAt) {
            this.key = key;
            this.onAt = on.getAcquiredAt();
            this.offAt = off.getAcquiredAt();
            this.members = List.of(on.getPath().toAbsolutePath().normalize(),
                    off.getPath().toAbsolutePath().normalize());
            this.formedAt = formedAt;
        }

        boolean isWithin(Instant t, Duration tolerance) {
            return Duration.between(onAt, t).abs().compareTo(tolerance) <= 0
                    || Duration.between(offAt, t).abs().compareTo(tolerance) <= 0;
        }
    }
}
