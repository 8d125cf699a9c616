package com.di.plumeflux.grouping;

import com.di.plumeflux.exception.OrphanDataException;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/** What routing one file produced: at most one ready unit, plus any files it pushed out as surplus. */
@Value
public class RoutingResult {

    private static final RoutingResult NOTHING = new RoutingResult(null, List.of());

    ProcessingUnit ready;
    List<OrphanDataException> orphans;

    public static RoutingResult nothing() {
        return NOTHING;
    }

    public static RoutingResult ready(ProcessingUnit unit, List<OrphanDataException> orphans) {
        return new RoutingResult(unit, List.copyOf(orphans));
    }

    public static RoutingResult orphaned(OrphanDataException orphan) {
        return new RoutingResult(null, List.of(orphan));
    }

    public Optional<ProcessingUnit> getReady() {
        return Optional.ofNullable(ready);
    }
}
