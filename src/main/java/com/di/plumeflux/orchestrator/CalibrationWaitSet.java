package com.di.plumeflux.orchestrator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Units waiting for a calibration, keyed by acquisition time so that publishing an artifact
 * releases exactly the units inside its window with one range lookup.
 */
class CalibrationWaitSet<T> {

    private final TreeMap<Instant, List<T>> waiting = new TreeMap<>();
    private final Function<T, Instant> timeOf;
    private int size;

    CalibrationWaitSet(Function<T, Instant> timeOf) {
        this.timeOf = timeOf;
    }

    void add(T item) {
        waiting.computeIfAbsent(timeOf.apply(item), t -> new ArrayList<>()).add(item);
        size++;
    }

    /** Removes and returns every item with a time in {@code [from, to)}. */
    List<T> release(Instant from, Instant to) {
        NavigableMap<Instant, List<T>> window = waiting.subMap(from, true, to, false);
        List<T> released = new ArrayList<>();
        window.values().forEach(released::addAll);
        window.clear();
        size -= released.size();
        return released;
    }

    List<T> drain() {
        List<T> all = new ArrayList<>();
        waiting.values().forEach(all::addAll);
        waiting.clear();
        size = 0;
        return all;
    }

    int size() {
        return size;
    }
}
