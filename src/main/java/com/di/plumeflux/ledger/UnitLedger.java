package com.di.plumeflux.ledger;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of unit outcomes. One writer (the orchestrator loop); reads may come from any
 * thread.
 */
public interface UnitLedger extends AutoCloseable {

    void append(LedgerEntry entry);

    Optional<LedgerEntry> latest(String unitKey);

    List<LedgerEntry> history(String unitKey);

    /** Latest entry of every key, ordered by key. */
    Collection<LedgerEntry> latestEntries();

    /** True when the file belongs to a unit with a terminal outcome. */
    boolean isFileConsumed(Path file);

    @Override
    void close();
}
