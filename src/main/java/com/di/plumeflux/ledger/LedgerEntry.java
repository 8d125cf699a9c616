package com.di.plumeflux.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One line of the ledger. Entries are never rewritten; the latest entry for a key is its current
 * outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {

    private String unitKey;
    private LedgerOutcome outcome;
    private Instant recordedAt;
    /** Attempts made so far, carried across restarts for deferred units. */
    private int attempts;
    /** Artifact written for the unit, if any. */
    private String outputRef;
    @Builder.Default
    private List<String> files = new ArrayList<>();
    private String lastError;
    private String errorCategory;
    private boolean forced;
}
