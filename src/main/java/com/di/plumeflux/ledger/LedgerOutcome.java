package com.di.plumeflux.ledger;

public enum LedgerOutcome {
    SUCCESS,
    FAILED,
    /** Waiting on a calibration or interrupted by shutdown; picked up again on the next run. */
    DEFERRED,
    /** A pair that never found its partner. */
    INCOMPLETE,
    /** A surplus image. */
    ORPHANED;

    /** Terminal outcomes are skipped by the idempotence check and mark their files as consumed. */
    public boolean isTerminal() {
        return this != DEFERRED;
    }
}
