package com.di.plumeflux.grouping;

/** Lifecycle of a processing unit inside one process run. */
public enum UnitState {
    OBSERVED,
    GROUPING,
    READY,
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    DEFERRED,
    INCOMPLETE;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == INCOMPLETE;
    }
}
