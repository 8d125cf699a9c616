package com.di.plumeflux.orchestrator;

public enum SubmitResult {
    ACCEPTED,
    /** Same key already queued, in flight, retrying or waiting. */
    COALESCED,
    /** Ledger already holds a terminal outcome. */
    ALREADY_DONE,
    /** Orchestrator is shutting down. */
    REJECTED
}
