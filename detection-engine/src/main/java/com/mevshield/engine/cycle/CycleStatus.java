package com.mevshield.engine.cycle;

public enum CycleStatus {
    /** Pipeline ran to the end; results are in the ledger. */
    COMPLETED,
    /** Too soon after the previous cycle, or another cycle was running. Nothing happened. */
    SKIPPED,
    /** Pipeline aborted; the ledger holds only what was written before the failure. */
    FAILED
}
