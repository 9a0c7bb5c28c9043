package com.tomeqa.index.lifecycle;

public enum RunStatus {
    STAGING,
    SWAPPING,
    COMMITTED,
    ROLLED_BACK,
    /** The alias batch outcome is unknown; the bases stay blocked until an operator clears them. */
    NEEDS_RECONCILIATION;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == NEEDS_RECONCILIATION;
    }
}
