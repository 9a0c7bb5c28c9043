package com.tomeqa.index.exception;

import java.util.Set;

/**
 * Another rebuild already owns one of the requested base collections, or the base is
 * blocked awaiting manual reconciliation.
 */
public class RebuildInProgressException extends IndexException {

    private final Set<String> conflictingBases;

    public RebuildInProgressException(String message, Set<String> conflictingBases) {
        super(message);
        this.conflictingBases = Set.copyOf(conflictingBases);
    }

    public Set<String> getConflictingBases() {
        return conflictingBases;
    }
}
