package com.tomeqa.index.lifecycle;

/**
 * A base collection blocked after an alias swap with unknown outcome.
 */
public record ReconciliationEntry(String base, String runId, String reason, String since) {
}
