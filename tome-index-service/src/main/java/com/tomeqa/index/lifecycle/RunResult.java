package com.tomeqa.index.lifecycle;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of a finished rebuild run.
 *
 * @param documentsUnchanged documents whose content hash matched the processing history
 * @param pointsByBase       points written into each staged collection
 * @param error              failure reason, or {@code null} when committed
 */
public record RunResult(
        String runId,
        RunStatus status,
        List<String> targets,
        int documentsProcessed,
        int documentsSkipped,
        int documentsUnchanged,
        Map<String, Integer> pointsByBase,
        List<String> skippedDocuments,
        String error,
        Instant startedAt,
        Instant finishedAt
) {

    public boolean isCommitted() {
        return status == RunStatus.COMMITTED;
    }
}
