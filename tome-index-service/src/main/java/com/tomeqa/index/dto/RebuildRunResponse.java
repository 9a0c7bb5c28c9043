package com.tomeqa.index.dto;

import com.tomeqa.index.lifecycle.RebuildRun;
import com.tomeqa.index.lifecycle.RunResult;
import com.tomeqa.index.lifecycle.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RebuildRunResponse(
        String runId,
        RunStatus status,
        List<String> targets,
        String cacheBehavior,
        Map<String, String> stagedCollections,
        int documentsTotal,
        int documentsProcessed,
        int documentsSkipped,
        int documentsUnchanged,
        Map<String, Integer> pointsByBase,
        List<String> skippedDocuments,
        String error,
        Instant startedAt,
        Instant finishedAt
) {
    public static RebuildRunResponse from(RebuildRun run) {
        RunResult result = run.toResult();
        return new RebuildRunResponse(
                result.runId(),
                result.status(),
                result.targets(),
                run.getCacheBehavior().name(),
                run.getStagedCollections(),
                run.getDocumentsTotal(),
                result.documentsProcessed(),
                result.documentsSkipped(),
                result.documentsUnchanged(),
                result.pointsByBase(),
                result.skippedDocuments(),
                result.error(),
                result.startedAt(),
                result.finishedAt()
        );
    }
}
