package com.tomeqa.index.lifecycle;

import com.tomeqa.index.ingest.CacheBehavior;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One rebuild attempt. Written by the thread executing the run, read by status queries.
 */
public class RebuildRun {

    private final String runId;
    private final List<String> targets;
    private final CacheBehavior cacheBehavior;
    private final Instant startedAt = Instant.now();

    private final Map<String, String> stagedCollections = new LinkedHashMap<>();
    private final Map<String, Integer> pointsByBase = new LinkedHashMap<>();
    private final List<String> skippedDocuments = new ArrayList<>();
    private int documentsProcessed;
    private int documentsUnchanged;
    private int documentsTotal;

    private volatile RunStatus status = RunStatus.STAGING;
    private volatile boolean cancelRequested;
    private volatile String error;
    private volatile Instant finishedAt;

    public RebuildRun(String runId, List<String> targets, CacheBehavior cacheBehavior) {
        this.runId = runId;
        this.targets = List.copyOf(targets);
        this.cacheBehavior = cacheBehavior;
        targets.forEach(t -> pointsByBase.put(t, 0));
    }

    public String getRunId() {
        return runId;
    }

    public List<String> getTargets() {
        return targets;
    }

    public CacheBehavior getCacheBehavior() {
        return cacheBehavior;
    }

    public RunStatus getStatus() {
        return status;
    }

    synchronized void setStatus(RunStatus status) {
        this.status = status;
        if (status.isTerminal()) {
            this.finishedAt = Instant.now();
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * @return false once the run has left {@link RunStatus#STAGING}
     */
    synchronized boolean requestCancel() {
        if (status != RunStatus.STAGING) {
            return false;
        }
        this.cancelRequested = true;
        return true;
    }

    /**
     * Moves a staged run to {@link RunStatus#SWAPPING} unless cancellation was requested first.
     */
    synchronized boolean beginSwap() {
        if (cancelRequested || status != RunStatus.STAGING) {
            return false;
        }
        this.status = RunStatus.SWAPPING;
        return true;
    }

    public String getError() {
        return error;
    }

    void setError(String error) {
        this.error = error;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized Map<String, String> getStagedCollections() {
        return Map.copyOf(stagedCollections);
    }

    synchronized void addStagedCollection(String base, String collection) {
        stagedCollections.put(base, collection);
    }

    public synchronized int committedPoints(String base) {
        return pointsByBase.getOrDefault(base, 0);
    }

    synchronized void recordDocument(Map<String, Integer> points, boolean unchanged) {
        points.forEach((base, count) -> pointsByBase.merge(base, count, Integer::sum));
        documentsProcessed++;
        if (unchanged) {
            documentsUnchanged++;
        }
    }

    synchronized void recordSkipped(String documentId) {
        skippedDocuments.add(documentId);
    }

    synchronized void setDocumentsTotal(int documentsTotal) {
        this.documentsTotal = documentsTotal;
    }

    public synchronized int getDocumentsTotal() {
        return documentsTotal;
    }

    public synchronized int getDocumentsProcessed() {
        return documentsProcessed;
    }

    public synchronized RunResult toResult() {
        return new RunResult(
                runId,
                status,
                targets,
                documentsProcessed,
                skippedDocuments.size(),
                documentsUnchanged,
                Map.copyOf(pointsByBase),
                List.copyOf(skippedDocuments),
                error,
                startedAt,
                finishedAt);
    }
}
