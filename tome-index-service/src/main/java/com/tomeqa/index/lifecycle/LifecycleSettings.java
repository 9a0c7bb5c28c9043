package com.tomeqa.index.lifecycle;

import com.tomeqa.index.chunk.ChunkingStrategy;
import com.tomeqa.index.chunk.RecursiveTextSplitter;
import com.tomeqa.index.ingest.DocumentIngestor;

import java.util.Map;

/**
 * Tunables of rebuild runs.
 *
 * @param strategies     chunking strategy per base; others use {@link ChunkingStrategy#CROSS_PAGE}
 * @param allowEmpty     accept staged collections without points
 * @param embedBatchSize texts per embedding request
 * @param retainedRuns   finished runs kept for status queries
 */
public record LifecycleSettings(
        Map<String, ChunkingStrategy> strategies,
        boolean allowEmpty,
        int embedBatchSize,
        int chunkSize,
        int chunkOverlap,
        int retainedRuns
) {

    public static final int DEFAULT_RETAINED_RUNS = 50;

    public LifecycleSettings {
        strategies = strategies == null ? Map.of() : Map.copyOf(strategies);
        if (retainedRuns < 1) {
            throw new IllegalArgumentException("retainedRuns must be positive, got " + retainedRuns);
        }
    }

    public LifecycleSettings(Map<String, ChunkingStrategy> strategies, boolean allowEmpty, int embedBatchSize,
                             int chunkSize, int chunkOverlap) {
        this(strategies, allowEmpty, embedBatchSize, chunkSize, chunkOverlap, DEFAULT_RETAINED_RUNS);
    }

    public static LifecycleSettings defaults() {
        return new LifecycleSettings(Map.of(), false, DocumentIngestor.DEFAULT_EMBED_BATCH_SIZE,
                RecursiveTextSplitter.DEFAULT_CHUNK_SIZE, RecursiveTextSplitter.DEFAULT_CHUNK_OVERLAP);
    }

    public ChunkingStrategy strategyFor(String base) {
        return strategies.getOrDefault(base, ChunkingStrategy.CROSS_PAGE);
    }
}
