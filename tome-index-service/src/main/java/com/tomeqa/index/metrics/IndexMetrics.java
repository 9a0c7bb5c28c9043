package com.tomeqa.index.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Retrieval and rebuild metrics, exported to Prometheus through actuator.
 */
@Component
public class IndexMetrics {

    private final MeterRegistry registry;

    // Timers
    private final Timer searchTimer;
    private final Timer embeddingTimer;
    private final Timer denseSearchTimer;
    private final Timer rebuildTimer;

    // Counters
    private final Counter searchCounter;
    private final Counter searchErrorCounter;
    private final Counter retryCounter;
    private final Counter documentIngestCounter;
    private final Counter documentSkippedCounter;
    private final Counter chunkCreatedCounter;

    private volatile long lastSearchTimeMs = 0;

    public IndexMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.searchTimer = Timer.builder("tome.index.search.duration")
                .description("Total hybrid search duration")
                .tags("operation", "search")
                .register(registry);

        this.embeddingTimer = Timer.builder("tome.index.embedding.duration")
                .description("Time to embed a query")
                .tags("component", "embedding")
                .register(registry);

        this.denseSearchTimer = Timer.builder("tome.index.dense.search.duration")
                .description("Time for vector similarity search in the index service")
                .tags("component", "index-service")
                .register(registry);

        this.rebuildTimer = Timer.builder("tome.index.rebuild.duration")
                .description("Duration of a rebuild run")
                .tags("operation", "rebuild")
                .register(registry);

        this.searchCounter = Counter.builder("tome.index.search.total")
                .description("Number of searches served")
                .tags("operation", "search")
                .register(registry);

        this.searchErrorCounter = Counter.builder("tome.index.search.errors")
                .description("Number of searches and page lookups that failed and returned nothing")
                .tags("operation", "search")
                .register(registry);

        this.retryCounter = Counter.builder("tome.index.retries")
                .description("Number of read-path retries after transient failures")
                .tags("operation", "retry")
                .register(registry);

        this.documentIngestCounter = Counter.builder("tome.index.documents.ingested")
                .description("Number of documents ingested into staged collections")
                .tags("operation", "ingest")
                .register(registry);

        this.documentSkippedCounter = Counter.builder("tome.index.documents.skipped")
                .description("Number of malformed documents skipped")
                .tags("operation", "ingest")
                .register(registry);

        this.chunkCreatedCounter = Counter.builder("tome.index.chunks.created")
                .description("Number of chunks written")
                .tags("operation", "ingest")
                .register(registry);

        Gauge.builder("tome.index.last.search.time.ms", this, IndexMetrics::getLastSearchTimeMs)
                .description("Last search time in milliseconds")
                .register(registry);
    }

    public void recordSearchTime(long durationMs) {
        this.lastSearchTimeMs = durationMs;
        searchTimer.record(durationMs, TimeUnit.MILLISECONDS);
        searchCounter.increment();
    }

    public void recordEmbeddingTime(long durationMs) {
        embeddingTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordDenseSearchTime(long durationMs) {
        denseSearchTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordSearchError() {
        searchErrorCounter.increment();
    }

    public void recordRetry() {
        retryCounter.increment();
    }

    public void recordDocumentIngested(int chunkCount) {
        documentIngestCounter.increment();
        chunkCreatedCounter.increment(chunkCount);
    }

    public void recordDocumentSkipped() {
        documentSkippedCounter.increment();
    }

    /**
     * Records a finished rebuild with its terminal status as tag.
     */
    public void recordRebuild(String status, long durationMs) {
        rebuildTimer.record(durationMs, TimeUnit.MILLISECONDS);
        registry.counter("tome.index.rebuilds", "status", status).increment();
    }

    public long getLastSearchTimeMs() {
        return lastSearchTimeMs;
    }
}
