package com.tomeqa.index.config;

import com.tomeqa.index.blob.BlobStore;
import com.tomeqa.index.chunk.ChunkingStrategy;
import com.tomeqa.index.embed.EmbeddingsClient;
import com.tomeqa.index.ingest.IngestionSource;
import com.tomeqa.index.ingest.JsonDirectoryIngestionSource;
import com.tomeqa.index.lifecycle.IndexLifecycleManager;
import com.tomeqa.index.lifecycle.LifecycleSettings;
import com.tomeqa.index.metrics.IndexMetrics;
import com.tomeqa.index.search.FusionReranker;
import com.tomeqa.index.search.LiveIndexRegistry;
import com.tomeqa.index.status.StatusSink;
import com.tomeqa.index.store.IndexServiceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Executor;

@Configuration
@Slf4j
public class IndexConfig {

    @Bean
    public IndexContext indexContext(
            EmbeddingsClient embeddingsClient,
            IndexServiceClient indexServiceClient,
            BlobStore blobStore,
            @Value("${tomeqa.index.vector-size:768}") int vectorSize
    ) {
        log.info("[CONFIG] Index backend={}, vectorSize={}", indexServiceClient.backendName(), vectorSize);
        return new IndexContext(embeddingsClient, indexServiceClient, blobStore, vectorSize);
    }

    @Bean
    public LiveIndexRegistry liveIndexRegistry(IndexContext indexContext) {
        return new LiveIndexRegistry(indexContext);
    }

    @Bean
    public FusionReranker fusionReranker(
            @Value("${tomeqa.index.fusion.alpha:0.5}") double alpha,
            @Value("${tomeqa.index.fusion.beta:0.3}") double beta,
            @Value("${tomeqa.index.fusion.gamma:0.2}") double gamma
    ) {
        return new FusionReranker(alpha, beta, gamma);
    }

    @Bean
    public IngestionSource ingestionSource(@Value("${tomeqa.index.ingest.source-dir:./data/documents}") String sourceDir) {
        return new JsonDirectoryIngestionSource(Path.of(sourceDir));
    }

    @Bean
    public LifecycleSettings lifecycleSettings(
            Environment environment,
            @Value("${tomeqa.index.rebuild.allow-empty:false}") boolean allowEmpty,
            @Value("${tomeqa.index.ingest.embed-batch-size:32}") int embedBatchSize,
            @Value("${tomeqa.index.chunking.chunk-size:800}") int chunkSize,
            @Value("${tomeqa.index.chunking.chunk-overlap:150}") int chunkOverlap,
            @Value("${tomeqa.index.rebuild.retained-runs:" + LifecycleSettings.DEFAULT_RETAINED_RUNS + "}") int retainedRuns
    ) {
        Map<String, ChunkingStrategy> strategies = Binder.get(environment)
                .bind("tomeqa.index.collections", Bindable.mapOf(String.class, ChunkingStrategy.class))
                .orElse(Map.of());
        log.info("[CONFIG] Chunking strategies: {}", strategies);
        return new LifecycleSettings(strategies, allowEmpty, embedBatchSize, chunkSize, chunkOverlap, retainedRuns);
    }

    @Bean
    public IndexLifecycleManager indexLifecycleManager(
            IndexContext indexContext,
            IngestionSource ingestionSource,
            LiveIndexRegistry liveIndexRegistry,
            StatusSink statusSink,
            IndexMetrics indexMetrics,
            @Qualifier("rebuildExecutor") Executor rebuildExecutor,
            @Qualifier("embedExecutor") Executor embedExecutor,
            LifecycleSettings lifecycleSettings
    ) {
        return new IndexLifecycleManager(indexContext, ingestionSource, liveIndexRegistry, statusSink, indexMetrics,
                rebuildExecutor, embedExecutor, lifecycleSettings);
    }
}
