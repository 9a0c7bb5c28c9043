package com.tomeqa.index.config;

import com.tomeqa.index.lifecycle.IndexLifecycleManager;
import com.tomeqa.index.search.HybridIndex;
import com.tomeqa.index.search.LiveIndexRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Restores lifecycle state and loads the lexical indexes of the served collections once the
 * application is up. The index service may be unavailable; failures are logged only.
 */
@Component
@Slf4j
public class IndexStartup {

    private final IndexLifecycleManager lifecycleManager;
    private final LiveIndexRegistry registry;
    private final List<String> collections;
    private final int warmupLimit;
    private final boolean warmupEnabled;

    public IndexStartup(
            IndexLifecycleManager lifecycleManager,
            LiveIndexRegistry registry,
            @Value("${tomeqa.index.warmup.collections:pages,semantic}") List<String> collections,
            @Value("${tomeqa.index.warmup.limit:" + HybridIndex.DEFAULT_WARMUP_LIMIT + "}") int warmupLimit,
            @Value("${tomeqa.index.warmup.enabled:true}") boolean warmupEnabled) {
        this.lifecycleManager = lifecycleManager;
        this.registry = registry;
        this.collections = collections;
        this.warmupLimit = warmupLimit;
        this.warmupEnabled = warmupEnabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        lifecycleManager.loadReconciliationState();
        if (!warmupEnabled) {
            log.info("[STARTUP] Lexical warm-up disabled");
            return;
        }
        log.info("[STARTUP] Warming lexical indexes for {}", collections);
        registry.warm(collections, warmupLimit);
        log.info("[STARTUP] Index service ready");
    }
}
