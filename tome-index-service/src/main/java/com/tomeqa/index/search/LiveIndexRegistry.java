package com.tomeqa.index.search;

import com.tomeqa.index.config.IndexContext;
import com.tomeqa.index.store.CollectionNames;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Query-side index per base collection, addressed through the base's live alias.
 * A committed rebuild replaces the entry with the staged generation.
 */
@Slf4j
public class LiveIndexRegistry {

    private final IndexContext context;
    private final Map<String, HybridIndex> live = new ConcurrentHashMap<>();

    public LiveIndexRegistry(IndexContext context) {
        this.context = context;
    }

    /**
     * The live index of {@code base}. A base that is not registered yet is added only when its live
     * alias exists in the index service.
     */
    public Optional<HybridIndex> get(String base) {
        HybridIndex index = live.get(base);
        if (index != null) {
            return Optional.of(index);
        }
        if (context.indexService().resolveAlias(CollectionNames.liveAlias(base)).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(register(base));
    }

    private HybridIndex register(String base) {
        return live.computeIfAbsent(base, b -> new HybridIndex(context, CollectionNames.liveAlias(b)));
    }

    /**
     * Makes the staged generation the live one for {@code base}, keeping its lexical index.
     */
    public void publish(String base, HybridIndex staged) {
        live.put(base, staged.rebind(CollectionNames.liveAlias(base)));
        log.info("[LIVE] {} now serves {} ({} lexical chunks)", base, staged.collection(), staged.lexicalSize());
    }

    /**
     * Loads the lexical corpus of every base whose live alias exists. Failures are logged per base.
     */
    public void warm(Collection<String> bases, int limit) {
        for (String base : bases) {
            String alias = CollectionNames.liveAlias(base);
            try {
                if (context.indexService().resolveAlias(alias).isEmpty()) {
                    log.info("[LIVE] No live generation for {} yet", base);
                    continue;
                }
                register(base).warmLexicalIndex(limit);
            } catch (RuntimeException e) {
                log.warn("[LIVE] Failed to warm lexical index for {}: {}", base, e.getMessage());
            }
        }
    }

    public Set<String> bases() {
        return Set.copyOf(live.keySet());
    }
}
