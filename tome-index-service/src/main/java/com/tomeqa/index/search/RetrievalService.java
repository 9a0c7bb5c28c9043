package com.tomeqa.index.search;

import com.tomeqa.index.config.IndexContext;
import com.tomeqa.index.exception.IndexException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.metrics.IndexMetrics;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.MetadataKeys;
import com.tomeqa.index.model.PageDetails;
import com.tomeqa.index.model.ScoredChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Hybrid search and page lookup over the live indexes.
 * <p>
 * Transient index-service failures are retried with exponential backoff. When a query still
 * fails it is logged and counted and an empty result is returned.
 */
@Service
@Slf4j
public class RetrievalService {

    public static final String DEFAULT_COLLECTION = "semantic";
    static final int CANDIDATE_FACTOR = 2;
    static final int PAGE_CHUNK_LIMIT = 100;

    private final IndexContext context;
    private final LiveIndexRegistry registry;
    private final FusionReranker reranker;
    private final IndexMetrics metrics;
    private final String defaultCollection;
    private final int maxRetries;
    private final long baseDelayMs;

    public RetrievalService(
            IndexContext context,
            LiveIndexRegistry registry,
            FusionReranker reranker,
            IndexMetrics metrics,
            @Value("${tomeqa.index.retrieval.default-collection:" + DEFAULT_COLLECTION + "}") String defaultCollection,
            @Value("${tomeqa.index.retrieval.max-retries:2}") int maxRetries,
            @Value("${tomeqa.index.retrieval.base-delay-ms:200}") long baseDelayMs) {
        this.context = context;
        this.registry = registry;
        this.reranker = reranker;
        this.metrics = metrics;
        this.defaultCollection = defaultCollection;
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
    }

    public List<ScoredChunk> search(String queryText, int limit) {
        return search(queryText, null, limit, null);
    }

    /**
     * Dense and lexical candidates fused by {@link FusionReranker}. When the lexical index has no
     * match the dense ranking is returned as is.
     *
     * @param queryVector precomputed query embedding, or {@code null} to embed {@code queryText}
     * @param collection  base collection name, or {@code null} for the default one
     */
    public List<ScoredChunk> search(String queryText, float[] queryVector, int limit, String collection) {
        String base = baseOrDefault(collection);
        long startTime = System.currentTimeMillis();
        try {
            Optional<HybridIndex> live = withRetry("resolve " + base, () -> registry.get(base));
            if (live.isEmpty()) {
                log.warn("[SEARCH] No live generation for collection '{}'", base);
                return List.of();
            }
            HybridIndex index = live.get();
            float[] vector = queryVector;
            if (vector == null) {
                long embedStart = System.currentTimeMillis();
                vector = withRetry("embed query", () -> context.embeddings().embed(queryText));
                metrics.recordEmbeddingTime(System.currentTimeMillis() - embedStart);
            }

            float[] finalVector = vector;
            long denseStart = System.currentTimeMillis();
            List<ScoredChunk> dense = withRetry("dense search " + base,
                    () -> index.denseSearch(finalVector, limit * CANDIDATE_FACTOR));
            metrics.recordDenseSearchTime(System.currentTimeMillis() - denseStart);

            List<ScoredChunk> sparse = index.lexicalSearch(queryText, limit * CANDIDATE_FACTOR);

            List<ScoredChunk> results = sparse.isEmpty()
                    ? dense.stream().limit(limit).toList()
                    : reranker.combine(dense, sparse, queryText, limit);

            long totalTime = System.currentTimeMillis() - startTime;
            metrics.recordSearchTime(totalTime);
            log.debug("[SEARCH TIMING] {} total={}ms dense={} sparse={} returned={}",
                    base, totalTime, dense.size(), sparse.size(), results.size());
            return results;
        } catch (IndexException e) {
            metrics.recordSearchError();
            log.error("[SEARCH] Search in {} failed for query '{}': {}", base, queryText, e.getMessage(), e);
            return List.of();
        }
    }

    public Optional<PageDetails> getBySourceAndPage(String source, int page) {
        return getBySourceAndPage(source, page, null);
    }

    /**
     * All chunks whose origin is the given page, joined in chunk order.
     */
    public Optional<PageDetails> getBySourceAndPage(String source, int page, String collection) {
        String base = baseOrDefault(collection);
        try {
            Optional<HybridIndex> live = withRetry("resolve " + base, () -> registry.get(base));
            if (live.isEmpty()) {
                log.warn("[PAGE] No live generation for collection '{}'", base);
                return Optional.empty();
            }
            HybridIndex index = live.get();
            List<Chunk> chunks = withRetry("page lookup " + base, () -> index.getByExactMetadata(
                    Map.of(MetadataKeys.SOURCE, source, MetadataKeys.PAGE, page), PAGE_CHUNK_LIMIT));
            if (chunks.isEmpty()) {
                log.warn("[PAGE] No match in {} for source '{}', page {}", base, source, page);
                return Optional.empty();
            }

            List<Chunk> ordered = chunks.stream()
                    .sorted(Comparator.comparingInt(c -> Chunk.intValue(c.metadata().get(MetadataKeys.CHUNK_INDEX), 0)))
                    .toList();
            String text = ordered.stream()
                    .map(Chunk::text)
                    .collect(Collectors.joining("\n\n"))
                    .strip();

            String imageUrl = ordered.stream()
                    .map(c -> c.metadata().get(MetadataKeys.IMAGE_URL))
                    .filter(v -> v != null && !v.toString().isBlank())
                    .map(Object::toString)
                    .findFirst()
                    .orElse(null);
            Integer totalPages = ordered.stream()
                    .map(c -> c.metadata().get(MetadataKeys.TOTAL_PAGES))
                    .filter(v -> v != null)
                    .map(v -> Chunk.intValue(v, 0))
                    .filter(v -> v > 0)
                    .findFirst()
                    .orElse(null);

            return Optional.of(new PageDetails(text, ordered.get(0).metadata(), imageUrl, totalPages));
        } catch (IndexException e) {
            metrics.recordSearchError();
            log.error("[PAGE] Lookup in {} failed for source '{}', page {}: {}", base, source, page, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private String baseOrDefault(String collection) {
        return collection == null || collection.isBlank() ? defaultCollection : collection;
    }

    <T> T withRetry(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (TransientStoreException e) {
                if (attempt >= maxRetries) {
                    throw e;
                }
                long delay = baseDelayMs * (1L << attempt);
                attempt++;
                metrics.recordRetry();
                log.warn("[RETRY] {} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxRetries + 1, delay, e.getMessage());
                sleep(delay);
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while backing off", false, e);
        }
    }
}
