package com.tomeqa.index.search;

import com.tomeqa.index.config.IndexContext;
import com.tomeqa.index.exception.IndexWriteException;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.IndexPoint;
import com.tomeqa.index.model.ScoredChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One logical collection: batched writes, dense search through the index service, in-process
 * lexical search, and exact payload lookups.
 * <p>
 * The lexical index covers every chunk written through this instance (or loaded with
 * {@link #warmLexicalIndex(int)}) and is rebuilt from scratch after each upsert. Readers see an
 * immutable snapshot.
 */
@Slf4j
public class HybridIndex {

    public static final int UPSERT_BATCH_SIZE = 100;
    public static final int DEFAULT_WARMUP_LIMIT = 0;
    static final int DENSE_OVERFETCH = 5;

    private final IndexContext context;
    private final String collection;
    private final Generation generation;

    private record LexicalSnapshot(List<Chunk> chunks, BM25Index index) {
        static final LexicalSnapshot EMPTY = new LexicalSnapshot(List.of(), BM25Index.EMPTY);
    }

    /**
     * State shared by every view of the same collection generation.
     */
    private static final class Generation {
        final List<Chunk> corpus = new ArrayList<>();
        volatile LexicalSnapshot snapshot = LexicalSnapshot.EMPTY;
        AtomicLong nextId;
    }

    public HybridIndex(IndexContext context, String collection) {
        this(context, collection, new Generation());
    }

    private HybridIndex(IndexContext context, String collection, Generation generation) {
        this.context = context;
        this.collection = collection;
        this.generation = generation;
    }

    public String collection() {
        return collection;
    }

    /**
     * A view of the same generation under another name, typically its live alias.
     */
    public HybridIndex rebind(String name) {
        return new HybridIndex(context, name, generation);
    }

    /**
     * Pairs chunks with their vectors and assigns fresh point ids. The id counter starts at the
     * collection's point count the first time it is used.
     */
    public List<IndexPoint> toPoints(List<Chunk> chunks, List<float[]> vectors) {
        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("Got " + vectors.size() + " vectors for " + chunks.size() + " chunks");
        }
        AtomicLong ids = idCounter();
        List<IndexPoint> points = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            float[] vector = vectors.get(i);
            if (vector == null || vector.length != context.vectorSize()) {
                throw new IllegalArgumentException("Vector dimension mismatch for chunk " + i
                        + " expected=" + context.vectorSize()
                        + " got=" + (vector == null ? "null" : vector.length));
            }
            points.add(new IndexPoint(ids.getAndIncrement(), vector, chunks.get(i)));
        }
        return points;
    }

    /**
     * Writes points in batches of {@value #UPSERT_BATCH_SIZE}, each batch a single request.
     *
     * @return number of points written
     * @throws IndexWriteException when a batch fails; earlier batches stay committed
     */
    public int upsert(List<IndexPoint> points) {
        int committed = 0;
        try {
            for (int from = 0; from < points.size(); from += UPSERT_BATCH_SIZE) {
                List<IndexPoint> batch = points.subList(from, Math.min(points.size(), from + UPSERT_BATCH_SIZE));
                try {
                    context.indexService().upsert(collection, batch);
                } catch (RuntimeException e) {
                    log.error("[INDEX] Upsert batch at offset {} into {} failed after {} committed points",
                            from, collection, committed, e);
                    throw new IndexWriteException(collection, committed, e);
                }
                synchronized (generation) {
                    batch.forEach(p -> generation.corpus.add(p.payload()));
                }
                committed += batch.size();
            }
        } finally {
            if (committed > 0) {
                rebuildLexicalIndex();
            }
        }
        log.debug("[INDEX] Upserted {} points into {}", committed, collection);
        return committed;
    }

    /**
     * Top {@code limit} neighbours by cosine similarity, from {@code limit * 5} candidates.
     */
    public List<ScoredChunk> denseSearch(float[] vector, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return context.indexService().search(collection, vector, limit * DENSE_OVERFETCH).stream()
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(limit)
                .toList();
    }

    /**
     * BM25 matches scored by rank: {@code 1.0 - rank / resultCount}.
     */
    public List<ScoredChunk> lexicalSearch(String text, int limit) {
        LexicalSnapshot snapshot = generation.snapshot;
        List<BM25Index.BM25Result> hits = snapshot.index().search(text, limit);
        List<ScoredChunk> out = new ArrayList<>(hits.size());
        for (int rank = 0; rank < hits.size(); rank++) {
            Chunk chunk = snapshot.chunks().get(hits.get(rank).position());
            out.add(new ScoredChunk(chunk, 1.0 - (double) rank / hits.size()));
        }
        return out;
    }

    public List<Chunk> getByExactMetadata(Map<String, Object> filters, int limit) {
        return context.indexService().scroll(collection, filters, limit);
    }

    public long count() {
        return context.indexService().count(collection);
    }

    /**
     * Replaces the lexical corpus with the chunks read back from the index service.
     *
     * @param limit at most this many chunks, or {@code 0} for the whole collection
     * @return number of chunks loaded
     */
    public int warmLexicalIndex(int limit) {
        int fetch = limit > 0 ? limit + 1 : Integer.MAX_VALUE;
        List<Chunk> stored = context.indexService().scroll(collection, Map.of(), fetch);
        if (limit > 0 && stored.size() > limit) {
            log.warn("[INDEX] Lexical warm-up of {} capped at {} chunks; chunks past the cap get no lexical or keyword score",
                    collection, limit);
            stored = stored.subList(0, limit);
        }
        synchronized (generation) {
            generation.corpus.clear();
            generation.corpus.addAll(stored);
        }
        rebuildLexicalIndex();
        log.info("[INDEX] Warmed lexical index of {} with {} chunks", collection, stored.size());
        return stored.size();
    }

    public int lexicalSize() {
        return generation.snapshot.chunks().size();
    }

    private void rebuildLexicalIndex() {
        synchronized (generation) {
            List<Chunk> chunks = List.copyOf(generation.corpus);
            BM25Index index = BM25Index.build(chunks.stream().map(Chunk::text).toList());
            generation.snapshot = new LexicalSnapshot(chunks, index);
        }
    }

    private AtomicLong idCounter() {
        synchronized (generation) {
            if (generation.nextId == null) {
                generation.nextId = new AtomicLong(context.indexService().count(collection));
            }
            return generation.nextId;
        }
    }
}
