package com.tomeqa.index.store.memory;

import com.tomeqa.index.exception.IndexServiceException;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.IndexPoint;
import com.tomeqa.index.model.ScoredChunk;
import com.tomeqa.index.store.AliasOperation;
import com.tomeqa.index.store.IndexServiceClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-process index service: brute-force cosine search and an alias table updated atomically.
 * Used for local runs and tests.
 */
@Slf4j
public class InMemoryIndexServiceClient implements IndexServiceClient {

    private final Object lock = new Object();
    private final Map<String, Collection> collections = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();

    private static final class Collection {
        final int vectorSize;
        final Map<Long, IndexPoint> points = new LinkedHashMap<>();

        Collection(int vectorSize) {
            this.vectorSize = vectorSize;
        }
    }

    @Override
    public String backendName() {
        return "memory";
    }

    @Override
    public void createCollection(String name, int vectorSize) {
        synchronized (lock) {
            if (collections.containsKey(name) || aliases.containsKey(name)) {
                throw new IndexServiceException("Collection " + name + " already exists", 409);
            }
            collections.put(name, new Collection(vectorSize));
        }
        log.debug("[MEMORY] Created collection {} (size={})", name, vectorSize);
    }

    @Override
    public boolean collectionExists(String name) {
        synchronized (lock) {
            return collections.containsKey(resolve(name));
        }
    }

    @Override
    public void deleteCollection(String name) {
        synchronized (lock) {
            if (collections.remove(name) == null) {
                throw new IndexServiceException("Collection " + name + " not found", 404);
            }
            aliases.values().removeIf(name::equals);
        }
        log.debug("[MEMORY] Deleted collection {}", name);
    }

    @Override
    public List<String> listCollections() {
        synchronized (lock) {
            return new ArrayList<>(collections.keySet());
        }
    }

    @Override
    public void upsert(String collection, List<IndexPoint> points) {
        synchronized (lock) {
            Collection c = require(collection);
            for (IndexPoint p : points) {
                if (p.vector() == null || p.vector().length != c.vectorSize) {
                    throw new IndexServiceException("Vector dimension mismatch for id=" + p.id()
                            + " expected=" + c.vectorSize, 400);
                }
            }
            for (IndexPoint p : points) {
                c.points.put(p.id(), p);
            }
        }
    }

    @Override
    public List<ScoredChunk> search(String collection, float[] vector, int limit) {
        List<IndexPoint> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(require(collection).points.values());
        }
        return snapshot.stream()
                .map(p -> new ScoredChunk(p.payload(), cosine(vector, p.vector())))
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<Chunk> scroll(String collection, Map<String, Object> filters, int limit) {
        List<IndexPoint> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(require(collection).points.values());
        }
        return snapshot.stream()
                .map(IndexPoint::payload)
                .filter(chunk -> matches(chunk.metadata(), filters))
                .limit(limit)
                .toList();
    }

    @Override
    public long count(String collection) {
        synchronized (lock) {
            return require(collection).points.size();
        }
    }

    @Override
    public Optional<String> resolveAlias(String alias) {
        synchronized (lock) {
            return Optional.ofNullable(aliases.get(alias));
        }
    }

    @Override
    public void updateAliases(List<AliasOperation> operations) {
        synchronized (lock) {
            Map<String, String> next = new HashMap<>(aliases);
            for (AliasOperation op : operations) {
                if (op.type() == AliasOperation.Type.DELETE) {
                    if (next.remove(op.alias()) == null) {
                        throw new IndexServiceException("Alias " + op.alias() + " does not exist", 404);
                    }
                } else {
                    if (!collections.containsKey(op.collection())) {
                        throw new IndexServiceException("Collection " + op.collection() + " not found", 404);
                    }
                    if (next.containsKey(op.alias()) || collections.containsKey(op.alias())) {
                        throw new IndexServiceException("Alias " + op.alias() + " already exists", 409);
                    }
                    next.put(op.alias(), op.collection());
                }
            }
            aliases.clear();
            aliases.putAll(next);
        }
        log.debug("[MEMORY] Applied alias batch with {} actions", operations.size());
    }

    private String resolve(String name) {
        return aliases.getOrDefault(name, name);
    }

    private Collection require(String name) {
        Collection c = collections.get(resolve(name));
        if (c == null) {
            throw new IndexServiceException("Collection " + name + " not found", 404);
        }
        return c;
    }

    private static boolean matches(Map<String, Object> metadata, Map<String, Object> filters) {
        for (Map.Entry<String, Object> f : filters.entrySet()) {
            Object actual = metadata.get(f.getKey());
            Object expected = f.getValue();
            if (actual instanceof Number a && expected instanceof Number e) {
                if (a.doubleValue() != e.doubleValue()) return false;
            } else if (!Objects.equals(actual, expected)) {
                return false;
            }
        }
        return true;
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IndexServiceException("Vector dimension mismatch: " + a.length + " vs " + b.length, 400);
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
