package com.tomeqa.index.store;

import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.IndexPoint;
import com.tomeqa.index.model.ScoredChunk;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contract of the vector index service. Collection arguments may name a collection or an alias.
 * <p>
 * Implementations throw {@link com.tomeqa.index.exception.TransientStoreException} for timeouts,
 * 5xx and I/O errors and {@link com.tomeqa.index.exception.IndexServiceException} for rejected or
 * unreadable requests.
 */
public interface IndexServiceClient {

    String backendName();

    void createCollection(String name, int vectorSize);

    boolean collectionExists(String name);

    void deleteCollection(String name);

    List<String> listCollections();

    /**
     * Writes all points in one request; the write is visible when the call returns.
     */
    void upsert(String collection, List<IndexPoint> points);

    List<ScoredChunk> search(String collection, float[] vector, int limit);

    /**
     * Points whose {@code metadata.<key>} equals the given value for every filter entry.
     */
    List<Chunk> scroll(String collection, Map<String, Object> filters, int limit);

    long count(String collection);

    Optional<String> resolveAlias(String alias);

    /**
     * Applies all operations as one atomic request: either all take effect or none.
     */
    void updateAliases(List<AliasOperation> operations);
}
