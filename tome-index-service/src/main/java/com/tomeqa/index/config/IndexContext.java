package com.tomeqa.index.config;

import com.tomeqa.index.blob.BlobStore;
import com.tomeqa.index.embed.EmbeddingsClient;
import com.tomeqa.index.store.IndexServiceClient;

/**
 * The external collaborators every indexing component talks to, built once at start-up.
 */
public record IndexContext(
        EmbeddingsClient embeddings,
        IndexServiceClient indexService,
        BlobStore blobStore,
        int vectorSize
) {

    public IndexContext {
        if (vectorSize <= 0) {
            throw new IllegalArgumentException("vectorSize must be > 0");
        }
    }
}
