package com.tomeqa.index.blob;

import java.util.Optional;

/**
 * Key/value object storage for small JSON state files (processing history, lifecycle state).
 */
public interface BlobStore {

    Optional<byte[]> get(String key);

    void put(String key, byte[] content);

    void delete(String key);
}
