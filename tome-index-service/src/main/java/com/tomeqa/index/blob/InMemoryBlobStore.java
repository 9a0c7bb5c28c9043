package com.tomeqa.index.blob;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBlobStore implements BlobStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(blobs.get(key)).map(byte[]::clone);
    }

    @Override
    public void put(String key, byte[] content) {
        blobs.put(key, content.clone());
    }

    @Override
    public void delete(String key) {
        blobs.remove(key);
    }
}
