package com.tomeqa.index.dto;

import com.tomeqa.index.ingest.CacheBehavior;

import java.util.List;

public record RebuildRequest(
        List<String> collections,
        CacheBehavior cacheBehavior
) {
    public void validate() {
        if (collections == null || collections.isEmpty()) {
            throw new IllegalArgumentException("collections is required");
        }
        if (collections.stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new IllegalArgumentException("collection names must not be blank");
        }
    }

    public CacheBehavior getCacheBehaviorOrDefault() {
        return cacheBehavior != null ? cacheBehavior : CacheBehavior.USE;
    }
}
