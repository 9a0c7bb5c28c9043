package com.tomeqa.index.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded passage of document text with its provenance. Immutable.
 */
public record Chunk(
        String text,
        String sourceDocumentId,
        int originPage,
        int chunkIndex,
        int chunkCount,
        HeadingContext headingContext,
        Map<String, Object> metadata
) {

    public Chunk {
        text = text == null ? "" : text;
        headingContext = headingContext == null ? HeadingContext.EMPTY : headingContext;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isCrossPage() {
        return Boolean.TRUE.equals(metadata.get(MetadataKeys.CROSS_PAGE));
    }

    /**
     * Index payload: {@code {"text": ..., "metadata": {...}}}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", text);
        payload.put("metadata", metadata);
        return payload;
    }

    @SuppressWarnings("unchecked")
    public static Chunk fromPayload(Map<String, Object> payload) {
        Object text = payload.get("text");
        Object rawMetadata = payload.get("metadata");
        Map<String, Object> metadata = rawMetadata instanceof Map<?, ?> m
                ? (Map<String, Object>) m
                : Map.of();
        Object documentId = metadata.getOrDefault(MetadataKeys.DOCUMENT_ID, metadata.get(MetadataKeys.SOURCE));
        return new Chunk(
                text != null ? text.toString() : "",
                documentId != null ? documentId.toString() : null,
                intValue(metadata.get(MetadataKeys.PAGE), 0),
                intValue(metadata.get(MetadataKeys.CHUNK_INDEX), 0),
                intValue(metadata.get(MetadataKeys.CHUNK_COUNT), 1),
                HeadingContext.fromMetadata(metadata),
                metadata);
    }

    public static int intValue(Object value, int fallback) {
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
