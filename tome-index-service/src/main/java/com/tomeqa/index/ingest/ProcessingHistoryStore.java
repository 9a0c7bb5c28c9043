package com.tomeqa.index.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tomeqa.index.blob.BlobStore;
import com.tomeqa.index.json.Json;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * What earlier runs recorded per source document: content hash, processing time and the
 * rendered page images. Kept as one JSON object in the blob store.
 * <p>
 * Load and save failures are logged and otherwise ignored; a missing or unreadable history
 * only means every document is treated as new.
 */
@Slf4j
public class ProcessingHistoryStore {

    public static final String HISTORY_KEY = "processing/pdf_process_history.json";

    private static final TypeReference<Map<String, DocumentHistory>> HISTORY_TYPE = new TypeReference<>() {};

    private final BlobStore blobStore;
    private final Map<String, DocumentHistory> entries = new ConcurrentHashMap<>();

    public record PageHistory(String imageUrl, String processed) {}

    public record DocumentHistory(String hash, String processed, Map<String, PageHistory> pages) {

        public DocumentHistory {
            pages = pages == null ? Map.of() : Map.copyOf(pages);
        }

        public Optional<String> imageUrl(int pageNumber) {
            return Optional.ofNullable(pages.get(String.valueOf(pageNumber))).map(PageHistory::imageUrl);
        }
    }

    public ProcessingHistoryStore(BlobStore blobStore) {
        this.blobStore = blobStore;
    }

    public void load() {
        entries.clear();
        try {
            Optional<byte[]> content = blobStore.get(HISTORY_KEY);
            if (content.isEmpty()) {
                log.info("[HISTORY] No processing history at {}, starting empty", HISTORY_KEY);
                return;
            }
            Map<String, DocumentHistory> loaded = Json.MAPPER.readValue(content.get(), HISTORY_TYPE);
            if (loaded != null) {
                entries.putAll(loaded);
            }
            log.info("[HISTORY] Loaded processing history for {} documents", entries.size());
        } catch (IOException | RuntimeException e) {
            log.warn("[HISTORY] Could not load processing history, starting empty: {}", e.getMessage());
            entries.clear();
        }
    }

    public boolean save() {
        try {
            blobStore.put(HISTORY_KEY, Json.MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new LinkedHashMap<>(entries)));
            log.info("[HISTORY] Saved processing history for {} documents", entries.size());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("[HISTORY] Failed to save processing history: {}", e.getMessage(), e);
            return false;
        }
    }

    public Optional<DocumentHistory> get(String documentId) {
        return Optional.ofNullable(entries.get(documentId));
    }

    /**
     * Replaces the entry of a document with its current hash and page images.
     */
    public void record(String documentId, String contentHash, Map<Integer, String> pageImageUrls) {
        String now = Instant.now().toString();
        Map<String, PageHistory> pages = new LinkedHashMap<>();
        pageImageUrls.forEach((page, url) -> pages.put(String.valueOf(page), new PageHistory(url, now)));
        entries.put(documentId, new DocumentHistory(contentHash, now, pages));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
