package com.tomeqa.index.model;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * A parsed document as handed over by the ingestion collaborator.
 *
 * @param documentId  stable source key, e.g. the object key of the PDF
 * @param contentHash hash of the source bytes, used to detect unchanged documents
 * @param pages       pages in page order
 * @param metadata    document-level metadata copied onto every page
 */
public record SourceDocument(String documentId, String contentHash, List<Page> pages, Map<String, Object> metadata) {

    public SourceDocument {
        pages = pages == null ? List.of() : pages.stream()
                .sorted(Comparator.comparingInt(Page::pageNumber))
                .toList();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public int totalPages() {
        return pages.isEmpty() ? 0 : pages.stream().mapToInt(Page::totalPages).max().orElse(pages.size());
    }
}
