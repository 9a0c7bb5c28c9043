package com.tomeqa.index.chunk;

import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.HeadingContext;
import com.tomeqa.index.model.MetadataKeys;
import com.tomeqa.index.model.PageText;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One chunk per non-empty page, used for full-page collections.
 */
public class PerPageChunker implements DocumentChunker {

    @Override
    public List<Chunk> chunk(String documentId, List<PageText> pages) {
        if (pages == null) {
            return List.of();
        }
        return pages.stream()
                .filter(p -> !p.text().isBlank())
                .sorted(Comparator.comparingInt(PageText::pageNumber))
                .map(p -> toChunk(documentId, p))
                .toList();
    }

    private static Chunk toChunk(String documentId, PageText page) {
        Map<String, Object> metadata = new LinkedHashMap<>(page.metadata());
        metadata.put(MetadataKeys.DOCUMENT_ID, documentId);
        metadata.put(MetadataKeys.PAGE, page.pageNumber());
        metadata.put(MetadataKeys.END_PAGE, page.pageNumber());
        metadata.put(MetadataKeys.CHUNK_INDEX, 0);
        metadata.put(MetadataKeys.CHUNK_COUNT, 1);
        metadata.put(MetadataKeys.CROSS_PAGE, false);
        return new Chunk(page.text().strip(), documentId, page.pageNumber(), 0, 1,
                HeadingContext.fromMetadata(metadata), metadata);
    }
}
