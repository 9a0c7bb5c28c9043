package com.tomeqa.index.chunk;

import com.tomeqa.index.chunk.RecursiveTextSplitter.TextSpan;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.HeadingContext;
import com.tomeqa.index.model.MetadataKeys;
import com.tomeqa.index.model.PageText;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a whole document across page boundaries while remembering where each chunk came from.
 * <p>
 * Pages are concatenated with a paragraph separator and the start offset of every page is
 * recorded. A chunk's origin page is the page with the largest start offset not after the
 * chunk's own start, i.e. the page the chunk begins on. Chunks inherit that page's metadata.
 */
@Slf4j
public class CrossPageChunker implements DocumentChunker {

    static final String PAGE_SEPARATOR = "\n\n";

    private final RecursiveTextSplitter splitter;

    public CrossPageChunker() {
        this(new RecursiveTextSplitter());
    }

    public CrossPageChunker(RecursiveTextSplitter splitter) {
        this.splitter = splitter;
    }

    @Override
    public List<Chunk> chunk(String documentId, List<PageText> pages) {
        if (pages == null || pages.isEmpty()) {
            return List.of();
        }
        List<PageText> ordered = pages.stream()
                .filter(p -> !p.text().isBlank())
                .sorted(Comparator.comparingInt(PageText::pageNumber))
                .toList();
        if (ordered.isEmpty()) {
            return List.of();
        }

        StringBuilder combined = new StringBuilder();
        int[] pageStarts = new int[ordered.size()];
        for (int i = 0; i < ordered.size(); i++) {
            pageStarts[i] = combined.length();
            combined.append(ordered.get(i).text());
            if (!endsWithSeparator(combined)) {
                combined.append(PAGE_SEPARATOR);
            }
        }

        List<TextSpan> spans = splitter.split(combined.toString());
        List<Chunk> chunks = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            TextSpan span = spans.get(i);
            PageText origin = ordered.get(pageAt(pageStarts, span.start()));
            PageText last = ordered.get(pageAt(pageStarts, span.end() - 1));

            Map<String, Object> metadata = new LinkedHashMap<>(origin.metadata());
            metadata.put(MetadataKeys.DOCUMENT_ID, documentId);
            metadata.put(MetadataKeys.PAGE, origin.pageNumber());
            metadata.put(MetadataKeys.END_PAGE, last.pageNumber());
            metadata.put(MetadataKeys.CHUNK_INDEX, i);
            metadata.put(MetadataKeys.CHUNK_COUNT, spans.size());
            metadata.put(MetadataKeys.CROSS_PAGE, true);

            chunks.add(new Chunk(
                    span.text(),
                    documentId,
                    origin.pageNumber(),
                    i,
                    spans.size(),
                    HeadingContext.fromMetadata(metadata),
                    metadata));
        }

        log.debug("[CHUNK] {}: {} pages -> {} cross-page chunks", documentId, ordered.size(), chunks.size());
        return chunks;
    }

    /**
     * Index of the page whose start offset is the largest one {@code <= offset}.
     */
    static int pageAt(int[] pageStarts, int offset) {
        int lo = 0;
        int hi = pageStarts.length - 1;
        int found = 0;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (pageStarts[mid] <= offset) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }

    private static boolean endsWithSeparator(StringBuilder sb) {
        int n = sb.length();
        return n >= 2 && sb.charAt(n - 2) == '\n' && sb.charAt(n - 1) == '\n';
    }
}
