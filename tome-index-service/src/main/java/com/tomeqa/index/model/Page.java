package com.tomeqa.index.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One physical page of a source document. Page numbers are 1-based.
 *
 * @param imageUrl rendered preview of the page, when the parser produced one
 */
public record Page(String documentId, int pageNumber, String rawText, int totalPages, List<TextBlock> blocks,
                   String imageUrl) {

    public Page {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public Page(String documentId, int pageNumber, String rawText, int totalPages, List<TextBlock> blocks) {
        this(documentId, pageNumber, rawText, totalPages, blocks, null);
    }

    /**
     * The raw text when the parser supplied one, otherwise the layout lines joined by newlines.
     */
    public String text() {
        if (rawText != null && !rawText.isBlank()) {
            return rawText.strip();
        }
        return blocks.stream()
                .flatMap(b -> b.lines().stream())
                .map(TextLine::text)
                .collect(Collectors.joining("\n"))
                .strip();
    }
}
