package com.tomeqa.index.model;

import java.util.Map;

/**
 * Chunker input: the extracted text of one page plus the metadata every chunk starting on it inherits.
 */
public record PageText(String text, int pageNumber, Map<String, Object> metadata) {

    public PageText {
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
