package com.tomeqa.index.chunk;

/**
 * How a base collection is populated: overlapping passages across page boundaries, or one
 * point per page.
 */
public enum ChunkingStrategy {
    CROSS_PAGE,
    PAGE;

    public DocumentChunker newChunker(RecursiveTextSplitter splitter) {
        return this == CROSS_PAGE ? new CrossPageChunker(splitter) : new PerPageChunker();
    }
}
