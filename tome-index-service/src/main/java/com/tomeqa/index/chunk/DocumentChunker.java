package com.tomeqa.index.chunk;

import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.PageText;

import java.util.List;

/**
 * Turns the pages of one document into index chunks.
 */
public interface DocumentChunker {

    List<Chunk> chunk(String documentId, List<PageText> pages);
}
