package com.tomeqa.index.chunk;

import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.PageText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PerPageChunkerTest {

    @Test
    @DisplayName("Should emit one chunk per non-empty page in page order")
    void shouldChunkPerPage() {
        List<PageText> pages = List.of(
                new PageText("Second page text", 2, Map.of("source", "phb.pdf")),
                new PageText("  First page text  ", 1, Map.of("source", "phb.pdf")),
                new PageText(" ", 3, Map.of()));

        List<Chunk> chunks = new PerPageChunker().chunk("phb", pages);

        assertThat(chunks).extracting(Chunk::text).containsExactly("First page text", "Second page text");
        Chunk second = chunks.get(1);
        assertThat(second.isCrossPage()).isFalse();
        assertThat(second.metadata())
                .containsEntry("page", 2)
                .containsEntry("end_page", 2)
                .containsEntry("chunk_index", 0)
                .containsEntry("chunk_count", 1)
                .containsEntry("source", "phb.pdf");
    }

    @Test
    @DisplayName("Should pick the chunker matching the strategy")
    void shouldCreateChunkerForStrategy() {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter();

        assertThat(ChunkingStrategy.PAGE.newChunker(splitter)).isInstanceOf(PerPageChunker.class);
        assertThat(ChunkingStrategy.CROSS_PAGE.newChunker(splitter)).isInstanceOf(CrossPageChunker.class);
    }
}
