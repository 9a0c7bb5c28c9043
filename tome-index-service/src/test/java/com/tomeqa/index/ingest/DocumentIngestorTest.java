package com.tomeqa.index.ingest;

import com.tomeqa.index.blob.InMemoryBlobStore;
import com.tomeqa.index.chunk.ChunkingStrategy;
import com.tomeqa.index.chunk.RecursiveTextSplitter;
import com.tomeqa.index.config.IndexContext;
import com.tomeqa.index.embed.FakeEmbeddingsClient;
import com.tomeqa.index.exception.MalformedDocumentException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.FontSpan;
import com.tomeqa.index.model.Page;
import com.tomeqa.index.model.SourceDocument;
import com.tomeqa.index.model.TextBlock;
import com.tomeqa.index.model.TextLine;
import com.tomeqa.index.search.HybridIndex;
import com.tomeqa.index.store.memory.InMemoryIndexServiceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentIngestorTest {

    private static final String BODY = "Creatures that take damage from this effect must make a saving throw "
            + "against the caster's spell save DC or fall prone.";

    private InMemoryIndexServiceClient store;
    private FakeEmbeddingsClient embeddings;
    private IndexContext context;
    private DocumentIngestor ingestor;
    private HybridIndex pages;

    @BeforeEach
    void setUp() {
        store = new InMemoryIndexServiceClient();
        embeddings = new FakeEmbeddingsClient(4);
        context = new IndexContext(embeddings, store, new InMemoryBlobStore(), 4);
        ingestor = new DocumentIngestor(context, Runnable::run, DocumentIngestor.DEFAULT_EMBED_BATCH_SIZE,
                new RecursiveTextSplitter());
        store.createCollection("pages_temp_1", 4);
        pages = new HybridIndex(context, "pages_temp_1");
    }

    private static TextBlock block(double size, int flags, String text) {
        return new TextBlock(List.of(new TextLine(List.of(new FontSpan("Serif", size, flags, text)))));
    }

    private static Page textPage(String id, int number, String text, String imageUrl) {
        return new Page(id, number, text, 3, List.of(), imageUrl);
    }

    private List<Chunk> stored(String collection) {
        return store.scroll(collection, Map.of(), 100).stream()
                .sorted(Comparator.comparingInt(Chunk::originPage))
                .toList();
    }

    private Map<String, HybridIndex> pagesTarget() {
        return Map.of("pages", pages);
    }

    private Map<String, ChunkingStrategy> perPage() {
        return Map.of("pages", ChunkingStrategy.PAGE);
    }

    @Nested
    @DisplayName("Payload metadata")
    class Metadata {

        @Test
        @DisplayName("Should write source, location and document metadata onto every page")
        void shouldWritePageMetadata() {
            SourceDocument document = new SourceDocument("rules/phb", "h1", List.of(
                    textPage("rules/phb", 1, "Introduction", null),
                    textPage("rules/phb", 2, "Races", "img/2.png"),
                    textPage("rules/phb", 3, "Classes", null)), Map.of("edition", "5e"));

            DocumentIngestor.Result result = ingestor.ingest(document, pagesTarget(), perPage(), Optional.empty(), true);

            assertThat(result.pointsByBase()).containsEntry("pages", 3);
            assertThat(result.pageImageUrls()).containsOnly(Map.entry(2, "img/2.png"));
            List<Chunk> chunks = stored("pages_temp_1");
            assertThat(chunks).hasSize(3);
            assertThat(chunks.get(0).metadata())
                    .containsEntry("source", "rules/phb")
                    .containsEntry("filename", "phb")
                    .containsEntry("folder", "rules")
                    .containsEntry("page", 1)
                    .containsEntry("total_pages", 3)
                    .containsEntry("type", "pdf")
                    .containsEntry("edition", "5e")
                    .containsKey("processed_at")
                    .doesNotContainKey("image_url");
            assertThat(chunks.get(1).metadata()).containsEntry("image_url", "img/2.png");
        }

        @Test
        @DisplayName("Should carry the heading context of earlier pages forward")
        void shouldAttachHeadingContext() {
            SourceDocument document = new SourceDocument("phb", "h1", List.of(
                    new Page("phb", 1, null, 3, List.of(block(24, 16, "Combat"), block(11, 0, BODY))),
                    new Page("phb", 2, null, 3, List.of(block(24, 16, "Spellcasting"), block(11, 0, BODY))),
                    new Page("phb", 3, null, 3, List.of(block(11, 0, BODY)))), Map.of());

            ingestor.ingest(document, pagesTarget(), perPage(), Optional.empty(), true);

            List<Chunk> chunks = stored("pages_temp_1");
            assertThat(chunks.get(0).metadata()).containsEntry("h1", "Combat").containsEntry("section", "Combat");
            assertThat(chunks.get(2).metadata()).containsEntry("section", "Spellcasting");
            assertThat(chunks.get(2).headingContext().headingPath()).containsExactly("Spellcasting");
        }

        @Test
        @DisplayName("Should skip pages without text")
        void shouldSkipEmptyPages() {
            SourceDocument document = new SourceDocument("phb", "h1", List.of(
                    textPage("phb", 1, "Introduction", null),
                    textPage("phb", 2, "   ", null)), Map.of());

            DocumentIngestor.Result result = ingestor.ingest(document, pagesTarget(), perPage(), Optional.empty(), true);

            assertThat(result.totalPoints()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Processing history")
    class History {

        private final ProcessingHistoryStore.DocumentHistory previous = new ProcessingHistoryStore.DocumentHistory(
                "same-hash", "2024-01-01T00:00:00Z",
                Map.of("1", new ProcessingHistoryStore.PageHistory("img/cached-1.png", "2024-01-01T00:00:00Z")));

        @Test
        @DisplayName("Should reuse recorded page images for an unchanged document")
        void shouldReuseImagesWhenUnchanged() {
            SourceDocument document = new SourceDocument("phb", "same-hash",
                    List.of(textPage("phb", 1, "Introduction", null)), Map.of());

            DocumentIngestor.Result result = ingestor.ingest(document, pagesTarget(), perPage(), Optional.of(previous), true);

            assertThat(result.unchanged()).isTrue();
            assertThat(result.pageImageUrls()).containsEntry(1, "img/cached-1.png");
            assertThat(stored("pages_temp_1").get(0).metadata()).containsEntry("image_url", "img/cached-1.png");
        }

        @Test
        @DisplayName("Should ignore history when the hash changed or history is disabled")
        void shouldIgnoreStaleHistory() {
            SourceDocument changed = new SourceDocument("phb", "new-hash",
                    List.of(textPage("phb", 1, "Introduction", null)), Map.of());

            assertThat(ingestor.ingest(changed, pagesTarget(), perPage(), Optional.of(previous), true).unchanged())
                    .isFalse();

            SourceDocument same = new SourceDocument("phb", "same-hash",
                    List.of(textPage("phb", 1, "Introduction", null)), Map.of());
            DocumentIngestor.Result result = ingestor.ingest(same, pagesTarget(), perPage(), Optional.of(previous), false);
            assertThat(result.unchanged()).isFalse();
            assertThat(result.pageImageUrls()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Targets and failures")
    class Targets {

        @Test
        @DisplayName("Should write every target with its own chunking strategy")
        void shouldWriteEveryTarget() {
            store.createCollection("semantic_temp_1", 4);
            HybridIndex semantic = new HybridIndex(context, "semantic_temp_1");
            SourceDocument document = new SourceDocument("phb", "h1", List.of(
                    textPage("phb", 1, "Short first page.", null),
                    textPage("phb", 2, "Short second page.", null)), Map.of());

            DocumentIngestor.Result result = ingestor.ingest(document,
                    Map.of("pages", pages, "semantic", semantic),
                    Map.of("pages", ChunkingStrategy.PAGE, "semantic", ChunkingStrategy.CROSS_PAGE),
                    Optional.empty(), true);

            assertThat(result.pointsByBase()).containsEntry("pages", 2).containsEntry("semantic", 1);
            assertThat(stored("semantic_temp_1").get(0).metadata()).containsEntry("end_page", 2);
        }

        @Test
        @DisplayName("Should reject documents without pages or without any valid page number")
        void shouldRejectMalformedDocuments() {
            SourceDocument noPages = new SourceDocument("phb", "h1", List.of(), Map.of());
            SourceDocument badPage = new SourceDocument("phb", "h1", List.of(textPage("phb", 0, "x", null)), Map.of());

            assertThatThrownBy(() -> ingestor.ingest(noPages, pagesTarget(), perPage(), Optional.empty(), true))
                    .isInstanceOf(MalformedDocumentException.class);
            assertThatThrownBy(() -> ingestor.ingest(badPage, pagesTarget(), perPage(), Optional.empty(), true))
                    .isInstanceOf(MalformedDocumentException.class);
        }

        @Test
        @DisplayName("Should skip pages with invalid numbers and keep the valid ones")
        void shouldSkipInvalidPages() {
            SourceDocument document = new SourceDocument("phb", "h1", List.of(
                    textPage("phb", 0, "Cover art", null),
                    textPage("phb", 1, "Introduction", null),
                    textPage("phb", 2, "Races", null)), Map.of());

            DocumentIngestor.Result result = ingestor.ingest(document, pagesTarget(), perPage(), Optional.empty(), true);

            assertThat(result.pointsByBase()).containsEntry("pages", 2);
            assertThat(stored("pages_temp_1")).extracting(Chunk::originPage).containsExactly(1, 2);
            assertThat(stored("pages_temp_1")).extracting(Chunk::text).doesNotContain("Cover art");
        }

        @Test
        @DisplayName("Should surface embedding failures unchanged")
        void shouldPropagateEmbeddingFailure() {
            embeddings.failOnTextContaining("Introduction");
            SourceDocument document = new SourceDocument("phb", "h1",
                    List.of(textPage("phb", 1, "Introduction", null)), Map.of());

            assertThatThrownBy(() -> ingestor.ingest(document, pagesTarget(), perPage(), Optional.empty(), true))
                    .isInstanceOf(TransientStoreException.class);
            assertThat(store.count("pages_temp_1")).isZero();
        }
    }

    @Test
    @DisplayName("Should keep input order when batches are embedded in parallel")
    void shouldEmbedBatchesInOrder() {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            DocumentIngestor parallel = new DocumentIngestor(context, pool, 2, new RecursiveTextSplitter());
            List<String> texts = List.of("alpha", "beta", "gamma", "delta", "epsilon");

            List<float[]> vectors = parallel.embedAll(texts);

            assertThat(vectors).hasSize(5);
            for (int i = 0; i < texts.size(); i++) {
                assertThat(vectors.get(i)).containsExactly(embeddings.embed(texts.get(i)));
            }
            assertThat(embeddings.batchCalls()).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should derive file name and folder from the document id")
    void shouldDeriveFileNameAndFolder() {
        assertThat(DocumentIngestor.filename("rules/core/phb.pdf")).isEqualTo("phb.pdf");
        assertThat(DocumentIngestor.folder("rules/core/phb.pdf")).isEqualTo("rules/core");
        assertThat(DocumentIngestor.folder("phb.pdf")).isEqualTo(".");
    }
}
