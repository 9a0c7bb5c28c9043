package com.tomeqa.index.search;

import com.tomeqa.index.blob.InMemoryBlobStore;
import com.tomeqa.index.config.IndexContext;
import com.tomeqa.index.embed.EmbeddingsClient;
import com.tomeqa.index.exception.IndexWriteException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.HeadingContext;
import com.tomeqa.index.model.IndexPoint;
import com.tomeqa.index.model.ScoredChunk;
import com.tomeqa.index.store.memory.InMemoryIndexServiceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class HybridIndexTest {

    private InMemoryIndexServiceClient store;
    private IndexContext context;
    private HybridIndex index;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryIndexServiceClient());
        context = new IndexContext(mock(EmbeddingsClient.class), store, new InMemoryBlobStore(), 3);
        store.createCollection("spells", 3);
        index = new HybridIndex(context, "spells");
    }

    private static Chunk chunk(String text, int page) {
        Map<String, Object> metadata = Map.of("source", "phb.pdf", "page", page);
        return new Chunk(text, "phb", page, 0, 1, HeadingContext.EMPTY, metadata);
    }

    private static List<float[]> vectors(int n, float[] vector) {
        return new ArrayList<>(Collections.nCopies(n, vector));
    }

    private List<IndexPoint> points(int n) {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            chunks.add(chunk("passage number " + i, i + 1));
        }
        return index.toPoints(chunks, vectors(n, new float[]{1, 0, 0}));
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("Should write points in batches of one hundred")
        void shouldUpsertInBatches() {
            int written = index.upsert(points(250));

            assertThat(written).isEqualTo(250);
            verify(store, times(3)).upsert(eq("spells"), anyList());
            assertThat(index.count()).isEqualTo(250);
            assertThat(index.lexicalSize()).isEqualTo(250);
        }

        @Test
        @DisplayName("Should report how many points were committed before a batch failed")
        void shouldReportCommittedCountOnFailure() {
            List<IndexPoint> points = points(250);
            doCallRealMethod()
                    .doThrow(new TransientStoreException("connection reset", false))
                    .when(store).upsert(eq("spells"), anyList());

            assertThatThrownBy(() -> index.upsert(points))
                    .isInstanceOfSatisfying(IndexWriteException.class,
                            e -> assertThat(e.getCommittedCount()).isEqualTo(100));
            assertThat(index.lexicalSize()).isEqualTo(100);
        }

        @Test
        @DisplayName("Should continue point ids from the collection's current count")
        void shouldSeedIdsFromCount() {
            store.upsert("spells", List.of(
                    new IndexPoint(0, new float[]{1, 0, 0}, chunk("existing a", 1)),
                    new IndexPoint(1, new float[]{1, 0, 0}, chunk("existing b", 2))));

            List<IndexPoint> first = index.toPoints(List.of(chunk("new a", 3), chunk("new b", 4)),
                    vectors(2, new float[]{0, 1, 0}));
            List<IndexPoint> second = index.toPoints(List.of(chunk("new c", 5)), vectors(1, new float[]{0, 1, 0}));

            assertThat(first).extracting(IndexPoint::id).containsExactly(2L, 3L);
            assertThat(second).extracting(IndexPoint::id).containsExactly(4L);
        }

        @Test
        @DisplayName("Should reject vectors of the wrong size or count")
        void shouldValidateVectors() {
            List<Chunk> chunks = List.of(chunk("a", 1));

            assertThatThrownBy(() -> index.toPoints(chunks, List.of(new float[]{1, 0})))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("dimension");
            assertThatThrownBy(() -> index.toPoints(chunks, List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("Should overfetch dense candidates and keep the best ones")
        void shouldOverfetchDenseCandidates() {
            List<Chunk> chunks = List.of(chunk("north", 1), chunk("east", 2), chunk("up", 3));
            index.upsert(index.toPoints(chunks, List.of(
                    new float[]{1, 0, 0}, new float[]{0.7f, 0.7f, 0}, new float[]{0, 0, 1})));
            float[] query = {1, 0, 0};

            List<ScoredChunk> hits = index.denseSearch(query, 2);

            verify(store).search("spells", query, 2 * HybridIndex.DENSE_OVERFETCH);
            assertThat(hits).extracting(h -> h.chunk().text()).containsExactly("north", "east");
        }

        @Test
        @DisplayName("Should score lexical hits by rank")
        void shouldScoreLexicalHitsByRank() {
            List<Chunk> chunks = List.of(
                    chunk("fireball deals fire damage", 1),
                    chunk("magic missile always hits", 2),
                    chunk("fireball radius twenty feet wide and tall", 3));
            index.upsert(index.toPoints(chunks, vectors(3, new float[]{1, 0, 0})));

            List<ScoredChunk> hits = index.lexicalSearch("fireball", 10);

            assertThat(hits).extracting(ScoredChunk::score).containsExactly(1.0, 0.5);
            assertThat(hits.get(0).chunk().text()).isEqualTo("fireball deals fire damage");
        }

        @Test
        @DisplayName("Should filter stored chunks by exact metadata")
        void shouldLookUpByMetadata() {
            index.upsert(index.toPoints(List.of(chunk("page one", 1), chunk("page two", 2)),
                    vectors(2, new float[]{1, 0, 0})));

            assertThat(index.getByExactMetadata(Map.of("source", "phb.pdf", "page", 2), 10))
                    .extracting(Chunk::text).containsExactly("page two");
        }

        @Test
        @DisplayName("Should load the lexical corpus back from the index service")
        void shouldWarmLexicalIndex() {
            store.upsert("spells", List.of(new IndexPoint(0, new float[]{1, 0, 0}, chunk("owlbear lair", 1))));

            assertThat(index.lexicalSize()).isZero();
            assertThat(index.warmLexicalIndex(HybridIndex.DEFAULT_WARMUP_LIMIT)).isEqualTo(1);
            assertThat(index.lexicalSearch("owlbear", 5)).hasSize(1);
        }

        @Test
        @DisplayName("Should warm the whole collection by default and honour an explicit cap")
        void shouldWarmWholeCollection() {
            List<IndexPoint> stored = new ArrayList<>();
            for (int i = 0; i < 12_000; i++) {
                stored.add(new IndexPoint(i, new float[]{1, 0, 0}, chunk("entry " + i + (i == 11_999 ? " tarrasque" : ""), i)));
            }
            store.upsert("spells", stored);

            HybridIndex fresh = new HybridIndex(context, "spells");
            assertThat(fresh.warmLexicalIndex(HybridIndex.DEFAULT_WARMUP_LIMIT)).isEqualTo(12_000);
            assertThat(fresh.lexicalSearch("tarrasque", 5)).hasSize(1);

            assertThat(fresh.warmLexicalIndex(500)).isEqualTo(500);
            assertThat(fresh.lexicalSize()).isEqualTo(500);
        }

        @Test
        @DisplayName("Should share the lexical index with a view under another name")
        void shouldShareStateAcrossRebind() {
            index.upsert(points(3));

            HybridIndex live = index.rebind("spells_live");

            assertThat(live.collection()).isEqualTo("spells_live");
            assertThat(live.lexicalSize()).isEqualTo(3);
            assertThat(live.lexicalSearch("passage", 5)).hasSize(3);
        }
    }
}
