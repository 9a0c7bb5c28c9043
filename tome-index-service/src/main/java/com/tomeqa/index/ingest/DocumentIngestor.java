package com.tomeqa.index.ingest;

import com.tomeqa.index.chunk.ChunkingStrategy;
import com.tomeqa.index.chunk.DocumentChunker;
import com.tomeqa.index.chunk.RecursiveTextSplitter;
import com.tomeqa.index.config.IndexContext;
import com.tomeqa.index.exception.IndexServiceException;
import com.tomeqa.index.exception.MalformedDocumentException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.HeadingContext;
import com.tomeqa.index.model.IndexPoint;
import com.tomeqa.index.model.MetadataKeys;
import com.tomeqa.index.model.Page;
import com.tomeqa.index.model.PageText;
import com.tomeqa.index.model.SourceDocument;
import com.tomeqa.index.search.HybridIndex;
import com.tomeqa.index.structure.PageSampler;
import com.tomeqa.index.structure.StructureAnalyzer;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one document through structure analysis, chunking, embedding and upsert into the
 * staged index of every target base.
 * <p>
 * Holds a {@link StructureAnalyzer}, so an instance serves one rebuild run and documents
 * must be ingested one at a time.
 */
@Slf4j
public class DocumentIngestor {

    public static final int DEFAULT_EMBED_BATCH_SIZE = 32;
    static final String DEFAULT_TYPE = "pdf";

    private final IndexContext context;
    private final Executor embedExecutor;
    private final int embedBatchSize;
    private final RecursiveTextSplitter splitter;
    private final StructureAnalyzer analyzer = new StructureAnalyzer();

    /**
     * Outcome for one document.
     *
     * @param pointsByBase  points written per base collection
     * @param unchanged     the content hash matched the recorded history
     * @param pageImageUrls image URL per page number, as written to the payload
     */
    public record Result(String documentId, Map<String, Integer> pointsByBase, boolean unchanged,
                         Map<Integer, String> pageImageUrls) {

        public int totalPoints() {
            return pointsByBase.values().stream().mapToInt(Integer::intValue).sum();
        }
    }

    public DocumentIngestor(IndexContext context, Executor embedExecutor, int embedBatchSize,
                            RecursiveTextSplitter splitter) {
        if (embedBatchSize <= 0) {
            throw new IllegalArgumentException("embedBatchSize must be > 0");
        }
        this.context = context;
        this.embedExecutor = embedExecutor;
        this.embedBatchSize = embedBatchSize;
        this.splitter = splitter;
    }

    /**
     * @param targets    staged index per base collection
     * @param strategies chunking strategy per base; bases without one use {@link ChunkingStrategy#CROSS_PAGE}
     * @param previous   recorded history of the document, consulted only when {@code useHistory}
     */
    public Result ingest(SourceDocument document,
                         Map<String, HybridIndex> targets,
                         Map<String, ChunkingStrategy> strategies,
                         Optional<ProcessingHistoryStore.DocumentHistory> previous,
                         boolean useHistory) {
        validate(document);
        long startTime = System.currentTimeMillis();

        boolean unchanged = useHistory && previous
                .map(h -> h.hash() != null && h.hash().equals(document.contentHash()))
                .orElse(false);
        Optional<ProcessingHistoryStore.DocumentHistory> reusable = unchanged ? previous : Optional.empty();

        Map<Integer, String> imageUrls = new LinkedHashMap<>();
        List<PageText> pages = preparePages(document, reusable, imageUrls);
        if (pages.isEmpty()) {
            log.warn("[INGEST] {} has no extractable text", document.documentId());
        }

        Map<String, Integer> pointsByBase = new LinkedHashMap<>();
        for (Map.Entry<String, HybridIndex> target : targets.entrySet()) {
            ChunkingStrategy strategy = strategies.getOrDefault(target.getKey(), ChunkingStrategy.CROSS_PAGE);
            DocumentChunker chunker = strategy.newChunker(splitter);
            List<Chunk> chunks = chunker.chunk(document.documentId(), pages);
            int written = chunks.isEmpty() ? 0 : write(target.getValue(), chunks);
            pointsByBase.put(target.getKey(), written);
        }

        log.info("[INGEST] {}: {} pages, points {} in {}ms{}", document.documentId(), pages.size(), pointsByBase,
                System.currentTimeMillis() - startTime, unchanged ? " (unchanged, reused page images)" : "");
        return new Result(document.documentId(), pointsByBase, unchanged, imageUrls);
    }

    /**
     * Structure pass over sampled pages, then per page: headings, text and payload metadata.
     * Pages without text or with an invalid page number are skipped.
     */
    List<PageText> preparePages(SourceDocument document,
                                Optional<ProcessingHistoryStore.DocumentHistory> reusable,
                                Map<Integer, String> imageUrlsOut) {
        List<Page> pages = usablePages(document);
        int totalPages = Math.max(document.totalPages(), pages.size());

        analyzer.resetForDocument(document.documentId());
        for (int index : PageSampler.samplePages(pages.size(), PageSampler.DEFAULT_SAMPLE_SIZE)) {
            analyzer.analyzePage(pages.get(index));
        }
        analyzer.determineHeadingLevels(StructureAnalyzer.DEFAULT_MIN_PAGES_SEEN);

        String filename = filename(document.documentId());
        String folder = folder(document.documentId());
        List<PageText> out = new ArrayList<>();
        for (Page page : pages) {
            analyzer.processPageHeadings(page);
            HeadingContext heading = analyzer.currentContext();
            String text = page.text();
            if (text.isEmpty()) {
                continue;
            }

            String imageUrl = page.imageUrl();
            if (imageUrl == null) {
                imageUrl = reusable.flatMap(h -> h.imageUrl(page.pageNumber())).orElse(null);
            }
            if (imageUrl != null) {
                imageUrlsOut.put(page.pageNumber(), imageUrl);
            }

            Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
            metadata.put(MetadataKeys.SOURCE, document.documentId());
            metadata.put(MetadataKeys.FILENAME, filename);
            metadata.put(MetadataKeys.PAGE, page.pageNumber());
            metadata.put(MetadataKeys.TOTAL_PAGES, totalPages);
            if (imageUrl != null) {
                metadata.put(MetadataKeys.IMAGE_URL, imageUrl);
            }
            metadata.putIfAbsent(MetadataKeys.TYPE, DEFAULT_TYPE);
            metadata.put(MetadataKeys.FOLDER, folder);
            metadata.put(MetadataKeys.PROCESSED_AT, Instant.now().toString());
            heading.writeTo(metadata);

            out.add(new PageText(text, page.pageNumber(), metadata));
        }
        return out;
    }

    private int write(HybridIndex index, List<Chunk> chunks) {
        List<float[]> vectors = embedAll(chunks.stream().map(Chunk::text).toList());
        List<IndexPoint> points = index.toPoints(chunks, vectors);
        return index.upsert(points);
    }

    /**
     * Embeds in batches that may run in parallel; results are joined in input order.
     */
    List<float[]> embedAll(List<String> texts) {
        List<CompletableFuture<List<float[]>>> futures = new ArrayList<>();
        for (int from = 0; from < texts.size(); from += embedBatchSize) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + embedBatchSize));
            futures.add(CompletableFuture.supplyAsync(() -> embedBatch(batch), embedExecutor));
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        try {
            for (CompletableFuture<List<float[]>> future : futures) {
                vectors.addAll(future.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new TransientStoreException("Embedding failed", false, e.getCause());
        }
        return vectors;
    }

    private List<float[]> embedBatch(List<String> batch) {
        List<float[]> vectors = context.embeddings().embedBatch(batch);
        if (vectors.size() != batch.size()) {
            throw new IndexServiceException("Embedding service returned " + vectors.size()
                    + " vectors for " + batch.size() + " texts", -1);
        }
        return vectors;
    }

    private static void validate(SourceDocument document) {
        if (document.documentId() == null || document.documentId().isBlank()) {
            throw new MalformedDocumentException(null, "Document without id");
        }
        if (document.pages().isEmpty()) {
            throw new MalformedDocumentException(document.documentId(), "Document has no pages");
        }
    }

    /**
     * Pages with a valid number. Invalid pages are logged and dropped; a document left without
     * any page is malformed.
     */
    private static List<Page> usablePages(SourceDocument document) {
        List<Page> usable = new ArrayList<>(document.pages().size());
        for (Page page : document.pages()) {
            if (page == null || page.pageNumber() < 1) {
                log.warn("[INGEST] Skipping page with invalid number {} in {}",
                        page == null ? null : page.pageNumber(), document.documentId());
                continue;
            }
            usable.add(page);
        }
        if (usable.isEmpty()) {
            throw new MalformedDocumentException(document.documentId(), "Document has no page with a valid number");
        }
        return usable;
    }

    static String filename(String documentId) {
        int slash = documentId.lastIndexOf('/');
        return slash >= 0 ? documentId.substring(slash + 1) : documentId;
    }

    static String folder(String documentId) {
        int slash = documentId.lastIndexOf('/');
        return slash > 0 ? documentId.substring(0, slash) : ".";
    }
}
