package com.tomeqa.index.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tomeqa.index.exception.MalformedDocumentException;
import com.tomeqa.index.exception.TransientStoreException;
import com.tomeqa.index.json.Json;
import com.tomeqa.index.model.FontSpan;
import com.tomeqa.index.model.Page;
import com.tomeqa.index.model.SourceDocument;
import com.tomeqa.index.model.TextBlock;
import com.tomeqa.index.model.TextLine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads page-layout JSON files written by the document parser, one file per source document:
 * <pre>
 * {"documentId": "...", "contentHash": "...", "metadata": {...},
 *  "pages": [{"pageNumber": 1, "text": "...", "imageUrl": "...",
 *             "blocks": [{"lines": [{"spans": [{"font": "...", "size": 12.0, "flags": 0, "text": "..."}]}]}]}]}
 * </pre>
 * Document ids default to the file path relative to the root, without the {@code .json} suffix.
 * The content hash defaults to the SHA-256 of the file.
 */
@Slf4j
public class JsonDirectoryIngestionSource implements IngestionSource {

    private static final String SUFFIX = ".json";

    private final Path root;

    public JsonDirectoryIngestionSource(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public List<String> listDocumentIds() {
        if (!Files.isDirectory(root)) {
            log.warn("[INGEST] Source directory {} does not exist", root);
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .map(this::toDocumentId)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new TransientStoreException("Cannot list " + root, false, e);
        }
    }

    @Override
    public SourceDocument load(String documentId) {
        Path file = root.resolve(documentId + SUFFIX).normalize();
        if (!file.startsWith(root) || !Files.isRegularFile(file)) {
            throw new MalformedDocumentException(documentId, "No layout file for " + documentId);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new TransientStoreException("Cannot read " + file, false, e);
        }

        JsonNode root;
        try {
            root = Json.MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new MalformedDocumentException(documentId, "Invalid JSON in " + file.getFileName(), e);
        }
        if (root == null || !root.path("pages").isArray()) {
            throw new MalformedDocumentException(documentId, "Layout file has no pages array");
        }

        String id = root.path("documentId").asText(documentId);
        String hash = root.hasNonNull("contentHash") ? root.get("contentHash").asText() : sha256(bytes);
        Map<String, Object> metadata = new LinkedHashMap<>();
        root.path("metadata").fields().forEachRemaining(e -> {
            if (!e.getValue().isNull()) {
                metadata.put(e.getKey(), Json.MAPPER.convertValue(e.getValue(), Object.class));
            }
        });

        JsonNode pagesNode = root.get("pages");
        int totalPages = root.path("totalPages").asInt(pagesNode.size());
        List<Page> pages = new ArrayList<>(pagesNode.size());
        for (int i = 0; i < pagesNode.size(); i++) {
            JsonNode p = pagesNode.get(i);
            int pageNumber = p.path("pageNumber").asInt(i + 1);
            pages.add(new Page(
                    id,
                    pageNumber,
                    p.hasNonNull("text") ? p.get("text").asText() : null,
                    totalPages,
                    readBlocks(p.path("blocks")),
                    p.hasNonNull("imageUrl") ? p.get("imageUrl").asText() : null));
        }
        return new SourceDocument(id, hash, pages, metadata);
    }

    private static List<TextBlock> readBlocks(JsonNode blocksNode) {
        List<TextBlock> blocks = new ArrayList<>();
        for (JsonNode b : blocksNode) {
            List<TextLine> lines = new ArrayList<>();
            for (JsonNode l : b.path("lines")) {
                List<FontSpan> spans = new ArrayList<>();
                for (JsonNode s : l.path("spans")) {
                    spans.add(new FontSpan(
                            s.path("font").asText("unknown"),
                            s.path("size").asDouble(),
                            s.path("flags").asInt(),
                            s.path("text").asText("")));
                }
                lines.add(new TextLine(spans));
            }
            blocks.add(new TextBlock(lines));
        }
        return blocks;
    }

    private String toDocumentId(Path file) {
        String relative = root.relativize(file).toString().replace('\\', '/');
        return relative.substring(0, relative.length() - SUFFIX.length());
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
