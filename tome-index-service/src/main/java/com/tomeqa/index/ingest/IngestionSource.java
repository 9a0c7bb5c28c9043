package com.tomeqa.index.ingest;

import com.tomeqa.index.model.SourceDocument;

import java.util.List;

/**
 * Supplies parsed documents for a rebuild.
 */
public interface IngestionSource {

    List<String> listDocumentIds();

    /**
     * @throws com.tomeqa.index.exception.MalformedDocumentException when the document cannot be read
     */
    SourceDocument load(String documentId);
}
