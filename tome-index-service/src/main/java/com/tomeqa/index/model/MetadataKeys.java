package com.tomeqa.index.model;

/**
 * Keys of the flat chunk metadata written to the index payload.
 */
public final class MetadataKeys {

    public static final String SOURCE = "source";
    public static final String DOCUMENT_ID = "document_id";
    public static final String FILENAME = "filename";
    public static final String FOLDER = "folder";
    public static final String TYPE = "type";
    public static final String PAGE = "page";
    public static final String END_PAGE = "end_page";
    public static final String TOTAL_PAGES = "total_pages";
    public static final String IMAGE_URL = "image_url";
    public static final String SECTION = "section";
    public static final String SUBSECTION = "subsection";
    public static final String HEADING_PATH = "heading_path";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String CHUNK_COUNT = "chunk_count";
    public static final String CROSS_PAGE = "cross_page";
    public static final String PROCESSED_AT = "processed_at";

    public static final String HEADING_PATH_SEPARATOR = " > ";

    private MetadataKeys() {}

    public static String headingKey(int level) {
        return "h" + level;
    }
}
