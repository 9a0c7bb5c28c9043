package com.tomeqa.index.ingest;

/**
 * How a rebuild treats the processing history of earlier runs.
 */
public enum CacheBehavior {
    /** Reuse recorded page assets of documents whose content hash is unchanged. */
    USE,
    /** Ignore recorded history and record everything again. */
    REBUILD,
    /** Clear the history before the run. */
    RESET
}
