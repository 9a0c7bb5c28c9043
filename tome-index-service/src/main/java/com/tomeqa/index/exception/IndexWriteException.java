package com.tomeqa.index.exception;

/**
 * A batched upsert failed part-way. {@link #getCommittedCount()} points were written
 * before the failing batch; the caller decides whether to retry the remainder.
 */
public class IndexWriteException extends IndexException {

    private final int committedCount;

    public IndexWriteException(String collection, int committedCount, Throwable cause) {
        super("Upsert into " + collection + " failed after " + committedCount + " committed points", cause);
        this.committedCount = committedCount;
    }

    public int getCommittedCount() {
        return committedCount;
    }
}
