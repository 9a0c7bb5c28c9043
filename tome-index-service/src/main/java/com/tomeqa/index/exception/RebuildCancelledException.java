package com.tomeqa.index.exception;

public class RebuildCancelledException extends IndexException {

    public RebuildCancelledException(String runId) {
        super("Rebuild run " + runId + " was cancelled");
    }
}
