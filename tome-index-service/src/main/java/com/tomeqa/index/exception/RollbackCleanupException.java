package com.tomeqa.index.exception;

public class RollbackCleanupException extends IndexException {

    public RollbackCleanupException(String collection, Throwable cause) {
        super("Failed to delete staged collection " + collection, cause);
    }
}
