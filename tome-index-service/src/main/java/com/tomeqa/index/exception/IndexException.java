package com.tomeqa.index.exception;

/**
 * Root of the indexing and retrieval error hierarchy.
 */
public class IndexException extends RuntimeException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
