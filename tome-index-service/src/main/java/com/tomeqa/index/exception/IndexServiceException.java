package com.tomeqa.index.exception;

/**
 * The index service rejected a request (4xx) or answered with something unreadable.
 */
public class IndexServiceException extends IndexException {

    private final int statusCode;

    public IndexServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public IndexServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
