package com.tomeqa.index.exception;

/**
 * Timeout, 5xx or I/O failure talking to the index, embedding or blob service.
 * Read paths retry these; write paths surface them.
 */
public class TransientStoreException extends IndexException {

    private final boolean timeout;

    public TransientStoreException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public TransientStoreException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    /**
     * True when the request may have been applied but no answer came back in time.
     */
    public boolean isTimeout() {
        return timeout;
    }
}
