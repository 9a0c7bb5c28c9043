package com.tomeqa.index.exception;

public class MalformedDocumentException extends IndexException {

    private final String documentId;

    public MalformedDocumentException(String documentId, String message) {
        super(message);
        this.documentId = documentId;
    }

    public MalformedDocumentException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
