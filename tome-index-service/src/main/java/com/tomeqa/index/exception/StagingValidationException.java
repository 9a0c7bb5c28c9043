package com.tomeqa.index.exception;

public class StagingValidationException extends IndexException {

    public StagingValidationException(String message) {
        super(message);
    }
}
