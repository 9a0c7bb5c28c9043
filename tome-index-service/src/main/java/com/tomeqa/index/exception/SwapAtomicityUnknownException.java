package com.tomeqa.index.exception;

/**
 * The alias batch outcome could not be established. Needs an operator.
 */
public class SwapAtomicityUnknownException extends IndexException {

    public SwapAtomicityUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
