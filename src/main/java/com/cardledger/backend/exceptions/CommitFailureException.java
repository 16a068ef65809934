package com.cardledger.backend.exceptions;

/**
 * The batch could not be written. Nothing of it was stored.
 */
public class CommitFailureException extends RuntimeException {

    public CommitFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
