package com.example.PolicyDesk.exception;

/**
 * The vector index could not be queried or returned a malformed row.
 */
public class RetrievalUnavailableException extends PolicyDeskException {

    public RetrievalUnavailableException(String message) {
        super(message);
    }

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
