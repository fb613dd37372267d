package com.example.PolicyDesk.exception;

/**
 * The embedding service could not be reached or returned a malformed vector.
 */
public class EmbeddingUnavailableException extends PolicyDeskException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
