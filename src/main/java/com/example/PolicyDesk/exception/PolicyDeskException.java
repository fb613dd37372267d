package com.example.PolicyDesk.exception;

/**
 * Base type for failures of the external collaborators behind the query engine
 * (embedding, vector index, generation, session storage).
 */
public class PolicyDeskException extends RuntimeException {

    public PolicyDeskException(String message) {
        super(message);
    }

    public PolicyDeskException(String message, Throwable cause) {
        super(message, cause);
    }
}
