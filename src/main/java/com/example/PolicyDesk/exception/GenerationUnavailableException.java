package com.example.PolicyDesk.exception;

/**
 * The generation service is unreachable or no chat client is configured.
 */
public class GenerationUnavailableException extends PolicyDeskException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
