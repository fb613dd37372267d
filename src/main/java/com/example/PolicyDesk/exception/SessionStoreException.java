package com.example.PolicyDesk.exception;

/**
 * The primary session store rejected a read or write.
 */
public class SessionStoreException extends PolicyDeskException {

    public SessionStoreException(String message) {
        super(message);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
