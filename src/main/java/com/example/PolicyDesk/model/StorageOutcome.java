package com.example.PolicyDesk.model;

/**
 * Result of appending a turn to session memory.
 */
public enum StorageOutcome {
    /** Written to the primary store. */
    STORED_PRIMARY,
    /** Written to the local store; the session was already running on it. */
    STORED_LOCAL,
    /** The primary store failed during this call and the turn went to the local store. */
    DEGRADED,
    /** Neither store accepted the turn. */
    FAILED
}
