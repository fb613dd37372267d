package com.example.PolicyDesk.model;

import java.time.Instant;

/**
 * Listing entry for a session.
 *
 * @param sessionId    session identifier
 * @param preview      first user question, possibly truncated
 * @param lastActivity timestamp of the most recent turn
 * @param origin       store the summary came from
 */
public record SessionSummary(
        String sessionId,
        String preview,
        Instant lastActivity,
        StorageOrigin origin
) {
    public SessionSummary withPreview(String value) {
        return new SessionSummary(sessionId, value, lastActivity, origin);
    }
}
