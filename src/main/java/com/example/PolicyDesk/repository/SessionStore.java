package com.example.PolicyDesk.repository;

import com.example.PolicyDesk.model.SessionSummary;
import com.example.PolicyDesk.model.Turn;

import java.util.List;

/**
 * Per-session turn storage. Implementations must tolerate concurrent access from
 * different sessions.
 */
public interface SessionStore {

    /**
     * Append one turn at the end of the session's history.
     *
     * @throws com.example.PolicyDesk.exception.SessionStoreException if the store rejects the write
     */
    void appendTurn(String sessionId, Turn turn);

    /**
     * All turns of the session in append order; empty when the session is unknown.
     */
    List<Turn> listTurns(String sessionId);

    /**
     * Remove every turn of the session.
     *
     * @return true if something was removed
     */
    boolean delete(String sessionId);

    /**
     * One summary per known session. The preview holds the full first user question.
     */
    List<SessionSummary> listSessionSummaries();
}
