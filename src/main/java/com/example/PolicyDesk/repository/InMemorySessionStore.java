package com.example.PolicyDesk.repository;

import com.example.PolicyDesk.model.SessionSummary;
import com.example.PolicyDesk.model.StorageOrigin;
import com.example.PolicyDesk.model.Turn;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime fallback store. Keeps turns with their source attachments.
 */
@Repository(InMemorySessionStore.BEAN_NAME)
public class InMemorySessionStore implements SessionStore {

    public static final String BEAN_NAME = "localSessionStore";

    private final Map<String, List<Turn>> sessions = new ConcurrentHashMap<>();

    @Override
    public void appendTurn(String sessionId, Turn turn) {
        List<Turn> turns = sessions.computeIfAbsent(sessionId, id -> new ArrayList<>());
        synchronized (turns) {
            turns.add(turn);
        }
    }

    @Override
    public List<Turn> listTurns(String sessionId) {
        List<Turn> turns = sessions.get(sessionId);
        if (turns == null) {
            return List.of();
        }
        synchronized (turns) {
            return List.copyOf(turns);
        }
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public List<SessionSummary> listSessionSummaries() {
        List<SessionSummary> summaries = new ArrayList<>();
        sessions.forEach((sessionId, turns) -> {
            List<Turn> snapshot;
            synchronized (turns) {
                snapshot = List.copyOf(turns);
            }
            if (snapshot.isEmpty()) {
                return;
            }
            String firstQuestion = snapshot.stream()
                    .filter(Turn::isUser)
                    .map(Turn::content)
                    .findFirst()
                    .orElse("");
            summaries.add(new SessionSummary(
                    sessionId,
                    firstQuestion,
                    snapshot.get(snapshot.size() - 1).timestamp(),
                    StorageOrigin.LOCAL
            ));
        });
        return summaries;
    }
}
