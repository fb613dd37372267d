package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.PolicyDeskProperties;
import com.example.PolicyDesk.model.SessionSummary;
import com.example.PolicyDesk.model.StorageOrigin;
import com.example.PolicyDesk.model.StorageOutcome;
import com.example.PolicyDesk.model.Turn;
import com.example.PolicyDesk.repository.InMemorySessionStore;
import com.example.PolicyDesk.repository.RedisSessionStore;
import com.example.PolicyDesk.repository.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ordered, append-only turn history per session.
 *
 * Writes go to the primary store until it fails once for a session; from then on that
 * session lives in the local store for the rest of the process (sticky fallback).
 * Any runtime failure of the primary store counts, not only {@code SessionStoreException}.
 * Storage failures are logged and never reach the caller.
 */
@Service
public class SessionMemoryService {

    private static final Logger log = LoggerFactory.getLogger(SessionMemoryService.class);

    private static final String EMPTY_PREVIEW = "New conversation";

    // room for at least one character before the ellipsis
    private static final int MIN_PREVIEW_LENGTH = 4;

    private final SessionStore primaryStore;
    private final SessionStore localStore;
    private final int previewLength;

    private final Set<String> degradedSessions = ConcurrentHashMap.newKeySet();

    public SessionMemoryService(@Qualifier(RedisSessionStore.BEAN_NAME) SessionStore primaryStore,
                                @Qualifier(InMemorySessionStore.BEAN_NAME) SessionStore localStore,
                                PolicyDeskProperties properties) {
        this.primaryStore = primaryStore;
        this.localStore = localStore;
        this.previewLength = Math.max(properties.getMemory().getPreviewLength(), MIN_PREVIEW_LENGTH);
    }

    public String newSessionId() {
        return UUID.randomUUID().toString();
    }

    public StorageOrigin origin(String sessionId) {
        return degradedSessions.contains(sessionId) ? StorageOrigin.LOCAL : StorageOrigin.PRIMARY;
    }

    public StorageOutcome append(String sessionId, Turn turn) {
        boolean degradedNow = false;
        if (origin(sessionId) == StorageOrigin.PRIMARY) {
            try {
                primaryStore.appendTurn(sessionId, turn);
                return StorageOutcome.STORED_PRIMARY;
            } catch (RuntimeException e) {
                log.warn("Primary session store failed for session={}, switching to local store: {}",
                        sessionId, e.getMessage());
                degrade(sessionId);
                degradedNow = true;
            }
        }

        try {
            localStore.appendTurn(sessionId, turn);
        } catch (RuntimeException e) {
            log.error("Local session store rejected turn for session={}", sessionId, e);
            return StorageOutcome.FAILED;
        }
        return degradedNow ? StorageOutcome.DEGRADED : StorageOutcome.STORED_LOCAL;
    }

    /**
     * A failed primary read falls back to the local store but does not make the session sticky;
     * only a failed write does.
     */
    public List<Turn> history(String sessionId) {
        if (origin(sessionId) == StorageOrigin.LOCAL) {
            return localStore.listTurns(sessionId);
        }
        try {
            return primaryStore.listTurns(sessionId);
        } catch (RuntimeException e) {
            log.warn("Primary session store unreadable for session={}, reading local store: {}",
                    sessionId, e.getMessage());
            return localStore.listTurns(sessionId);
        }
    }

    /**
     * Idempotent: deleting an unknown session succeeds.
     */
    public void delete(String sessionId) {
        localStore.delete(sessionId);
        try {
            primaryStore.delete(sessionId);
        } catch (RuntimeException e) {
            log.warn("Primary session store delete failed for session={}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Sessions from both stores, primary preferred on id collision, most recent first.
     */
    public List<SessionSummary> listSessions() {
        Map<String, SessionSummary> merged = new LinkedHashMap<>();
        try {
            primaryStore.listSessionSummaries().forEach(s -> merged.put(s.sessionId(), s));
        } catch (RuntimeException e) {
            log.warn("Primary session store listing failed, showing local sessions only: {}", e.getMessage());
        }
        localStore.listSessionSummaries().forEach(s -> merged.putIfAbsent(s.sessionId(), s));

        return merged.values().stream()
                .map(s -> s.withPreview(preview(s.preview())))
                .sorted(Comparator.comparing(SessionSummary::lastActivity).reversed())
                .toList();
    }

    /**
     * Copy whatever the primary store still returns into the local store so the session
     * history stays complete after the switch.
     */
    private void degrade(String sessionId) {
        if (!degradedSessions.add(sessionId)) {
            return;
        }
        if (!localStore.listTurns(sessionId).isEmpty()) {
            return;
        }
        try {
            List<Turn> existing = primaryStore.listTurns(sessionId);
            existing.forEach(t -> localStore.appendTurn(sessionId, t));
            log.debug("Seeded local store with {} turns for session={}", existing.size(), sessionId);
        } catch (RuntimeException e) {
            log.debug("Could not copy history from primary store for session={}: {}", sessionId, e.getMessage());
        }
    }

    private String preview(String firstQuestion) {
        if (firstQuestion == null || firstQuestion.isBlank()) {
            return EMPTY_PREVIEW;
        }
        if (firstQuestion.length() > previewLength) {
            return firstQuestion.substring(0, previewLength - 3) + "...";
        }
        return firstQuestion;
    }
}
