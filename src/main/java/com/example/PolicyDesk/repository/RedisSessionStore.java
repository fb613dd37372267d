package com.example.PolicyDesk.repository;

import com.example.PolicyDesk.exception.SessionStoreException;
import com.example.PolicyDesk.model.SessionSummary;
import com.example.PolicyDesk.model.StorageOrigin;
import com.example.PolicyDesk.model.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Primary session store.
 *
 * Layout:
 *  - chat:memory:{sessionId} : list of JSON messages (role, content, timestamp), append order
 *  - chat:sessions           : sorted set of session ids scored by last activity (epoch millis)
 *
 * Source attachments are not written here; only question/answer text survives a reload.
 */
@Repository(RedisSessionStore.BEAN_NAME)
@RequiredArgsConstructor
public class RedisSessionStore implements SessionStore {

    public static final String BEAN_NAME = "primarySessionStore";

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    static final String KEY_PREFIX = "chat:memory:";
    static final String SESSIONS_KEY = "chat:sessions";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void appendTurn(String sessionId, Turn turn) {
        String raw;
        try {
            raw = objectMapper.writeValueAsString(StoredMessage.from(turn));
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to serialize turn for session " + sessionId, e);
        }

        try {
            redisTemplate.opsForList().rightPush(buildKey(sessionId), raw);
        } catch (DataAccessException e) {
            throw new SessionStoreException("Redis rejected turn for session " + sessionId, e);
        }

        // The turn is stored once the push succeeds; a stale index only affects listing order
        try {
            redisTemplate.opsForZSet().add(SESSIONS_KEY, sessionId, turn.timestamp().toEpochMilli());
        } catch (DataAccessException e) {
            log.warn("Failed to update session index for session={}: {}", sessionId, e.getMessage());
        }
    }

    @Override
    public List<Turn> listTurns(String sessionId) {
        List<String> rawMessages;
        try {
            rawMessages = redisTemplate.opsForList().range(buildKey(sessionId), 0, -1);
        } catch (DataAccessException e) {
            throw new SessionStoreException("Redis read failed for session " + sessionId, e);
        }
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<Turn> turns = new ArrayList<>(rawMessages.size());
        for (String raw : rawMessages) {
            StoredMessage message = parse(raw);
            if (message != null) {
                turns.add(message.toTurn());
            }
        }
        return turns;
    }

    @Override
    public boolean delete(String sessionId) {
        try {
            Boolean deleted = redisTemplate.delete(buildKey(sessionId));
            redisTemplate.opsForZSet().remove(SESSIONS_KEY, sessionId);
            return Boolean.TRUE.equals(deleted);
        } catch (DataAccessException e) {
            throw new SessionStoreException("Redis delete failed for session " + sessionId, e);
        }
    }

    @Override
    public List<SessionSummary> listSessionSummaries() {
        try {
            Set<ZSetOperations.TypedTuple<String>> entries =
                    redisTemplate.opsForZSet().reverseRangeWithScores(SESSIONS_KEY, 0, -1);
            if (entries == null || entries.isEmpty()) {
                return List.of();
            }

            List<SessionSummary> summaries = new ArrayList<>(entries.size());
            for (ZSetOperations.TypedTuple<String> entry : entries) {
                String sessionId = entry.getValue();
                if (sessionId == null) {
                    continue;
                }
                long lastActivity = entry.getScore() == null ? 0L : entry.getScore().longValue();
                summaries.add(new SessionSummary(
                        sessionId,
                        firstQuestion(sessionId),
                        Instant.ofEpochMilli(lastActivity),
                        StorageOrigin.PRIMARY
                ));
            }
            return summaries;
        } catch (DataAccessException e) {
            throw new SessionStoreException("Redis session listing failed", e);
        }
    }

    /**
     * The first message of a session is normally the user question; peek at two entries
     * in case the list starts with something else.
     */
    private String firstQuestion(String sessionId) {
        List<String> head = redisTemplate.opsForList().range(buildKey(sessionId), 0, 1);
        if (head == null) {
            return "";
        }
        return head.stream()
                .map(this::parse)
                .filter(m -> m != null && Turn.USER.equals(m.role()))
                .map(StoredMessage::content)
                .findFirst()
                .orElse("");
    }

    private StoredMessage parse(String raw) {
        try {
            return objectMapper.readValue(raw, StoredMessage.class);
        } catch (JsonProcessingException e) {
            // Skip malformed entries instead of failing the whole load
            log.warn("Skipping malformed chat memory entry: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    public record StoredMessage(String role, String content, long timestamp) {

        static StoredMessage from(Turn turn) {
            return new StoredMessage(turn.role(), turn.content(), turn.timestamp().toEpochMilli());
        }

        Turn toTurn() {
            return new Turn(role, content, List.of(), Instant.ofEpochMilli(timestamp));
        }
    }
}
