package com.example.PolicyDesk.model;

import java.time.Instant;
import java.util.List;

/**
 * One role-tagged message of a session. Sources are only attached to assistant turns.
 */
public record Turn(
        String role,
        String content,
        List<SourceChunk> sources,
        Instant timestamp
) {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public Turn {
        sources = sources == null ? List.of() : List.copyOf(sources);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static Turn user(String content) {
        return new Turn(USER, content, List.of(), Instant.now());
    }

    public static Turn assistant(String content, List<SourceChunk> sources) {
        return new Turn(ASSISTANT, content, sources, Instant.now());
    }

    public boolean isUser() {
        return USER.equals(role);
    }
}
