package com.example.PolicyDesk.config;

import com.example.PolicyDesk.model.PolicyQuestionRequest;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chat clients keyed by model name ("deepseek", "openai").
 * Only models whose ChatModel bean exists are registered.
 */
public class ChatClientRegistry {

    private final Map<String, ChatClient> clients;

    public ChatClientRegistry(Map<String, ChatClient> clients) {
        this.clients = Collections.unmodifiableMap(new LinkedHashMap<>(clients));
    }

    /**
     * Resolve a client for the requested model.
     * Fallback order:
     *  - exact model name
     *  - default model
     *  - any registered client
     */
    public Optional<ChatClient> resolve(String model) {
        String key = Optional.ofNullable(model)
                .map(String::toLowerCase)
                .orElse(PolicyQuestionRequest.DEFAULT_MODEL);
        if (clients.containsKey(key)) {
            return Optional.of(clients.get(key));
        }
        ChatClient fallback = clients.get(PolicyQuestionRequest.DEFAULT_MODEL);
        if (fallback != null) {
            return Optional.of(fallback);
        }
        return clients.values().stream().findFirst();
    }

    public Set<String> models() {
        return clients.keySet();
    }

    public boolean isEmpty() {
        return clients.isEmpty();
    }
}
