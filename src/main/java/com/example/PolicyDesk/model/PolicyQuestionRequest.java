package com.example.PolicyDesk.model;

import java.util.Set;
import java.util.UUID;

/**
 * Request payload for answering a policy question.
 *
 * @param question  user question
 * @param sessionId chat session id; a new session is started when absent
 * @param model     optional model name hint ("deepseek" or "openai")
 */
public record PolicyQuestionRequest(
        String question,
        String sessionId,
        String model
) {
    private static final Set<String> models = Set.of("deepseek", "openai");
    public static final String DEFAULT_MODEL = "deepseek";

    public String resolveModel() {
        return (model == null || model.isBlank()
                || !models.contains(model.toLowerCase())) ? DEFAULT_MODEL : model.toLowerCase();
    }

    public ResolvedSession resolveSession() {
        boolean created = sessionId == null || sessionId.isBlank();
        String resolvedId = created ? UUID.randomUUID().toString() : sessionId.trim();
        return new ResolvedSession(resolvedId, created);
    }

    /**
     * @throws IllegalArgumentException when the question is missing or blank
     */
    public String requireQuestion() {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        return question.trim();
    }

    public record ResolvedSession(String id, boolean created) { }
}
