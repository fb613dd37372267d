package com.example.PolicyDesk.service;

import com.example.PolicyDesk.model.InteractionLog;
import com.example.PolicyDesk.model.QueryStage;
import com.example.PolicyDesk.model.SourceChunk;
import com.example.PolicyDesk.repository.InteractionLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Audit trail of answered questions. Recording is best effort and never fails a request.
 */
@Service
@RequiredArgsConstructor
public class InteractionLogService {

    private static final Logger log = LoggerFactory.getLogger(InteractionLogService.class);

    private final InteractionLogRepository interactionLogRepository;
    private final ObjectMapper objectMapper;

    public void record(String sessionId,
                       String model,
                       String question,
                       String prompt,
                       String answer,
                       List<SourceChunk> sources,
                       boolean retrievalDegraded,
                       QueryStage stage) {
        InteractionLog entry = new InteractionLog();
        entry.setSessionId(sessionId);
        entry.setModel(model);
        entry.setQuestion(question);
        entry.setPrompt(prompt);
        entry.setAnswer(answer);
        entry.setSourcesJson(serializeSources(sources));
        entry.setRetrievalDegraded(retrievalDegraded);
        entry.setStage(stage.name());

        try {
            interactionLogRepository.save(entry);
        } catch (RuntimeException e) {
            // Covers DataAccessException and TransactionException (database unreachable)
            log.warn("Failed to record interaction for session={}: {}", sessionId, e.getMessage());
        }
    }

    private String serializeSources(List<SourceChunk> sources) {
        if (sources == null || sources.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize sources for interaction log", e);
            return "[]";
        }
    }
}
