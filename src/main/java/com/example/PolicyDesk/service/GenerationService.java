package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.ChatClientRegistry;
import com.example.PolicyDesk.exception.GenerationUnavailableException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single blocking completion call against the resolved chat client.
 * No retries: a failed call costs quota and is surfaced to the caller.
 */
@Service
@RequiredArgsConstructor
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final ChatClientRegistry chatClients;

    public String complete(String model, List<Message> messages) {
        ChatClient chatClient = chatClients.resolve(model)
                .orElseThrow(() -> new GenerationUnavailableException("No ChatClient is configured"));

        String content;
        try {
            content = chatClient.prompt()
                    .messages(messages)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new GenerationUnavailableException("Generation call failed for model " + model, e);
        }

        if (content == null) {
            throw new GenerationUnavailableException("Generation service returned no content");
        }
        log.debug("Generation: model={} messages={} answerLength={}", model, messages.size(), content.length());
        return content;
    }
}
