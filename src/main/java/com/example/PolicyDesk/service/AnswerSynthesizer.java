package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.PolicyDeskProperties;
import com.example.PolicyDesk.exception.RetrievalUnavailableException;
import com.example.PolicyDesk.model.ClarifiedQuestion;
import com.example.PolicyDesk.model.RetrievalResult;
import com.example.PolicyDesk.model.SynthesizedAnswer;
import com.example.PolicyDesk.model.Turn;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AnswerSynthesizer {

    private final GenerationService generationService;
    private final PolicyDeskProperties properties;

    /**
     * Generate an answer grounded on the retrieved chunks.
     * The answer text is returned verbatim and every retrieved chunk is reported as a source,
     * including when there are none.
     *
     * @throws RetrievalUnavailableException  if no retrieval result was produced upstream
     * @throws com.example.PolicyDesk.exception.GenerationUnavailableException if generation fails
     */
    public SynthesizedAnswer synthesize(ClarifiedQuestion question, RetrievalResult retrieval, String model) {
        if (retrieval == null) {
            throw new RetrievalUnavailableException("No retrieval result available for synthesis");
        }
        List<Message> messages = buildMessages(question, retrieval);
        String answer = generationService.complete(model, messages);
        return new SynthesizedAnswer(answer, retrieval.sources(), renderPrompt(messages));
    }

    /**
     * Message order:
     *  - system: instructions + retrieved context
     *  - prior turns of the context window, original roles
     *  - user: the raw question
     */
    List<Message> buildMessages(ClarifiedQuestion question, RetrievalResult retrieval) {
        PolicyDeskProperties.Prompt prompt = properties.getPrompt();
        List<Message> messages = new ArrayList<>(question.contextTurns().size() + 2);

        String system = prompt.getSystem()
                + "\n\n" + prompt.getContextPreamble() + "\n"
                + retrieval.contextText();
        messages.add(new SystemMessage(system));

        for (Turn turn : question.contextTurns()) {
            messages.add(turn.isUser()
                    ? new UserMessage(turn.content())
                    : new AssistantMessage(turn.content()));
        }

        messages.add(new UserMessage(question.question()));
        return messages;
    }

    private String renderPrompt(List<Message> messages) {
        return messages.stream()
                .map(m -> m.getMessageType().getValue() + ": " + m.getText())
                .collect(Collectors.joining("\n\n"));
    }
}
