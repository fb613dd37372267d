package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.PolicyDeskProperties;
import com.example.PolicyDesk.model.ClarifiedQuestion;
import com.example.PolicyDesk.model.Turn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Selects which prior turns travel with a question.
 *
 * The question itself is never rewritten. Follow-ups such as "What about interns?" are
 * resolved by the generation model, which sees the last Q/A pairs and is instructed to
 * treat ambiguous questions as continuations of the previous topic.
 */
@Service
@RequiredArgsConstructor
public class QueryContextualizer {

    private final SessionMemoryService sessionMemory;
    private final PolicyDeskProperties properties;

    public ClarifiedQuestion contextualize(String sessionId, String rawQuestion) {
        List<Turn> history = sessionMemory.history(sessionId);
        return new ClarifiedQuestion(rawQuestion, selectWindow(history));
    }

    /**
     * The window starts at the N-th last user turn (N = configured pairs) and is capped at
     * 2N turns. With fewer than N user turns the whole history is used. Unanswered
     * questions inside the window are kept as they are.
     */
    List<Turn> selectWindow(List<Turn> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        int pairs = properties.getMemory().getContextPairs();
        int maxTurns = pairs * 2;

        int start = 0;
        int usersSeen = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isUser() && ++usersSeen == pairs) {
                start = i;
                break;
            }
        }

        List<Turn> window = history.subList(start, history.size());
        if (window.size() > maxTurns) {
            window = window.subList(window.size() - maxTurns, window.size());
        }
        return List.copyOf(window);
    }
}
