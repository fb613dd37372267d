package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.PolicyDeskProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Quick questions with pre-approved answers, matched on the exact (trimmed) question text.
 */
@Component
public class FaqCatalog {

    private final Map<String, String> answers;

    public FaqCatalog(PolicyDeskProperties properties) {
        Map<String, String> tmp = new LinkedHashMap<>();
        for (PolicyDeskProperties.Faq.Entry entry : properties.getFaq().getEntries()) {
            if (entry.getQuestion() == null || entry.getQuestion().isBlank()
                    || entry.getAnswer() == null || entry.getAnswer().isBlank()) {
                continue;
            }
            tmp.put(entry.getQuestion().trim(), entry.getAnswer());
        }
        this.answers = Collections.unmodifiableMap(tmp);
    }

    public List<String> questions() {
        return List.copyOf(answers.keySet());
    }

    public Optional<String> find(String question) {
        if (question == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(answers.get(question.trim()));
    }
}
