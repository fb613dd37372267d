package com.example.PolicyDesk.controller;

import com.example.PolicyDesk.model.RetrievalResult;
import com.example.PolicyDesk.service.PolicyRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/policy")
@RequiredArgsConstructor
public class PolicyRetrievalController {

    private final PolicyRetrievalService retrievalService;

    /**
     * Shows which chunks a question retrieves, without generating an answer.
     *   GET /api/policy/retrieve?q=xxx
     */
    @GetMapping("/retrieve")
    public RetrievalResult retrieve(@RequestParam("q") String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("q must not be blank");
        }
        return retrievalService.retrieve(question.trim());
    }
}
