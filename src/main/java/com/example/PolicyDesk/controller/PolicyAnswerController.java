package com.example.PolicyDesk.controller;

import com.example.PolicyDesk.model.PolicyAnswer;
import com.example.PolicyDesk.model.PolicyQuestionRequest;
import com.example.PolicyDesk.service.FaqCatalog;
import com.example.PolicyDesk.service.QueryEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/policy")
@RequiredArgsConstructor
public class PolicyAnswerController {

    private final QueryEngine queryEngine;
    private final FaqCatalog faqCatalog;

    /**
     * Request example:
     *   POST /api/policy/answer
     *   {
     *     "question": "What about interns?",
     *     "sessionId": "3f0c...",
     *     "model": "openai"
     *   }
     * A missing sessionId starts a new conversation; the id is returned in the answer.
     */
    @PostMapping("/answer")
    public PolicyAnswer answer(@RequestBody PolicyQuestionRequest request) {
        return queryEngine.ask(request);
    }

    @GetMapping("/faq")
    public List<String> faqQuestions() {
        return faqCatalog.questions();
    }

    @PostMapping("/faq/answer")
    public PolicyAnswer answerFaq(@RequestBody PolicyQuestionRequest request) {
        return queryEngine.answerFaq(request);
    }
}
