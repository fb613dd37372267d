package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.PolicyDeskProperties;
import com.example.PolicyDesk.exception.EmbeddingUnavailableException;
import com.example.PolicyDesk.exception.RetrievalUnavailableException;
import com.example.PolicyDesk.model.ClarifiedQuestion;
import com.example.PolicyDesk.model.PolicyAnswer;
import com.example.PolicyDesk.model.PolicyQuestionRequest;
import com.example.PolicyDesk.model.QueryStage;
import com.example.PolicyDesk.model.RetrievalResult;
import com.example.PolicyDesk.model.SourceChunk;
import com.example.PolicyDesk.model.StorageOutcome;
import com.example.PolicyDesk.model.SynthesizedAnswer;
import com.example.PolicyDesk.model.Turn;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Answers one question per call:
 *  RECEIVED → CONTEXTUALIZED → RETRIEVED → SYNTHESIZED → PERSISTED
 * with FAILED reachable from any stage.
 *
 * Every call appends exactly one user turn and one assistant turn to the session,
 * the assistant turn being the fixed apology when the question fails.
 */
@Service
@RequiredArgsConstructor
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final QueryContextualizer contextualizer;
    private final PolicyRetrievalService retrievalService;
    private final AnswerSynthesizer answerSynthesizer;
    private final SessionMemoryService sessionMemory;
    private final FaqCatalog faqCatalog;
    private final InteractionLogService interactionLogService;
    private final PolicyDeskProperties properties;

    public PolicyAnswer ask(PolicyQuestionRequest request) {
        String question = request.requireQuestion();
        String sessionId = request.resolveSession().id();
        String model = request.resolveModel();

        QueryStage stage = QueryStage.RECEIVED;
        RetrievalResult retrieval = null;
        String answer;
        String prompt = "";
        List<SourceChunk> sources;
        try {
            ClarifiedQuestion clarified = contextualizer.contextualize(sessionId, question);
            stage = QueryStage.CONTEXTUALIZED;

            retrieval = retrieveOrEmpty(clarified.question());
            stage = QueryStage.RETRIEVED;

            SynthesizedAnswer synthesized = answerSynthesizer.synthesize(clarified, retrieval, model);
            stage = QueryStage.SYNTHESIZED;

            answer = synthesized.answer();
            sources = synthesized.sources();
            prompt = synthesized.prompt();
        } catch (RuntimeException e) {
            log.error("Question failed after stage={} for session={}", stage, sessionId, e);
            stage = QueryStage.FAILED;
            answer = properties.getPrompt().getApology();
            sources = List.of();
        }

        persist(sessionId, question, answer, sources);
        QueryStage terminal = stage == QueryStage.FAILED ? QueryStage.FAILED : QueryStage.PERSISTED;

        interactionLogService.record(
                sessionId,
                model,
                question,
                prompt,
                answer,
                sources,
                retrieval != null && retrieval.degraded(),
                terminal
        );
        return new PolicyAnswer(sessionId, answer, sources, terminal);
    }

    /**
     * Quick questions from the FAQ catalog are answered with their approved text and no
     * generation call; anything else goes through {@link #ask}.
     */
    public PolicyAnswer answerFaq(PolicyQuestionRequest request) {
        String question = request.requireQuestion();
        Optional<String> canned = faqCatalog.find(question);
        if (canned.isEmpty()) {
            return ask(request);
        }

        String sessionId = request.resolveSession().id();
        persist(sessionId, question, canned.get(), List.of());
        interactionLogService.record(
                sessionId,
                "faq",
                question,
                "",
                canned.get(),
                List.of(),
                false,
                QueryStage.PERSISTED
        );
        return new PolicyAnswer(sessionId, canned.get(), List.of(), QueryStage.PERSISTED);
    }

    /**
     * Embedding and index failures degrade to an empty result; an ungrounded answer is
     * still better than none.
     */
    private RetrievalResult retrieveOrEmpty(String query) {
        try {
            return retrievalService.retrieve(query);
        } catch (EmbeddingUnavailableException | RetrievalUnavailableException e) {
            log.warn("Retrieval unavailable, answering without context: {}", e.getMessage());
            return RetrievalResult.unavailable(query);
        }
    }

    private void persist(String sessionId, String question, String answer, List<SourceChunk> sources) {
        StorageOutcome userOutcome = sessionMemory.append(sessionId, Turn.user(question));
        StorageOutcome assistantOutcome = sessionMemory.append(sessionId, Turn.assistant(answer, sources));
        if (userOutcome == StorageOutcome.FAILED || assistantOutcome == StorageOutcome.FAILED) {
            log.error("Turns for session={} were not stored (user={}, assistant={})",
                    sessionId, userOutcome, assistantOutcome);
        }
    }
}
