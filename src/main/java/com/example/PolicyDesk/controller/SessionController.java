package com.example.PolicyDesk.controller;

import com.example.PolicyDesk.model.SessionSummary;
import com.example.PolicyDesk.model.Turn;
import com.example.PolicyDesk.service.SessionMemoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionMemoryService sessionMemory;

    /** "New conversation": the session exists once its first question is asked. */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, String> create() {
        return Map.of("sessionId", sessionMemory.newSessionId());
    }

    @GetMapping
    public List<SessionSummary> list() {
        return sessionMemory.listSessions();
    }

    @GetMapping("/{sessionId}/turns")
    public List<Turn> turns(@PathVariable String sessionId) {
        return sessionMemory.history(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String sessionId) {
        sessionMemory.delete(sessionId);
    }
}
