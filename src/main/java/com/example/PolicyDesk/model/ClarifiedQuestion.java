package com.example.PolicyDesk.model;

import java.util.List;

/**
 * The unmodified user question plus the bounded window of prior turns handed to generation.
 */
public record ClarifiedQuestion(
        String question,
        List<Turn> contextTurns
) {
    public ClarifiedQuestion {
        contextTurns = contextTurns == null ? List.of() : List.copyOf(contextTurns);
    }
}
