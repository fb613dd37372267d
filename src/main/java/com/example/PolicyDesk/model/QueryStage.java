package com.example.PolicyDesk.model;

/**
 * Stages a question passes through in the query engine.
 * PERSISTED and FAILED are terminal.
 */
public enum QueryStage {
    RECEIVED,
    CONTEXTUALIZED,
    RETRIEVED,
    SYNTHESIZED,
    PERSISTED,
    FAILED
}
