package com.example.PolicyDesk.model;

import java.util.List;

/**
 * @param answer  completion text, verbatim
 * @param sources chunks that were placed in the system message
 * @param prompt  rendered message sequence, kept for the interaction log
 */
public record SynthesizedAnswer(
        String answer,
        List<SourceChunk> sources,
        String prompt
) {
}
