package com.example.PolicyDesk.model;

import java.util.List;

public record PolicyAnswer(
        String sessionId,
        String answer,
        List<SourceChunk> sources,
        QueryStage stage
) {
}
