package com.example.PolicyDesk.service;

import com.example.PolicyDesk.model.InteractionLog;
import com.example.PolicyDesk.model.QueryStage;
import com.example.PolicyDesk.model.SourceChunk;
import com.example.PolicyDesk.repository.InteractionLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InteractionLogServiceTest {

    private InteractionLogRepository repository;
    private InteractionLogService service;

    @BeforeEach
    void setUp() {
        repository = mock(InteractionLogRepository.class);
        service = new InteractionLogService(repository, new ObjectMapper());
    }

    @Test
    void recordsAllColumns() {
        service.record("s1", "openai", "Dental plans?", "system: ...", "Two plans.",
                List.of(new SourceChunk("Dental PPO and HMO.", 7, "benefits")), true, QueryStage.PERSISTED);

        ArgumentCaptor<InteractionLog> captor = ArgumentCaptor.forClass(InteractionLog.class);
        verify(repository).save(captor.capture());
        InteractionLog saved = captor.getValue();

        assertThat(saved.getSessionId()).isEqualTo("s1");
        assertThat(saved.getModel()).isEqualTo("openai");
        assertThat(saved.getAnswer()).isEqualTo("Two plans.");
        assertThat(saved.isRetrievalDegraded()).isTrue();
        assertThat(saved.getStage()).isEqualTo("PERSISTED");
        assertThat(saved.getSourcesJson()).contains("\"page\":7").contains("\"documentId\":\"benefits\"");
    }

    @Test
    void emptySourcesAreStoredAsEmptyArray() {
        service.record("s1", "deepseek", "q", "", "apology", List.of(), false, QueryStage.FAILED);

        ArgumentCaptor<InteractionLog> captor = ArgumentCaptor.forClass(InteractionLog.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getSourcesJson()).isEqualTo("[]");
        assertThat(captor.getValue().getStage()).isEqualTo("FAILED");
    }

    @Test
    void dataAccessFailureIsSwallowed() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("disk full"));

        assertThatCode(() -> service.record("s1", "deepseek", "q", "", "a", List.of(), false, QueryStage.PERSISTED))
                .doesNotThrowAnyException();
    }

    @Test
    void unreachableDatabaseIsSwallowed() {
        when(repository.save(any())).thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));

        assertThatCode(() -> service.record("s1", "deepseek", "q", "", "a", List.of(), false, QueryStage.PERSISTED))
                .doesNotThrowAnyException();
    }
}
