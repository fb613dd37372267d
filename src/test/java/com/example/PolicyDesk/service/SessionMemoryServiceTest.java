package com.example.PolicyDesk.service;

import com.example.PolicyDesk.config.PolicyDeskProperties;
import com.example.PolicyDesk.exception.SessionStoreException;
import com.example.PolicyDesk.model.SessionSummary;
import com.example.PolicyDesk.model.SourceChunk;
import com.example.PolicyDesk.model.StorageOrigin;
import com.example.PolicyDesk.model.StorageOutcome;
import com.example.PolicyDesk.model.Turn;
import com.example.PolicyDesk.repository.InMemorySessionStore;
import com.example.PolicyDesk.repository.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SessionMemoryServiceTest {

    private SessionStore primary;
    private InMemorySessionStore local;
    private SessionMemoryService memory;

    @BeforeEach
    void setUp() {
        primary = mock(SessionStore.class);
        local = new InMemorySessionStore();
        memory = new SessionMemoryService(primary, local, new PolicyDeskProperties());
    }

    @Test
    void healthyPrimaryReceivesWrites() {
        Turn question = Turn.user("How much PTO?");

        StorageOutcome outcome = memory.append("s1", question);

        assertThat(outcome).isEqualTo(StorageOutcome.STORED_PRIMARY);
        assertThat(memory.origin("s1")).isEqualTo(StorageOrigin.PRIMARY);
        verify(primary).appendTurn("s1", question);
        assertThat(local.listTurns("s1")).isEmpty();
    }

    @Test
    void failedPrimaryWriteIsRetriedOnLocalInSameCall() {
        doThrow(new SessionStoreException("down")).when(primary).appendTurn(eq("s1"), any());
        Turn question = Turn.user("How much PTO?");

        StorageOutcome outcome = memory.append("s1", question);

        assertThat(outcome).isEqualTo(StorageOutcome.DEGRADED);
        assertThat(memory.origin("s1")).isEqualTo(StorageOrigin.LOCAL);
        assertThat(local.listTurns("s1")).containsExactly(question);
    }

    @Test
    void fallbackIsStickyEvenAfterPrimaryRecovers() {
        doThrow(new SessionStoreException("down"))
                .doNothing()
                .when(primary).appendTurn(eq("s1"), any());

        memory.append("s1", Turn.user("q1"));
        StorageOutcome second = memory.append("s1", Turn.assistant("a1", List.of()));
        StorageOutcome third = memory.append("s1", Turn.user("q2"));

        assertThat(second).isEqualTo(StorageOutcome.STORED_LOCAL);
        assertThat(third).isEqualTo(StorageOutcome.STORED_LOCAL);
        verify(primary, times(1)).appendTurn(eq("s1"), any());
        assertThat(memory.history("s1")).extracting(Turn::content).containsExactly("q1", "a1", "q2");
    }

    @Test
    void degradationOnlyAffectsTheFailingSession() {
        doThrow(new SessionStoreException("down")).when(primary).appendTurn(eq("s1"), any());

        memory.append("s1", Turn.user("q1"));
        StorageOutcome other = memory.append("s2", Turn.user("q2"));

        assertThat(other).isEqualTo(StorageOutcome.STORED_PRIMARY);
        assertThat(memory.origin("s2")).isEqualTo(StorageOrigin.PRIMARY);
    }

    @Test
    void degradationCopiesHistoryStillReadableFromPrimary() {
        Turn q1 = Turn.user("What is the remote work policy?");
        Turn a1 = Turn.assistant("40 hours in office", List.of());
        when(primary.listTurns("s1")).thenReturn(List.of(q1, a1));
        doThrow(new SessionStoreException("down")).when(primary).appendTurn(eq("s1"), any());
        Turn q2 = Turn.user("What about interns?");

        memory.append("s1", q2);

        assertThat(memory.history("s1")).containsExactly(q1, a1, q2);
    }

    @Test
    void failedPrimaryReadFallsBackWithoutFlippingOrigin() {
        when(primary.listTurns("s1")).thenThrow(new SessionStoreException("down"));

        assertThat(memory.history("s1")).isEmpty();
        assertThat(memory.origin("s1")).isEqualTo(StorageOrigin.PRIMARY);

        memory.append("s1", Turn.user("q"));
        verify(primary).appendTurn(eq("s1"), any());
    }

    @Test
    void appendThenHistoryReturnsTurnLastOnBothTiers() {
        InMemorySessionStore primaryStandIn = new InMemorySessionStore();
        SessionMemoryService healthy = new SessionMemoryService(primaryStandIn, local, new PolicyDeskProperties());
        Turn onPrimary = Turn.assistant("answer", List.of());
        healthy.append("p", Turn.user("question"));
        healthy.append("p", onPrimary);

        doThrow(new SessionStoreException("down")).when(primary).appendTurn(eq("l"), any());
        Turn onLocal = Turn.assistant("answer", List.of(new SourceChunk("text", null, "doc")));
        memory.append("l", Turn.user("question"));
        memory.append("l", onLocal);

        List<Turn> primaryHistory = healthy.history("p");
        List<Turn> localHistory = memory.history("l");
        assertThat(primaryHistory.get(primaryHistory.size() - 1)).isEqualTo(onPrimary);
        assertThat(localHistory.get(localHistory.size() - 1)).isEqualTo(onLocal);
    }

    @Test
    void deleteClearsBothStoresAndToleratesPrimaryFailure() {
        doThrow(new SessionStoreException("down")).when(primary).appendTurn(eq("s1"), any());
        memory.append("s1", Turn.user("q"));
        when(primary.delete("s1")).thenThrow(new SessionStoreException("down"));

        assertThatCode(() -> memory.delete("s1")).doesNotThrowAnyException();
        assertThat(local.listTurns("s1")).isEmpty();
        assertThatCode(() -> memory.delete("never-existed")).doesNotThrowAnyException();
    }

    @Test
    void listingMergesStoresPrefersPrimaryAndSortsByRecency() {
        when(primary.listSessionSummaries()).thenReturn(List.of(new SessionSummary(
                "shared", "What are the health insurance benefits for part-time staff?",
                Instant.ofEpochMilli(1_000), StorageOrigin.PRIMARY)));
        local.appendTurn("shared", new Turn(Turn.USER, "local copy", List.of(), Instant.ofEpochMilli(9_000)));
        local.appendTurn("local-only", new Turn(Turn.USER, "Parental leave?", List.of(), Instant.ofEpochMilli(5_000)));

        List<SessionSummary> sessions = memory.listSessions();

        assertThat(sessions).extracting(SessionSummary::sessionId).containsExactly("local-only", "shared");
        SessionSummary shared = sessions.get(1);
        assertThat(shared.origin()).isEqualTo(StorageOrigin.PRIMARY);
        assertThat(shared.preview()).isEqualTo("What are the health insuran...");
        assertThat(shared.preview()).hasSize(30);
    }

    @Test
    void listingSurvivesUnreachablePrimary() {
        when(primary.listSessionSummaries()).thenThrow(new SessionStoreException("down"));
        local.appendTurn("s1", Turn.user("Dental?"));

        assertThat(memory.listSessions()).extracting(SessionSummary::preview).containsExactly("Dental?");
    }

    @Test
    void unexpectedPrimaryFailureAlsoSwitchesToLocal() {
        doThrow(new IllegalStateException("pool exhausted")).when(primary).appendTurn(eq("s1"), any());

        StorageOutcome outcome = memory.append("s1", Turn.user("How much PTO?"));

        assertThat(outcome).isEqualTo(StorageOutcome.DEGRADED);
        assertThat(memory.history("s1")).extracting(Turn::content).containsExactly("How much PTO?");
    }

    @Test
    void tinyPreviewLengthStillTruncates() {
        PolicyDeskProperties properties = new PolicyDeskProperties();
        properties.getMemory().setPreviewLength(2);
        SessionMemoryService shortPreviews = new SessionMemoryService(primary, local, properties);
        local.appendTurn("s1", Turn.user("Dental plans?"));

        assertThat(shortPreviews.listSessions()).extracting(SessionSummary::preview).containsExactly("D...");
    }
}
