package com.openforge.clusterlens.stream;

import com.openforge.clusterlens.websocket.EventType;
import com.openforge.clusterlens.websocket.InvestigationEvent;
import com.openforge.clusterlens.websocket.PhaseEventPublisher;
import com.openforge.clusterlens.websocket.PhaseThrottlerFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamSessionTest {

    private final PhaseEventPublisher publisher = mock(PhaseEventPublisher.class);
    private final PhaseThrottlerFactory throttlers = mock(PhaseThrottlerFactory.class);
    private final AgentStreamClient client = mock(AgentStreamClient.class);

    @BeforeEach
    void setUp() {
        // zero window: every phase is delivered at once
        when(throttlers.create(any())).thenAnswer(invocation -> new PhaseThrottler<>(Duration.ZERO,
                mock(ScheduledExecutorService.class), () -> 0L, invocation.getArgument(0)));
        when(client.open(any(), any())).thenAnswer(invocation -> new StreamConnection(invocation.getArgument(0)));
    }

    @Test
    void shouldPublishPhasesThenFinalAnswer() {
        AgentStreamService service = new AgentStreamService(client, publisher, throttlers);
        StreamSession session = service.subscribe("q-1");

        session.onEvent(new RawAgentEvent("planning", null, "Planning", null));
        session.onEvent(new RawAgentEvent("done", null, null, "Restart the pod."));
        session.onEvent(new RawAgentEvent("planning", null, "late", null));

        List<InvestigationEvent> events = published(3);
        assertEquals(EventType.PHASE, events.get(0).type());
        assertEquals("Planning", events.get(0).content());
        assertEquals(PhaseKind.COMPLETE, ((Phase) events.get(1).payload()).kind());
        assertEquals(EventType.FINAL_ANSWER, events.get(2).type());
        assertEquals("Restart the pod.", events.get(2).content());
        assertEquals("q-1", events.get(2).channelId());

        assertTrue(session.isFinished());
        assertFalse(service.isSubscribed("q-1"));
    }

    @Test
    void shouldPublishErrorEventWithAgentMessage() {
        StreamSession session = new AgentStreamService(client, publisher, throttlers).subscribe("q-2");

        session.onEvent(new RawAgentEvent("error", null, "LLM quota exceeded", null));

        List<InvestigationEvent> events = published(2);
        assertEquals(PhaseKind.ERROR, ((Phase) events.get(0).payload()).kind());
        assertEquals(EventType.ERROR, events.get(1).type());
        assertEquals("LLM quota exceeded", events.get(1).content());
    }

    @Test
    void shouldTurnTransportFailureIntoTerminalError() {
        StreamSession session = new AgentStreamService(client, publisher, throttlers).subscribe("q-3");
        session.onEvent(new RawAgentEvent("command_start", null, null, null));

        session.onFailure(new StreamConnectionException("q-3", "reset"));

        List<InvestigationEvent> events = published(3);
        Phase terminal = (Phase) events.get(1).payload();
        assertEquals(PhaseKind.ERROR, terminal.kind());
        assertEquals("Lost connection to agent", terminal.message());
        assertEquals(1, terminal.commandHistory().size());
        assertEquals("Lost connection to agent", events.get(2).content());
    }

    @Test
    void shouldReplaceExistingSubscriptionForSameQuery() {
        AgentStreamService service = new AgentStreamService(client, publisher, throttlers);
        StreamSession first = service.subscribe("q-4");
        StreamSession second = service.subscribe("q-4");

        assertTrue(first.isFinished());
        assertFalse(second.isFinished());
        assertTrue(second.normalizer().history().isEmpty());

        assertTrue(service.unsubscribe("q-4"));
        assertFalse(service.unsubscribe("q-4"));
        assertTrue(second.isFinished());
    }

    @Test
    void shouldCloseConnectionWithSession() {
        StreamConnection connection = new StreamConnection("q-5");
        when(client.open(any(), any())).thenReturn(connection);
        AgentStreamService service = new AgentStreamService(client, publisher, throttlers);
        service.subscribe("q-5");

        service.closeAll();

        assertTrue(connection.isClosed());
    }

    private List<InvestigationEvent> published(int expected) {
        ArgumentCaptor<InvestigationEvent> captor = ArgumentCaptor.forClass(InvestigationEvent.class);
        verify(publisher, times(expected)).publishStream(captor.capture());
        return captor.getAllValues();
    }
}
