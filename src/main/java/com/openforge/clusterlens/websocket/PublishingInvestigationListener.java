package com.openforge.clusterlens.websocket;

import com.openforge.clusterlens.investigation.InvestigationListener;
import com.openforge.clusterlens.investigation.InvestigationResult;
import com.openforge.clusterlens.investigation.InvestigationSession;
import com.openforge.clusterlens.investigation.Message;
import com.openforge.clusterlens.stream.Phase;
import com.openforge.clusterlens.stream.PhaseThrottler;

/**
 * Bridges one investigation turn to its WebSocket topic.
 *
 * Intermediate phases go through a {@link PhaseThrottler}; the terminal phase
 * closes the throttler and is published directly, so it is delivered exactly
 * once and never dropped by coalescing. Transcript messages are not throttled.
 */
public class PublishingInvestigationListener implements InvestigationListener {

    private final InvestigationSession   session;
    private final PhaseEventPublisher    publisher;
    private final PhaseThrottler<Phase>  throttler;

    public PublishingInvestigationListener(InvestigationSession session,
                                           PhaseEventPublisher publisher,
                                           PhaseThrottlerFactory throttlers) {
        this.session   = session;
        this.publisher = publisher;
        this.throttler = throttlers.create(phase ->
                publisher.publishInvestigation(InvestigationEvent.phase(session.id(), phase, session.iteration())));
    }

    @Override
    public void onPhase(Phase phase) {
        if (phase.isTerminal()) {
            throttler.close();
            publisher.publishInvestigation(InvestigationEvent.phase(session.id(), phase, session.iteration()));
            return;
        }
        throttler.emit(phase);
    }

    @Override
    public void onMessage(Message message) {
        publisher.publishInvestigation(InvestigationEvent.message(session.id(), message, session.iteration()));
    }

    @Override
    public void onFinished(InvestigationResult result) {
        throttler.close();
        publisher.publishInvestigation(InvestigationEvent.finished(session.id(), result));
    }
}
