package com.openforge.clusterlens.investigation;

import com.openforge.clusterlens.stream.Phase;

/**
 * Receives progress from one investigation turn. Passed to the orchestrator
 * per call; the web layer throttles phases before they reach a client.
 */
public interface InvestigationListener {

    InvestigationListener NONE = new InvestigationListener() {
    };

    default void onPhase(Phase phase) {
    }

    default void onMessage(Message message) {
    }

    /** Called exactly once per turn, after the transcript holds its final message. */
    default void onFinished(InvestigationResult result) {
    }
}
