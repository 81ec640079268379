package com.openforge.clusterlens.investigation;

/**
 * Orchestration state of one session.
 *
 *   IDLE → AWAITING_MODEL → PARSING_TOOLS ─(no tools)→ COMPLETE
 *                                 │
 *                                 └→ EXECUTING_TOOLS → AWAITING_MODEL (iteration + 1) → …
 *
 * ABORTED and CANCELLED are reachable from any active state. Terminal states
 * are re-entrant: the next question starts again at AWAITING_MODEL.
 */
public enum InvestigationState {
    IDLE,
    AWAITING_MODEL,
    PARSING_TOOLS,
    EXECUTING_TOOLS,
    COMPLETE,
    ABORTED,
    CANCELLED;

    public boolean isActive() {
        return this == AWAITING_MODEL || this == PARSING_TOOLS || this == EXECUTING_TOOLS;
    }
}
