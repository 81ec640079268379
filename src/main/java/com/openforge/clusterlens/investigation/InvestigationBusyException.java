package com.openforge.clusterlens.investigation;

/**
 * Thrown when a question is submitted while the session's loop is still running.
 * Questions are never queued.
 */
public class InvestigationBusyException extends RuntimeException {

    public InvestigationBusyException(String sessionId) {
        super("Investigation " + sessionId + " is already running");
    }
}
