package com.openforge.clusterlens.investigation.diagnostic;

/**
 * A diagnostic call failed. The message carries the API server's wording
 * ("is not valid for", "forbidden", ...), which the tool layer classifies.
 */
public class DiagnosticException extends RuntimeException {

    private final String commandEquivalent;

    public DiagnosticException(String message, String commandEquivalent) {
        super(message);
        this.commandEquivalent = commandEquivalent;
    }

    public DiagnosticException(String message, String commandEquivalent, Throwable cause) {
        super(message, cause);
        this.commandEquivalent = commandEquivalent;
    }

    /** The kubectl equivalent of the failed call; may be null. */
    public String commandEquivalent() {
        return commandEquivalent;
    }
}
