package com.openforge.clusterlens.investigation.diagnostic;

/**
 * Text output of one read-only diagnostic call.
 *
 * @param text              human-readable output handed to the model
 * @param commandEquivalent the kubectl command that would show the same data
 */
public record DiagnosticResult(String text, String commandEquivalent) {

    public DiagnosticResult {
        text = text == null ? "" : text;
    }
}
