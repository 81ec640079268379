package com.openforge.clusterlens.stream;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CommandSummariesTest {

    @Test
    void shouldReportMissingOutput() {
        assertEquals("No output", CommandSummaries.summarize(null, "kubectl get pods"));
        assertEquals("No output", CommandSummaries.summarize("", null));
    }

    @Test
    void shouldCountRowsOfGetCommandsWithoutHeader() {
        String output = """
                NAME      READY   STATUS    RESTARTS
                web-1     1/1     Running   0
                web-2     0/1     Error     4

                """;
        assertEquals("Found 2 resource(s)", CommandSummaries.summarize(output, "kubectl get pods -n shop"));
    }

    @Test
    void shouldFlagFailuresBeforeCountingCrashLoops() {
        assertEquals("Command failed - see raw output",
                CommandSummaries.summarize("Error from server (NotFound)", "kubectl describe pod x"));
        assertEquals("Found 2 pod(s) in CrashLoopBackOff",
                CommandSummaries.summarize("web-1 CrashLoopBackOff\nweb-2 CrashLoopBackOff", "kubectl describe pods"));
    }

    @Test
    void shouldFallBackToFirstNonEmptyLine() {
        String longLine = "x".repeat(120);
        assertEquals("x".repeat(80), CommandSummaries.summarize("\n  \n" + longLine, "kubectl logs web-1"));
        assertEquals("Command executed", CommandSummaries.summarize("\n \n", "kubectl logs web-1"));
    }
}
