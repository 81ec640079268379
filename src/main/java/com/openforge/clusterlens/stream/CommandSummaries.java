package com.openforge.clusterlens.stream;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One-line summaries for command outputs that arrive without one.
 */
public final class CommandSummaries {

    private static final int      FIRST_LINE_LIMIT = 80;
    private static final Pattern  CRASH_LOOP       = Pattern.compile("CrashLoopBackOff");

    private CommandSummaries() {}

    /**
     * First matching rule wins:
     *   no output                         → "No output"
     *   command contains "get", data rows → "Found N resource(s)" (header rows excluded)
     *   output mentions error / failed    → "Command failed - see raw output"
     *   CrashLoopBackOff occurrences      → "Found N pod(s) in CrashLoopBackOff"
     *   otherwise                         → first non-empty line, cut to 80 chars
     */
    public static String summarize(String output, String command) {
        if (output == null || output.isEmpty()) {
            return "No output";
        }
        String[] lines = output.split("\n", -1);

        if (command != null && command.contains("get")) {
            long rows = Arrays.stream(lines)
                    .filter(l -> !l.isBlank())
                    .filter(l -> !l.startsWith("NAME") && !l.startsWith("NAMESPACE"))
                    .count();
            if (rows > 0) {
                return "Found %d resource(s)".formatted(rows);
            }
        }

        String lower = output.toLowerCase();
        if (lower.contains("error") || lower.contains("failed")) {
            return "Command failed - see raw output";
        }

        Matcher crashLoops = CRASH_LOOP.matcher(output);
        int count = 0;
        while (crashLoops.find()) {
            count++;
        }
        if (count > 0) {
            return "Found %d pod(s) in CrashLoopBackOff".formatted(count);
        }

        return Arrays.stream(lines)
                .filter(l -> !l.isBlank())
                .findFirst()
                .map(l -> l.length() > FIRST_LINE_LIMIT ? l.substring(0, FIRST_LINE_LIMIT) : l)
                .orElse("Command executed");
    }
}
