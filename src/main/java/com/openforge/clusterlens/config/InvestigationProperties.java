package com.openforge.clusterlens.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tuning knobs for the investigation loop.
 *
 * agent:
 *   investigation:
 *     max-iterations: 3          # follow-up model rounds after the first reply
 *     output-limit: 4000         # characters of tool output kept per outcome
 *     log-tail-lines: 100        # lines requested from the log endpoints
 *     throttle-window: 500ms     # progress phases are coalesced to one per window
 */
@ConfigurationProperties(prefix = "agent.investigation")
public record InvestigationProperties(
        @DefaultValue("3")     int      maxIterations,
        @DefaultValue("4000")  int      outputLimit,
        @DefaultValue("100")   int      logTailLines,
        @DefaultValue("500ms") Duration throttleWindow
) {

    public static InvestigationProperties defaults() {
        return new InvestigationProperties(3, 4000, 100, Duration.ofMillis(500));
    }
}
