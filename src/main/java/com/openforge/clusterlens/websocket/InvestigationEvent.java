package com.openforge.clusterlens.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clusterlens.investigation.InvestigationResult;
import com.openforge.clusterlens.investigation.Message;
import com.openforge.clusterlens.stream.Phase;

/**
 * The single event envelope broadcast over WebSocket.
 *
 * Fields:
 *   channelId  — investigation session id, or agent query id for push feeds
 *   type       — discriminator; tells the frontend how to render the event
 *   content    — free-form text (answer for FINAL_ANSWER, message for ERROR)
 *   payload    — Phase, Message or InvestigationResult; null for plain text events
 *   iteration  — loop iteration that produced the event (0 for push feeds)
 *   timestamp  — epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record InvestigationEvent(
        String    channelId,
        EventType type,
        String    content,
        Object    payload,
        int       iteration,
        long      timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static InvestigationEvent phase(String channelId, Phase phase, int iteration) {
        return new InvestigationEvent(channelId, EventType.PHASE, phase.message(), phase, iteration, now());
    }

    public static InvestigationEvent message(String channelId, Message message, int iteration) {
        return new InvestigationEvent(channelId, EventType.MESSAGE, null, message, iteration, now());
    }

    public static InvestigationEvent finished(String channelId, InvestigationResult result) {
        EventType type = switch (result.state()) {
            case COMPLETE -> EventType.FINAL_ANSWER;
            default       -> EventType.ERROR;
        };
        return new InvestigationEvent(channelId, type, result.answer(), result, result.iterations(), now());
    }

    public static InvestigationEvent finalAnswer(String channelId, String answer) {
        return new InvestigationEvent(channelId, EventType.FINAL_ANSWER, answer, null, 0, now());
    }

    public static InvestigationEvent error(String channelId, String message) {
        return new InvestigationEvent(channelId, EventType.ERROR, message, null, 0, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
