package com.openforge.clusterlens.websocket;

/**
 * Classifies every frame pushed over WebSocket.
 *
 * Investigation flow: PHASE* / MESSAGE* interleaved → FINAL_ANSWER | ERROR.
 * Stream flow:        PHASE* → FINAL_ANSWER | ERROR.
 */
public enum EventType {

    /** Throttled progress snapshot. payload = Phase. */
    PHASE,

    /** A transcript entry was appended. payload = Message. */
    MESSAGE,

    /** Turn or stream finished with an answer. content = answer text. */
    FINAL_ANSWER,

    /** Turn aborted, cancelled, or stream lost. content = message. */
    ERROR
}
