package com.openforge.clusterlens.stream;

/**
 * Callbacks of one push-feed connection, invoked on the reader thread.
 */
public interface AgentStreamListener {

    void onEvent(RawAgentEvent event);

    /** The feed broke or ended before a done or error event. Not called after close(). */
    void onFailure(StreamConnectionException failure);
}
