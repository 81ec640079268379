package com.openforge.clusterlens.stream;

/**
 * The agent push feed could not be opened, or broke before it finished.
 */
public class StreamConnectionException extends RuntimeException {

    private final String queryId;

    public StreamConnectionException(String queryId, String message) {
        super(message);
        this.queryId = queryId;
    }

    public StreamConnectionException(String queryId, String message, Throwable cause) {
        super(message, cause);
        this.queryId = queryId;
    }

    public String queryId() {
        return queryId;
    }
}
