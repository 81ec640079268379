package com.openforge.clusterlens.investigation.tool;

/**
 * How many argument tokens a tool accepts after sanitization.
 */
public enum ArgumentShape {

    /** Any argument text is ignored. */
    NONE(0, 0),

    /** Zero or one token, e.g. a container name. */
    OPTIONAL_TOKEN(0, 1),

    /** Exactly one token, e.g. a resource kind. */
    REQUIRED_TOKEN(1, 1),

    /** Exactly two tokens: kind and name. */
    TWO_TOKENS(2, 2);

    private final int minTokens;
    private final int maxTokens;

    ArgumentShape(int minTokens, int maxTokens) {
        this.minTokens = minTokens;
        this.maxTokens = maxTokens;
    }

    public int minTokens() {
        return minTokens;
    }

    public int maxTokens() {
        return maxTokens;
    }
}
