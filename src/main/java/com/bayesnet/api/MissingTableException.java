package com.bayesnet.api;

/**
 * Thrown when a joint, marginal or inference query reaches a node that has
 * no probability table attached yet.
 */
public class MissingTableException extends IllegalStateException {
    private final String nodeName;

    public MissingTableException(String nodeName) {
        super("No probability table attached to node '" + nodeName + "'");
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
