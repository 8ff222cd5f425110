package com.bayesnet.api;

/**
 * Thrown when evidence names a state that is not among the node's declared
 * states.
 */
public class InvalidStateException extends IllegalArgumentException {
    private final String nodeName;
    private final String state;

    public InvalidStateException(String nodeName, String state) {
        super("Invalid state '" + state + "' for node '" + nodeName + "'");
        this.nodeName = nodeName;
        this.state = state;
    }

    public String nodeName() {
        return nodeName;
    }

    public String state() {
        return state;
    }
}
