package com.bayesnet.api;

/**
 * Thrown when a node name does not resolve to a node of the network.
 */
public class NodeNotFoundException extends IllegalArgumentException {
    private final String nodeName;

    public NodeNotFoundException(String nodeName) {
        super("Unknown node: " + nodeName);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
