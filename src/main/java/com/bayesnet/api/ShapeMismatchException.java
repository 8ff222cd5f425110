package com.bayesnet.api;

/**
 * Thrown when a probability table is inconsistent with the node it is being
 * attached to: wrong number of states, wrong number of parent axes, or a
 * dependency list that does not line up with the table's trailing axes.
 *
 * The network is left in its previous state when this is thrown.
 */
public class ShapeMismatchException extends IllegalArgumentException {
    private final String nodeName;

    public ShapeMismatchException(String nodeName, String message) {
        super(message + " (node '" + nodeName + "')");
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
