package com.bayesnet.api;

import java.util.Objects;

/**
 * An observation clamping a node to one of its states.
 *
 * @param node  The observed node's name.
 * @param state The observed state label.
 */
public record Evidence(String node, String state) {

    public Evidence {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(state, "state");
    }

    public static Evidence of(String node, String state) {
        return new Evidence(node, state);
    }
}
