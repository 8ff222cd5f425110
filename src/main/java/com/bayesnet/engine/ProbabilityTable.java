package com.bayesnet.engine;

import com.bayesnet.tensor.Tensor;

import java.util.List;

/**
 * The probabilistic attributes of one node: its table, its state labels and
 * the names of the parents indexing the table's trailing axes.
 *
 * Parent names are plain names, resolved against the network on every
 * query.
 */
public record ProbabilityTable(Tensor table, List<String> states, List<String> parentNames) {

    public ProbabilityTable {
        states = List.copyOf(states);
        parentNames = List.copyOf(parentNames);
    }

    /** Position of a state along axis 0, or -1 if the node has no such state. */
    public int stateIndex(String state) {
        return states.indexOf(state);
    }

    public boolean isRoot() {
        return parentNames.isEmpty();
    }
}
