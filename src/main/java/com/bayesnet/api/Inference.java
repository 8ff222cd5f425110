package com.bayesnet.api;

import com.bayesnet.tensor.Tensor;

import java.util.List;

/**
 * Result of an inference query on a single node.
 *
 * Either the node is observed, in which case the observed state is returned
 * as is and no distribution is computed, or it is not, in which case the
 * posterior marginal over the node's states is returned.
 *
 * @param node          The queried node.
 * @param observedState The clamped state, or null if the node is not observed.
 * @param distribution  The posterior marginal, or null if the node is observed.
 * @param states        The node's state labels, in axis order.
 */
public record Inference(String node, String observedState, Tensor distribution, List<String> states) {

    public static Inference observed(String node, String state, List<String> states) {
        return new Inference(node, state, null, List.copyOf(states));
    }

    public static Inference believed(String node, Tensor distribution, List<String> states) {
        return new Inference(node, null, distribution, List.copyOf(states));
    }

    public boolean isObserved() {
        return observedState != null;
    }

    /**
     * Probability of the given state. For an observed node this is 1 for the
     * observed state and 0 otherwise.
     *
     * @throws InvalidStateException if the state is not one of the node's
     *                               states.
     */
    public double probabilityOf(String state) {
        int idx = states.indexOf(state);
        if (idx < 0)
            throw new InvalidStateException(node, state);
        if (isObserved())
            return observedState.equals(state) ? 1.0 : 0.0;
        return distribution.get(idx);
    }

    /** The most probable state; the observed state if the node is observed. */
    public String mostLikelyState() {
        if (isObserved())
            return observedState;
        int best = 0;
        for (int i = 1; i < states.size(); i++)
            if (distribution.get(i) > distribution.get(best))
                best = i;
        return states.get(best);
    }
}
