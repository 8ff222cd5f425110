package com.bayesnet.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for a {@link BayesianNetwork}.
 */
@Value
@Builder
public class NetworkOptions {

    /**
     * When set, addProbabilityTable also checks that the dependency list
     * names exactly the node's structural parents. Order is still taken as
     * given.
     */
    @Builder.Default
    boolean validateParentNames = false;

    /** Allowed deviation from 1 of a marginal's total before a warning is logged. */
    @Builder.Default
    double tolerance = 1e-9;

    public static NetworkOptions defaults() {
        return NetworkOptions.builder().build();
    }
}
