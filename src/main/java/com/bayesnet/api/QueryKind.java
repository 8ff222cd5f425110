package com.bayesnet.api;

/** The kind of query reported to an {@link InferenceListener}. */
public enum QueryKind {
    JOINT,
    MARGINAL,
    INFERENCE
}
