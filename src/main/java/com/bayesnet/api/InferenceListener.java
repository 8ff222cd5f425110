package com.bayesnet.api;

/**
 * Observability interface for monitoring queries against a network.
 *
 * Implementations can be registered with the network to receive callbacks
 * around every joint, marginal and inference query. Typical uses are
 * profiling query latency and counting failing queries.
 *
 * Callbacks run synchronously on the caller's thread, inside the query.
 * They must not throw and must not mutate the network.
 */
public interface InferenceListener {

    /**
     * Called before a query starts.
     *
     * @param queryId Monotonic id of the query within the network.
     * @param kind    The kind of query.
     * @param node    The queried node, or null for a joint query.
     */
    void onQueryStart(long queryId, QueryKind kind, String node);

    /**
     * Called after a query returned successfully.
     *
     * @param durationNanos Wall time spent in the query.
     */
    void onQueryEnd(long queryId, QueryKind kind, String node, long durationNanos);

    /**
     * Called when a query fails. The error is rethrown to the caller after
     * this returns.
     */
    void onQueryError(long queryId, QueryKind kind, String node, Throwable error);
}
