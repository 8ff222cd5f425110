package com.bayesnet.util;

import com.bayesnet.api.InferenceListener;
import com.bayesnet.api.QueryKind;

import java.util.Arrays;

/**
 * Aggregates multiple {@link InferenceListener} instances.
 */
public class CompositeInferenceListener implements InferenceListener {
    private InferenceListener[] listeners = new InferenceListener[0];

    public CompositeInferenceListener add(InferenceListener listener) {
        InferenceListener[] old = listeners;
        InferenceListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onQueryStart(long queryId, QueryKind kind, String node) {
        for (InferenceListener l : listeners)
            l.onQueryStart(queryId, kind, node);
    }

    @Override
    public void onQueryEnd(long queryId, QueryKind kind, String node, long durationNanos) {
        for (InferenceListener l : listeners)
            l.onQueryEnd(queryId, kind, node, durationNanos);
    }

    @Override
    public void onQueryError(long queryId, QueryKind kind, String node, Throwable error) {
        for (InferenceListener l : listeners)
            l.onQueryError(queryId, kind, node, error);
    }
}
