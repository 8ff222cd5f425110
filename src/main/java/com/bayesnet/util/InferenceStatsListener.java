package com.bayesnet.util;

import com.bayesnet.api.InferenceListener;
import com.bayesnet.api.QueryKind;

import java.util.EnumMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that tracks query latency and failures.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per successful query (in
 * nanoseconds).</li>
 * <li><b>Throughput:</b> Number of queries per {@link QueryKind}.</li>
 * <li><b>Failures:</b> Number of failed queries. Failures are logged through
 * an {@link ErrorRateLimiter}.</li>
 * </ul>
 *
 * <p>
 * Nested queries are counted separately: an inference query that computes a
 * marginal is reported once, as INFERENCE.
 */
public final class InferenceStatsListener implements InferenceListener {
    private static final Logger log = LogManager.getLogger(InferenceStatsListener.class);

    private final ErrorRateLimiter errLimiter;
    private final Map<QueryKind, Long> queriesByKind = new EnumMap<>(QueryKind.class);
    private long totalQueries, totalErrors, totalLatencyNanos, lastLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;

    public InferenceStatsListener() {
        this(new ErrorRateLimiter(log, 1000)); // 1-second throttle
    }

    public InferenceStatsListener(ErrorRateLimiter errLimiter) {
        this.errLimiter = errLimiter;
    }

    @Override
    public void onQueryStart(long queryId, QueryKind kind, String node) {
        queriesByKind.merge(kind, 1L, Long::sum);
    }

    @Override
    public void onQueryEnd(long queryId, QueryKind kind, String node, long durationNanos) {
        totalQueries++;
        lastLatencyNanos = durationNanos;
        totalLatencyNanos += durationNanos;
        if (durationNanos < minLatencyNanos)
            minLatencyNanos = durationNanos;
        if (durationNanos > maxLatencyNanos)
            maxLatencyNanos = durationNanos;
    }

    @Override
    public void onQueryError(long queryId, QueryKind kind, String node, Throwable error) {
        totalErrors++;
        errLimiter.log(String.format("%s query #%d on '%s' failed: %s", kind, queryId, node, error.getMessage()),
                null);
    }

    public long totalQueries() {
        return totalQueries;
    }

    public long totalErrors() {
        return totalErrors;
    }

    public long queries(QueryKind kind) {
        return queriesByKind.getOrDefault(kind, 0L);
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public double avgLatencyNanos() {
        return totalQueries > 0 ? (double) totalLatencyNanos / totalQueries : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        queriesByKind.clear();
        totalQueries = 0;
        totalErrors = 0;
        totalLatencyNanos = 0;
        lastLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %10s | %10s | %10s | %10s\n", "Metric", "Count", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------\n");
        sb.append(String.format("%-12s | %10d | %10.2f | %10.2f | %10.2f\n",
                "Queries",
                totalQueries,
                avgLatencyNanos() / 1000.0,
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-12s | %10d |\n", "Errors", totalErrors));
        return sb.toString();
    }
}
