package com.bayesnet.util;

import org.apache.logging.log4j.Logger;

import java.util.function.LongSupplier;

/**
 * Limits how often errors are written to a logger.
 *
 * A query that keeps failing the same way (a missing table, evidence with
 * zero probability) would otherwise log once per call. At most one message
 * is written per interval; the rest are counted and the count is reported
 * with the next message that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final LongSupplier clock;
    private long lastLogTime;
    private boolean logged;
    private long suppressed;

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, minIntervalMillis, System::nanoTime);
    }

    ErrorRateLimiter(Logger logger, long minIntervalMillis, LongSupplier clock) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.clock = clock;
    }

    /**
     * @return true if the message was written, false if it was suppressed.
     */
    public boolean log(String message, Throwable t) {
        long now = clock.getAsLong();
        if (logged && now - lastLogTime < minIntervalNanos) {
            suppressed++;
            return false;
        }
        if (suppressed > 0)
            logger.error("{} ({} similar errors suppressed)", message, suppressed, t);
        else
            logger.error(message, t);
        lastLogTime = now;
        logged = true;
        suppressed = 0;
        return true;
    }

    public long suppressedCount() {
        return suppressed;
    }
}
