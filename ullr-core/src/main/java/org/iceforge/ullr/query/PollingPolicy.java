package org.iceforge.ullr.query;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs for {@link QueryExecutor}: how often to poll, when to give up, and how hard to retry a
 * throttled poll.
 */
public record PollingPolicy(
        Duration initialPollDelay,
        Duration maxPollDelay,
        double pollMultiplier,
        Duration timeout,
        int maxTransientRetries,
        Duration retryBaseDelay,
        Duration retryMaxDelay
) {
    public PollingPolicy {
        Objects.requireNonNull(initialPollDelay, "initialPollDelay");
        Objects.requireNonNull(maxPollDelay, "maxPollDelay");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
        Objects.requireNonNull(retryMaxDelay, "retryMaxDelay");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (pollMultiplier < 1.0d) {
            throw new IllegalArgumentException("pollMultiplier must be >= 1: " + pollMultiplier);
        }
        if (maxTransientRetries < 0) {
            throw new IllegalArgumentException("maxTransientRetries must be >= 0: " + maxTransientRetries);
        }
    }

    public static PollingPolicy defaults() {
        return new PollingPolicy(
                Duration.ofMillis(500),   // first wait
                Duration.ofSeconds(5),    // wait cap
                2.0d,
                Duration.ofSeconds(60),   // total ceiling
                5,                        // retries per poll
                Duration.ofMillis(250),
                Duration.ofSeconds(4)
        );
    }

    /** Wait before the poll following poll number {@code pollNumber} (0-based). */
    public Duration pollDelay(int pollNumber) {
        double ms = initialPollDelay.toMillis() * Math.pow(pollMultiplier, Math.min(pollNumber, 30));
        return Duration.ofMillis((long) Math.min(ms, (double) maxPollDelay.toMillis()));
    }

    /** Backoff before retry {@code attempt} (1-based) of a throttled poll. */
    public Duration retryBackoff(int attempt) {
        long ms = retryBaseDelay.toMillis() * (1L << Math.min(Math.max(attempt - 1, 0), 16));
        return Duration.ofMillis(Math.min(ms, retryMaxDelay.toMillis()));
    }
}
