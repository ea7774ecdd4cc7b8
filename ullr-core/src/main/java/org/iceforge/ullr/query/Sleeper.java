package org.iceforge.ullr.query;

import java.time.Duration;

/**
 * Wraps {@link Thread#sleep} so tests can advance a fake clock instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = d -> {
        if (!d.isNegative() && !d.isZero()) Thread.sleep(d.toMillis());
    };
}
