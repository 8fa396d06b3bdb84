package com.microtrader.gateway;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Injected so tests can run backoff schedules in
 * virtual time.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
