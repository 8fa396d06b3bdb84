package com.microtrader.gateway;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Bounded exponential backoff: attempt n (1-based) waits
 * {@code min(initialBackoff * multiplier^(n-1), maxBackoff)} before attempt n+1.
 */
@Value
@Builder
public class RetryPolicy {

    int maxAttempts;
    Duration initialBackoff;
    Duration maxBackoff;

    @Builder.Default
    double multiplier = 2.0;

    /** Delay after the given failed attempt (1-based). */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, attempt - 1);
        long millis = (long) Math.min(initialBackoff.toMillis() * factor, (double) maxBackoff.toMillis());
        return Duration.ofMillis(millis);
    }
}
