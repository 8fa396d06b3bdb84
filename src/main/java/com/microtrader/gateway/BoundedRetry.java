package com.microtrader.gateway;

import com.microtrader.exception.TransientGatewayException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs a gateway call, retrying only {@link TransientGatewayException}s according to the
 * configured {@link RetryPolicy}. Venue rejections and any other exception propagate on the
 * first occurrence.
 *
 * <p>When attempts run out the last transient exception is rethrown. An interrupt during the
 * backoff pause ends retrying early (interrupt flag restored).
 */
@Component
public class BoundedRetry {

    private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public BoundedRetry(RetryPolicy retryPolicy, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public <T> T call(String description, Supplier<T> action) {
        TransientGatewayException lastException = null;
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            try {
                return action.get();
            } catch (TransientGatewayException e) {
                lastException = e;
                log.warn(
                        "{} attempt {}/{} failed ({}): {}",
                        description,
                        attempt,
                        retryPolicy.getMaxAttempts(),
                        e.getKind(),
                        e.getMessage());
                if (attempt < retryPolicy.getMaxAttempts() && !pause(retryPolicy.backoffAfter(attempt))) {
                    break;
                }
            }
        }
        throw lastException;
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    private boolean pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
