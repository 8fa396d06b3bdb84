package com.microtrader.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/**
 * Cooperative stop flag. Raised once by the scheduler on shutdown; the scan cycle checks it
 * between opportunities and stops admitting new entries.
 */
@Component
public class ShutdownSignal {

    private final AtomicBoolean raised = new AtomicBoolean(false);

    /** @return true if this call raised the signal, false if it was already up */
    public boolean raise() {
        return raised.compareAndSet(false, true);
    }

    public boolean isRaised() {
        return raised.get();
    }

    /** Lowers the signal so a restarted lifecycle can trade again. */
    void clear() {
        raised.set(false);
    }
}
