package com.microtrader.config;

import com.microtrader.exception.ConfigurationException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Timing, universe, scoring and execution settings. Built once by {@link TradingConfig} and
 * passed to every component; nothing re-reads raw properties after startup.
 */
@Value
@Builder
public class TradingSettings {

    Duration scanInterval;
    Duration monitorInterval;
    Duration snapshotInterval;
    Duration universeRefreshInterval;
    Duration shutdownTimeout;

    /** Time-based stop for open positions. Zero disables it. */
    Duration maxHoldTime;

    int universeMaxSymbols;
    BigDecimal minVolume24h;

    BigDecimal minConfidence;
    BigDecimal maxSpread;

    int maxAttempts;
    Duration initialBackoff;
    Duration maxBackoff;

    Path journalPath;

    public TradingSettings validate() {
        requirePositive("scan-interval", scanInterval);
        requirePositive("monitor-interval", monitorInterval);
        requirePositive("snapshot-interval", snapshotInterval);
        requirePositive("universe-refresh-interval", universeRefreshInterval);
        requirePositive("shutdown-timeout", shutdownTimeout);
        if (monitorInterval.compareTo(scanInterval) >= 0) {
            throw new ConfigurationException("monitor-interval " + monitorInterval
                    + " must be shorter than scan-interval " + scanInterval);
        }
        if (maxHoldTime == null || maxHoldTime.isNegative()) {
            throw new ConfigurationException("max-hold-time must be zero or positive");
        }
        if (universeMaxSymbols < 1) {
            throw new ConfigurationException("universe max-symbols must be >= 1, got " + universeMaxSymbols);
        }
        if (minConfidence == null
                || minConfidence.signum() < 0
                || minConfidence.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigurationException("min-confidence must be within [0, 1], got " + minConfidence);
        }
        if (maxSpread == null || maxSpread.signum() <= 0) {
            throw new ConfigurationException("max-spread must be positive, got " + maxSpread);
        }
        if (maxAttempts < 1) {
            throw new ConfigurationException("execution max-attempts must be >= 1, got " + maxAttempts);
        }
        requirePositive("initial-backoff", initialBackoff);
        requirePositive("max-backoff", maxBackoff);
        if (journalPath == null) {
            throw new ConfigurationException("journal path is required");
        }
        return this;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(name + " must be a positive duration, got " + value);
        }
    }
}
