package com.microtrader.config;

import com.microtrader.gateway.RetryPolicy;
import com.microtrader.gateway.Sleeper;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Timing, universe, scoring, execution and journal settings plus the time and sleep sources
 * every component shares.
 *
 * <p>Intervals are configured in seconds and backoffs in milliseconds.
 */
@Configuration
public class TradingConfig {

    @Bean
    public TradingSettings tradingSettings(
            @Value("${microtrader.scheduler.scan-interval:300}") long scanIntervalSeconds,
            @Value("${microtrader.scheduler.monitor-interval:5}") long monitorIntervalSeconds,
            @Value("${microtrader.scheduler.snapshot-interval:300}") long snapshotIntervalSeconds,
            @Value("${microtrader.scheduler.universe-refresh-interval:3600}") long universeRefreshSeconds,
            @Value("${microtrader.scheduler.shutdown-timeout:30}") long shutdownTimeoutSeconds,
            @Value("${microtrader.monitor.max-hold-time:300}") long maxHoldSeconds,
            @Value("${microtrader.universe.max-symbols:50}") int universeMaxSymbols,
            @Value("${microtrader.universe.min-volume-24h:1000000}") BigDecimal minVolume24h,
            @Value("${microtrader.scoring.min-confidence:0.6}") BigDecimal minConfidence,
            @Value("${microtrader.scoring.max-spread:0.005}") BigDecimal maxSpread,
            @Value("${microtrader.execution.max-attempts:3}") int maxAttempts,
            @Value("${microtrader.execution.initial-backoff-ms:200}") long initialBackoffMs,
            @Value("${microtrader.execution.max-backoff-ms:2000}") long maxBackoffMs,
            @Value("${microtrader.journal.path:logs/trade-journal.jsonl}") String journalPath) {
        return TradingSettings.builder()
                .scanInterval(Duration.ofSeconds(scanIntervalSeconds))
                .monitorInterval(Duration.ofSeconds(monitorIntervalSeconds))
                .snapshotInterval(Duration.ofSeconds(snapshotIntervalSeconds))
                .universeRefreshInterval(Duration.ofSeconds(universeRefreshSeconds))
                .shutdownTimeout(Duration.ofSeconds(shutdownTimeoutSeconds))
                .maxHoldTime(Duration.ofSeconds(maxHoldSeconds))
                .universeMaxSymbols(universeMaxSymbols)
                .minVolume24h(minVolume24h)
                .minConfidence(minConfidence)
                .maxSpread(maxSpread)
                .maxAttempts(maxAttempts)
                .initialBackoff(Duration.ofMillis(initialBackoffMs))
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .journalPath(Path.of(journalPath))
                .build()
                .validate();
    }

    @Bean
    public RetryPolicy retryPolicy(TradingSettings tradingSettings) {
        return RetryPolicy.builder()
                .maxAttempts(tradingSettings.getMaxAttempts())
                .initialBackoff(tradingSettings.getInitialBackoff())
                .maxBackoff(tradingSettings.getMaxBackoff())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }
}
