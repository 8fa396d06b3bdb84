package com.microtrader.scheduler;

import com.microtrader.config.TradingSettings;
import com.microtrader.domain.enums.ExitReason;
import com.microtrader.gateway.BoundedRetry;
import com.microtrader.gateway.MarketGateway;
import com.microtrader.gateway.Sleeper;
import com.microtrader.monitor.PositionMonitor;
import com.microtrader.performance.PerformanceTracker;
import com.microtrader.risk.RiskLimits;
import com.microtrader.risk.RiskManager;
import com.microtrader.universe.UniverseManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Owns the trading loop's lifecycle.
 *
 * <p>On start: verify the venue balance against the configured capital, load the universe, then
 * schedule four fixed-delay tasks on the shared trading pool:
 * <ul>
 *   <li>scan cycle, every {@code scan-interval}, first run immediately</li>
 *   <li>position monitor, every {@code monitor-interval}</li>
 *   <li>performance snapshot, every {@code snapshot-interval}</li>
 *   <li>universe refresh, every {@code universe-refresh-interval}</li>
 * </ul>
 * Each tick applies the trading-day rollover first and never lets an exception escape, so a
 * failing tick does not cancel its task.
 *
 * <p>On stop: raise the shutdown signal, cancel scan, refresh and snapshot without interrupting
 * a running cycle, force-close every position and keep polling until none remain or the
 * shutdown timeout expires, cancel the monitor and take a final snapshot.
 */
@Component
public class TradingScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TradingScheduler.class);

    static final Duration SHUTDOWN_POLL_INTERVAL = Duration.ofSeconds(1);

    private final TaskScheduler taskScheduler;
    private final TradingSettings tradingSettings;
    private final RiskManager riskManager;
    private final MarketGateway marketGateway;
    private final BoundedRetry boundedRetry;
    private final UniverseManager universeManager;
    private final ScanCycle scanCycle;
    private final PositionMonitor positionMonitor;
    private final PerformanceTracker performanceTracker;
    private final ShutdownSignal shutdownSignal;
    private final Sleeper sleeper;
    private final Clock clock;
    private final boolean autoStartup;

    private volatile boolean running;
    private ScheduledFuture<?> scanTask;
    private ScheduledFuture<?> monitorTask;
    private ScheduledFuture<?> snapshotTask;
    private ScheduledFuture<?> refreshTask;

    public TradingScheduler(
            @Qualifier("tradingTaskScheduler") TaskScheduler taskScheduler,
            TradingSettings tradingSettings,
            RiskManager riskManager,
            MarketGateway marketGateway,
            BoundedRetry boundedRetry,
            UniverseManager universeManager,
            ScanCycle scanCycle,
            PositionMonitor positionMonitor,
            PerformanceTracker performanceTracker,
            ShutdownSignal shutdownSignal,
            Sleeper sleeper,
            Clock clock,
            @Value("${microtrader.scheduler.auto-start:true}") boolean autoStartup) {
        this.taskScheduler = taskScheduler;
        this.tradingSettings = tradingSettings;
        this.riskManager = riskManager;
        this.marketGateway = marketGateway;
        this.boundedRetry = boundedRetry;
        this.universeManager = universeManager;
        this.scanCycle = scanCycle;
        this.positionMonitor = positionMonitor;
        this.performanceTracker = performanceTracker;
        this.shutdownSignal = shutdownSignal;
        this.sleeper = sleeper;
        this.clock = clock;
        this.autoStartup = autoStartup;
    }

    // ========================
    // START
    // ========================

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        shutdownSignal.clear();
        riskManager.clearCloseAll();
        RiskLimits limits = riskManager.getLimits();
        log.info(
                "Starting trading loop: capital={} maxConcurrent={} size=[{}, {}] scan={} monitor={} snapshot={}",
                limits.getInitialCapital(),
                limits.getMaxConcurrentPositions(),
                limits.getMinPositionSize(),
                limits.getMaxPositionSize(),
                tradingSettings.getScanInterval(),
                tradingSettings.getMonitorInterval(),
                tradingSettings.getSnapshotInterval());

        verifyBalance(limits.getInitialCapital());
        if (!universeManager.refresh()) {
            log.warn("Initial universe load failed; scan cycles are no-ops until a refresh succeeds");
        }

        Instant now = clock.instant();
        scanTask = taskScheduler.scheduleWithFixedDelay(
                tick("scan", scanCycle::run), tradingSettings.getScanInterval());
        monitorTask = taskScheduler.scheduleWithFixedDelay(
                tick("monitor", positionMonitor::poll), tradingSettings.getMonitorInterval());
        snapshotTask = taskScheduler.scheduleWithFixedDelay(
                tick("snapshot", performanceTracker::takeSnapshot),
                now.plus(tradingSettings.getSnapshotInterval()),
                tradingSettings.getSnapshotInterval());
        refreshTask = taskScheduler.scheduleWithFixedDelay(
                tick("universe-refresh", universeManager::refresh),
                now.plus(tradingSettings.getUniverseRefreshInterval()),
                tradingSettings.getUniverseRefreshInterval());
        running = true;
    }

    private void verifyBalance(BigDecimal initialCapital) {
        try {
            BigDecimal balance = boundedRetry.call("getBalance", marketGateway::getBalance);
            if (balance.compareTo(initialCapital) < 0) {
                log.warn("Venue balance {} is below configured initial capital {}", balance, initialCapital);
            } else {
                log.info("Venue balance {} (configured capital {})", balance, initialCapital);
            }
        } catch (RuntimeException e) {
            log.warn("Could not verify venue balance at startup: {}", e.getMessage());
        }
    }

    private Runnable tick(String name, Runnable task) {
        return () -> {
            try {
                riskManager.rolloverIfNeeded();
                task.run();
            } catch (RuntimeException e) {
                log.error("{} task failed", name, e);
            }
        };
    }

    // ========================
    // STOP
    // ========================

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.warn("Stopping trading loop");
        shutdownSignal.raise();
        cancel(scanTask);
        cancel(refreshTask);
        cancel(snapshotTask);

        drainPositions();

        cancel(monitorTask);
        try {
            performanceTracker.takeSnapshot();
        } catch (RuntimeException e) {
            log.error("Final performance snapshot failed", e);
        }
        running = false;
        log.info("Trading loop stopped");
    }

    private void drainPositions() {
        Instant deadline = clock.instant().plus(tradingSettings.getShutdownTimeout());
        positionMonitor.closeAll(ExitReason.SHUTDOWN);
        while ((positionMonitor.hasOpenPositions() || riskManager.hasPendingReservations())
                && clock.instant().isBefore(deadline)) {
            try {
                sleeper.sleep(SHUTDOWN_POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            positionMonitor.poll();
        }
        int remaining = riskManager.getOpenPositionCount();
        if (remaining > 0) {
            log.error(
                    "{} positions still open after shutdown timeout {}; close them at the venue manually",
                    remaining,
                    tradingSettings.getShutdownTimeout());
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
