package com.microtrader.scheduler;

import com.microtrader.domain.enums.RiskState;
import com.microtrader.domain.model.Opportunity;
import com.microtrader.execution.ExecutionCoordinator;
import com.microtrader.execution.ExecutionSummary;
import com.microtrader.risk.RiskManager;
import com.microtrader.scanner.MarketScanner;
import com.microtrader.scoring.OpportunityScorer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One pass of scan, score, gate and execute.
 *
 * <p>Cycles never overlap: if the previous cycle is still running the new one returns
 * immediately. Entries are pointless while the account is not NORMAL, so the cycle skips the
 * scan entirely in that case and spares the venue the market data calls.
 */
@Service
public class ScanCycle {

    private static final Logger log = LoggerFactory.getLogger(ScanCycle.class);

    private final RiskManager riskManager;
    private final MarketScanner marketScanner;
    private final OpportunityScorer opportunityScorer;
    private final ExecutionCoordinator executionCoordinator;
    private final ShutdownSignal shutdownSignal;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    public ScanCycle(
            RiskManager riskManager,
            MarketScanner marketScanner,
            OpportunityScorer opportunityScorer,
            ExecutionCoordinator executionCoordinator,
            ShutdownSignal shutdownSignal,
            Clock clock) {
        this.riskManager = riskManager;
        this.marketScanner = marketScanner;
        this.opportunityScorer = opportunityScorer;
        this.executionCoordinator = executionCoordinator;
        this.shutdownSignal = shutdownSignal;
        this.clock = clock;
    }

    /**
     * @return the execution tally, or empty when the cycle was skipped or failed
     */
    public Optional<ExecutionSummary> run() {
        if (!cycleLock.tryLock()) {
            log.warn("Previous scan cycle still running, skipping this one");
            return Optional.empty();
        }
        try {
            if (shutdownSignal.isRaised()) {
                log.debug("Shutdown in progress, no scan");
                return Optional.empty();
            }
            RiskState state = riskManager.getState();
            if (state != RiskState.NORMAL) {
                log.info("Risk state {}, skipping scan cycle", state);
                return Optional.empty();
            }

            Instant cycleTimestamp = clock.instant();
            List<Opportunity> ranked = opportunityScorer.rank(marketScanner.scan(), cycleTimestamp);
            ExecutionSummary summary = ranked.isEmpty()
                    ? ExecutionSummary.empty()
                    : executionCoordinator.execute(ranked);

            log.info(
                    "Scan cycle done in {} ms: {} opportunities, filled={} rejected={} failed={} skipped={}",
                    Duration.between(cycleTimestamp, clock.instant()).toMillis(),
                    ranked.size(),
                    summary.getFilled(),
                    summary.getRejected(),
                    summary.getFailed(),
                    summary.getSkipped());
            return Optional.of(summary);
        } catch (RuntimeException e) {
            log.error("Scan cycle failed", e);
            return Optional.empty();
        } finally {
            cycleLock.unlock();
        }
    }
}
