package com.microtrader.monitor;

import com.microtrader.config.TradingSettings;
import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.ExitReason;
import com.microtrader.domain.enums.PositionStatus;
import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.MarketData;
import com.microtrader.domain.model.Position;
import com.microtrader.event.PositionEvent;
import com.microtrader.event.PositionEventType;
import com.microtrader.exception.TransientGatewayException;
import com.microtrader.exception.VenueRejectedException;
import com.microtrader.gateway.BoundedRetry;
import com.microtrader.gateway.CloseConfirmation;
import com.microtrader.gateway.MarketGateway;
import com.microtrader.risk.RiskManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Watches open positions and closes them when an exit rule fires.
 *
 * <p>Exit priority, first match wins:
 * <ol>
 *   <li>the reason the position was flagged with (SHUTDOWN through {@link #closeAll(ExitReason)}),
 *       or FORCED_CLOSE while the circuit breaker is latched</li>
 *   <li>STOP_LOSS: price crossed the stop-loss level</li>
 *   <li>TAKE_PROFIT: price crossed the take-profit level</li>
 *   <li>TIME_STOP: held for at least {@code maxHoldTime} (disabled when zero)</li>
 * </ol>
 *
 * <p>A position that is already CLOSING had a failed close on an earlier poll and gets its close
 * retried. Polls never overlap: a poll that finds the previous one still running returns
 * immediately.
 */
@Service
public class PositionMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);

    private final RiskManager riskManager;
    private final MarketGateway marketGateway;
    private final BoundedRetry boundedRetry;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final Duration maxHoldTime;

    private final ReentrantLock pollLock = new ReentrantLock();

    /** Last price seen per position id; exit price fallback when the venue already flattened it. */
    private final Map<String, BigDecimal> lastObservedPrices = new ConcurrentHashMap<>();

    public PositionMonitor(
            RiskManager riskManager,
            MarketGateway marketGateway,
            BoundedRetry boundedRetry,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock,
            TradingSettings tradingSettings) {
        this.riskManager = riskManager;
        this.marketGateway = marketGateway;
        this.boundedRetry = boundedRetry;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        this.maxHoldTime = tradingSettings.getMaxHoldTime();
    }

    /**
     * Evaluates every tracked position once.
     *
     * @return number of positions closed by this poll, or 0 if another poll was still running
     */
    public int poll() {
        if (!pollLock.tryLock()) {
            log.debug("Previous monitor poll still running, skipping");
            return 0;
        }
        try {
            boolean halted = riskManager.isHalted();
            int closed = 0;
            for (Position position : riskManager.getPositions()) {
                try {
                    if (evaluate(position, halted)) {
                        closed++;
                    }
                } catch (RuntimeException e) {
                    log.error("Monitor failed on position {}", position.getId(), e);
                }
            }
            return closed;
        } finally {
            pollLock.unlock();
        }
    }

    /**
     * Flags every open position for forced close with the given reason and runs a poll.
     * Positions filled after this call are flagged on confirmation and closed by later polls.
     */
    public int closeAll(ExitReason reason) {
        int flagged = riskManager.flagAllForClose(reason);
        log.warn("Closing all positions ({}): {} newly flagged", reason, flagged);
        return poll();
    }

    public boolean hasOpenPositions() {
        return riskManager.getOpenPositionCount() > 0;
    }

    // ========================
    // EXIT RULES
    // ========================

    private boolean evaluate(Position position, boolean halted) {
        if (position.getStatus() == PositionStatus.CLOSING) {
            log.info("Retrying close of {} ({})", position.getId(), position.getExitReason());
            return attemptClose(position);
        }
        if (position.getStatus() != PositionStatus.OPEN) {
            return false;
        }

        ExitReason reason;
        if (position.isForceClose()) {
            reason = position.getForcedExitReason();
        } else if (halted) {
            reason = ExitReason.FORCED_CLOSE;
        } else {
            BigDecimal price = currentPrice(position);
            if (price == null) {
                return false;
            }
            reason = exitReasonFor(position, price, clock.instant());
            if (reason == null) {
                return false;
            }
        }

        if (!riskManager.beginClosing(position, reason)) {
            log.debug("Position {} is no longer open, not closing", position.getId());
            return false;
        }
        log.info("Exit triggered for {} {}: {}", position.getId(), position.getInstrumentId(), reason);
        return attemptClose(position);
    }

    /**
     * Stop-loss, take-profit and time stop, in that order. Null when no rule fires.
     */
    ExitReason exitReasonFor(Position position, BigDecimal price, Instant now) {
        boolean isLong = position.getDirection() == Direction.LONG;
        int toStop = price.compareTo(position.getStopLoss());
        if (isLong ? toStop <= 0 : toStop >= 0) {
            return ExitReason.STOP_LOSS;
        }
        int toTarget = price.compareTo(position.getTakeProfit());
        if (isLong ? toTarget >= 0 : toTarget <= 0) {
            return ExitReason.TAKE_PROFIT;
        }
        if (!maxHoldTime.isZero()
                && Duration.between(position.getOpenedAt(), now).compareTo(maxHoldTime) >= 0) {
            return ExitReason.TIME_STOP;
        }
        return null;
    }

    private BigDecimal currentPrice(Position position) {
        try {
            MarketData marketData = marketGateway.getMarketData(position.getInstrument());
            BigDecimal price = marketData.getLastPrice();
            if (price != null) {
                lastObservedPrices.put(position.getId(), price);
            }
            return price;
        } catch (TransientGatewayException | VenueRejectedException e) {
            log.warn("No price for {} this poll: {}", position.getInstrumentId(), e.getMessage());
            return null;
        }
    }

    // ========================
    // CLOSING
    // ========================

    private boolean attemptClose(Position position) {
        BigDecimal exitPrice;
        Instant closedAt;
        try {
            CloseConfirmation confirmation = boundedRetry.call(
                    "closePosition(" + position.getId() + ")", () -> marketGateway.closePosition(position.getId()));
            exitPrice = confirmation.getExitPrice() != null ? confirmation.getExitPrice() : fallbackExitPrice(position);
            closedAt = confirmation.getFilledAt() != null ? confirmation.getFilledAt() : clock.instant();
        } catch (VenueRejectedException e) {
            if (e.getKind() != VenueRejectedException.Kind.ALREADY_CLOSED) {
                log.error(
                        "Venue refused to close {} ({}): {}; will retry next poll",
                        position.getId(),
                        e.getKind(),
                        e.getMessage());
                return false;
            }
            exitPrice = fallbackExitPrice(position);
            closedAt = clock.instant();
            log.warn("Position {} already closed at venue, booking at {}", position.getId(), exitPrice);
        } catch (TransientGatewayException e) {
            log.warn("Close of {} failed ({}), will retry next poll", position.getId(), e.getKind());
            return false;
        }

        ClosedTrade trade = riskManager.recordClose(position, exitPrice, closedAt);
        lastObservedPrices.remove(position.getId());
        log.debug("Recorded {}", trade);
        applicationEventPublisher.publishEvent(new PositionEvent(this, position, PositionEventType.CLOSED));
        return true;
    }

    private BigDecimal fallbackExitPrice(Position position) {
        BigDecimal observed = lastObservedPrices.get(position.getId());
        return observed != null ? observed : position.getEntryPrice();
    }
}
