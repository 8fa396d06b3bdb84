package com.microtrader.risk;

import com.microtrader.domain.enums.ExitReason;
import com.microtrader.domain.enums.RejectionReason;
import com.microtrader.domain.enums.RiskState;
import com.microtrader.domain.model.AccountSnapshot;
import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.Opportunity;
import com.microtrader.domain.model.Position;
import com.microtrader.event.RiskEvent;
import com.microtrader.event.RiskEventType;
import com.microtrader.event.RiskLevel;
import com.microtrader.exception.BusinessException;
import com.microtrader.exception.ErrorCode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * The safety core: admission gate, account bookkeeping and the risk state machine.
 *
 * <p>State machine over {@link AccountState}:
 * <ul>
 *   <li>NORMAL -> DAY_LIMIT_REACHED when daily P&L <= -dailyLossLimit * dayStartBalance.
 *       Entries blocked until the trading day rolls over; open positions keep running.</li>
 *   <li>NORMAL | DAY_LIMIT_REACHED -> HALTED when drawdown from peak >= maxDrawdownLimit, or
 *       loss since the session baseline >= circuitBreakerLimit. Every open position is flagged
 *       for forced close. Latched: only {@link #resetCircuitBreaker(String)} or a restart
 *       leaves HALTED.</li>
 *   <li>DAY_LIMIT_REACHED -> NORMAL on trading-day rollover.</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> the scan cycle and the position monitor run concurrently. Every read
 * and write of the account state, the open-position set and the reservations happens under a
 * single {@link ReentrantLock}. No gateway call is made while holding it. Events are collected
 * inside the critical section and published after the lock is released.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private static final int RATIO_SCALE = 8;
    private static final int MONEY_SCALE = 2;

    private final RiskLimits riskLimits;
    private final AccountState account;
    private final Clock clock;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final ReentrantLock accountLock = new ReentrantLock();

    /** Open and closing positions, keyed by position id, in opening order. */
    private final Map<String, Position> positions = new LinkedHashMap<>();

    private final Map<Long, Reservation> reservations = new LinkedHashMap<>();
    private final AtomicLong reservationSequence = new AtomicLong();

    /** Set by {@link #flagAllForClose(ExitReason)}; positions confirmed while set are flagged too. */
    private ExitReason closeAllReason;

    public RiskManager(
            RiskLimits riskLimits,
            AccountState account,
            Clock clock,
            ApplicationEventPublisher applicationEventPublisher) {
        this.riskLimits = riskLimits;
        this.account = account;
        this.clock = clock;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // ADMISSION GATE
    // ========================

    /**
     * Decides whether an opportunity may be executed and, if so, reserves its slot and capital.
     *
     * <p>Checks in order: circuit breaker, daily limit, concurrency cap (open + reserved),
     * one position per instrument, and sizing. Size is
     * {@code clamp(confidence * maxPositionSize, min, max)}, further capped so that committed
     * capital never exceeds {@code balance * maxPortfolioExposure}.
     *
     * <p>Successive calls are serialized; an approval's capital is reserved before the next
     * call is evaluated.
     */
    public AdmissionDecision admit(Opportunity opportunity) {
        List<RiskEvent> pending = new ArrayList<>();
        AdmissionDecision decision;
        accountLock.lock();
        try {
            rolloverIfNeededLocked(pending);
            decision = evaluateLocked(opportunity);
        } finally {
            accountLock.unlock();
        }
        publish(pending);
        return decision;
    }

    private AdmissionDecision evaluateLocked(Opportunity opportunity) {
        String instrumentId = opportunity.getInstrumentId();

        if (account.riskState() == RiskState.HALTED) {
            return AdmissionDecision.rejected(RejectionReason.CIRCUIT_BREAKER_HALTED, "circuit breaker latched");
        }
        if (account.riskState() == RiskState.DAY_LIMIT_REACHED) {
            return AdmissionDecision.rejected(
                    RejectionReason.DAILY_LIMIT_REACHED, "daily P&L " + account.dailyPnl());
        }

        int occupied = positions.size() + reservations.size();
        if (occupied >= riskLimits.getMaxConcurrentPositions()) {
            return AdmissionDecision.rejected(
                    RejectionReason.CONCURRENCY_CAP_REACHED,
                    occupied + " of " + riskLimits.getMaxConcurrentPositions() + " slots in use");
        }

        if (isInstrumentEngagedLocked(instrumentId)) {
            return AdmissionDecision.rejected(
                    RejectionReason.INSTRUMENT_ALREADY_HELD, instrumentId + " already held or pending");
        }

        BigDecimal available = account.balance()
                .multiply(riskLimits.getMaxPortfolioExposure())
                .subtract(committedCapitalLocked());
        BigDecimal size = sizeFor(opportunity.getConfidence()).min(available).setScale(MONEY_SCALE, RoundingMode.DOWN);
        BigDecimal venueMinimum = opportunity.getInstrument().getMinOrderSize();
        if (size.compareTo(riskLimits.getMinPositionSize()) < 0
                || (venueMinimum != null && size.compareTo(venueMinimum) < 0)) {
            return AdmissionDecision.rejected(
                    RejectionReason.SIZE_BELOW_MINIMUM, "size " + size + " with " + available + " available");
        }

        Reservation reservation = new Reservation(reservationSequence.incrementAndGet(), instrumentId, size);
        reservations.put(reservation.getId(), reservation);
        return AdmissionDecision.approved(reservation);
    }

    /**
     * Sizing before the capital cap: {@code clamp(confidence * maxPositionSize, min, max)}.
     */
    BigDecimal sizeFor(BigDecimal confidence) {
        BigDecimal raw = confidence.multiply(riskLimits.getMaxPositionSize());
        return raw.max(riskLimits.getMinPositionSize()).min(riskLimits.getMaxPositionSize());
    }

    // ========================
    // RESERVATION LIFECYCLE
    // ========================

    /**
     * Converts a reservation into an open position after the venue confirmed the fill.
     * If the breaker tripped in the meantime, or a close-all is under way, the position is flagged
     * for forced close at once.
     */
    public void confirmOpen(Reservation reservation, Position position) {
        accountLock.lock();
        try {
            if (reservations.remove(reservation.getId()) == null) {
                throw new IllegalStateException("Unknown or already settled reservation " + reservation);
            }
            positions.put(position.getId(), position);
            if (account.riskState() == RiskState.HALTED) {
                position.flagForcedClose(ExitReason.FORCED_CLOSE);
            } else if (closeAllReason != null) {
                position.flagForcedClose(closeAllReason);
            }
        } finally {
            accountLock.unlock();
        }
        log.info(
                "Position opened: {} {} {} size={} entry={} sl={} tp={}",
                position.getId(),
                position.getDirection(),
                position.getInstrumentId(),
                position.getSize(),
                position.getEntryPrice(),
                position.getStopLoss(),
                position.getTakeProfit());
    }

    /** Returns a reservation's slot and capital after a failed or skipped submission. */
    public void release(Reservation reservation) {
        accountLock.lock();
        try {
            if (reservations.remove(reservation.getId()) != null) {
                log.debug("Released {}", reservation);
            }
        } finally {
            accountLock.unlock();
        }
    }

    // ========================
    // POSITION TRANSITIONS
    // ========================

    /**
     * OPEN -> CLOSING. Returns false when the position is not open (another close is under way
     * or it is already closed), so callers never submit a duplicate close.
     */
    public boolean beginClosing(Position position, ExitReason reason) {
        accountLock.lock();
        try {
            return positions.containsKey(position.getId()) && position.beginClosing(reason);
        } finally {
            accountLock.unlock();
        }
    }

    /**
     * CLOSING -> CLOSED, booking realized P&L into balance, daily P&L and peak and evaluating
     * risk transitions, all in one critical section.
     */
    public ClosedTrade recordClose(Position position, BigDecimal exitPrice, Instant closedAt) {
        List<RiskEvent> pending = new ArrayList<>();
        ClosedTrade trade;
        accountLock.lock();
        try {
            if (positions.get(position.getId()) != position) {
                throw new IllegalStateException("Position " + position.getId() + " is not tracked");
            }
            BigDecimal pnl = position.pnlAt(exitPrice);
            position.complete(exitPrice, pnl, closedAt);
            positions.remove(position.getId());
            account.applyRealizedPnl(pnl);
            trade = ClosedTrade.of(position);
            evaluateTransitionsLocked(pending);
        } finally {
            accountLock.unlock();
        }
        log.info(
                "Position closed: {} {} reason={} exit={} pnl={}",
                position.getId(),
                position.getInstrumentId(),
                trade.getExitReason(),
                exitPrice,
                trade.getPnl());
        publish(pending);
        return trade;
    }

    /**
     * Flags every open position for forced close with {@code reason} and keeps flagging positions
     * confirmed afterwards until {@link #clearCloseAll()}.
     */
    public int flagAllForClose(ExitReason reason) {
        accountLock.lock();
        try {
            closeAllReason = reason;
            return flagAllLocked(reason);
        } finally {
            accountLock.unlock();
        }
    }

    /** Lifts the close-all latch set by {@link #flagAllForClose(ExitReason)}. */
    public void clearCloseAll() {
        accountLock.lock();
        try {
            closeAllReason = null;
        } finally {
            accountLock.unlock();
        }
    }

    // ========================
    // STATE MACHINE
    // ========================

    private void evaluateTransitionsLocked(List<RiskEvent> pending) {
        if (account.riskState() == RiskState.HALTED) {
            return;
        }

        BigDecimal drawdown = lossFraction(account.peakBalance(), account.balance());
        BigDecimal sessionLoss = lossFraction(account.sessionBaseline(), account.balance());
        boolean drawdownBreached = drawdown.compareTo(riskLimits.getMaxDrawdownLimit()) >= 0;
        boolean sessionLossBreached = sessionLoss.compareTo(riskLimits.getCircuitBreakerLimit()) >= 0;

        if (drawdownBreached || sessionLossBreached || account.balance().signum() == 0) {
            account.riskState(RiskState.HALTED);
            int flagged = flagAllLocked(ExitReason.FORCED_CLOSE);
            log.error(
                    "CIRCUIT BREAKER TRIPPED: balance={} peak={} drawdown={} sessionLoss={}; {} positions flagged for close",
                    account.balance(),
                    account.peakBalance(),
                    drawdown,
                    sessionLoss,
                    flagged);
            pending.add(new RiskEvent(
                    this,
                    RiskEventType.CIRCUIT_BREAKER_TRIPPED,
                    RiskLevel.CRITICAL,
                    drawdownBreached ? "Max drawdown reached" : "Circuit breaker loss reached",
                    Map.of(
                            "balance", account.balance(),
                            "peakBalance", account.peakBalance(),
                            "drawdown", drawdown,
                            "sessionLoss", sessionLoss,
                            "positionsFlagged", flagged)));
            return;
        }

        if (account.riskState() == RiskState.NORMAL && isDailyLimitBreachedLocked()) {
            account.riskState(RiskState.DAY_LIMIT_REACHED);
            log.warn(
                    "Daily loss limit reached: dailyPnl={} dayStartBalance={}; entries blocked until rollover",
                    account.dailyPnl(),
                    account.dayStartBalance());
            pending.add(new RiskEvent(
                    this,
                    RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                    RiskLevel.WARNING,
                    "Daily loss limit reached: " + account.dailyPnl(),
                    Map.of("dailyPnl", account.dailyPnl(), "dayStartBalance", account.dayStartBalance())));
        }
    }

    private boolean isDailyLimitBreachedLocked() {
        BigDecimal threshold = riskLimits.getDailyLossLimit().multiply(account.dayStartBalance()).negate();
        return account.dailyPnl().compareTo(threshold) <= 0;
    }

    /**
     * Applies the trading-day boundary if the clock's UTC date moved past the current day.
     * Called by every scheduled task before doing work.
     */
    public void rolloverIfNeeded() {
        List<RiskEvent> pending = new ArrayList<>();
        accountLock.lock();
        try {
            rolloverIfNeededLocked(pending);
        } finally {
            accountLock.unlock();
        }
        publish(pending);
    }

    private void rolloverIfNeededLocked(List<RiskEvent> pending) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.isAfter(account.tradingDay())) {
            return;
        }
        BigDecimal previousPnl = account.dailyPnl();
        account.startTradingDay(today);
        if (account.riskState() == RiskState.DAY_LIMIT_REACHED) {
            account.riskState(RiskState.NORMAL);
        }
        log.info(
                "Trading day rolled over to {}: dayStartBalance={}, previous dailyPnl={}, state={}",
                today,
                account.dayStartBalance(),
                previousPnl,
                account.riskState());
        pending.add(new RiskEvent(
                this,
                RiskEventType.TRADING_DAY_ROLLOVER,
                RiskLevel.INFO,
                "Trading day " + today,
                Map.of("previousDailyPnl", previousPnl, "dayStartBalance", account.dayStartBalance())));
    }

    /**
     * Manually clears a latched circuit breaker. Peak and session baseline are re-based to the
     * current balance so the same losses cannot immediately re-trip it.
     *
     * @throws BusinessException CONFLICT if the breaker is not tripped
     */
    public RiskState resetCircuitBreaker(String operator) {
        List<RiskEvent> pending = new ArrayList<>();
        RiskState newState;
        accountLock.lock();
        try {
            if (account.riskState() != RiskState.HALTED) {
                throw new BusinessException(
                        ErrorCode.CONFLICT,
                        "Circuit breaker is not tripped",
                        Map.of("riskState", account.riskState().name()));
            }
            account.rebase();
            newState = isDailyLimitBreachedLocked() ? RiskState.DAY_LIMIT_REACHED : RiskState.NORMAL;
            account.riskState(newState);
            pending.add(new RiskEvent(
                    this,
                    RiskEventType.CIRCUIT_BREAKER_RESET,
                    RiskLevel.WARNING,
                    "Circuit breaker reset by " + operator,
                    Map.of("balance", account.balance(), "riskState", newState.name())));
        } finally {
            accountLock.unlock();
        }
        log.warn("Circuit breaker reset by {}; state now {}", operator, newState);
        publish(pending);
        return newState;
    }

    // ========================
    // QUERIES
    // ========================

    public RiskState getState() {
        accountLock.lock();
        try {
            return account.riskState();
        } finally {
            accountLock.unlock();
        }
    }

    public boolean isHalted() {
        return getState() == RiskState.HALTED;
    }

    /** Copy of the open and closing positions, in opening order. */
    public List<Position> getPositions() {
        accountLock.lock();
        try {
            return new ArrayList<>(positions.values());
        } finally {
            accountLock.unlock();
        }
    }

    public int getOpenPositionCount() {
        accountLock.lock();
        try {
            return positions.size();
        } finally {
            accountLock.unlock();
        }
    }

    /** True while an admitted order has been neither confirmed nor released. */
    public boolean hasPendingReservations() {
        accountLock.lock();
        try {
            return !reservations.isEmpty();
        } finally {
            accountLock.unlock();
        }
    }

    public AccountSnapshot snapshot() {
        accountLock.lock();
        try {
            return AccountSnapshot.builder()
                    .balance(account.balance())
                    .peakBalance(account.peakBalance())
                    .dayStartBalance(account.dayStartBalance())
                    .dailyPnl(account.dailyPnl())
                    .sessionBaseline(account.sessionBaseline())
                    .tradingDay(account.tradingDay())
                    .riskState(account.riskState())
                    .openPositions(positions.size())
                    .reservedSlots(reservations.size())
                    .committedCapital(committedCapitalLocked())
                    .takenAt(clock.instant())
                    .build();
        } finally {
            accountLock.unlock();
        }
    }

    public RiskLimits getLimits() {
        return riskLimits;
    }

    // ========================
    // INTERNALS
    // ========================

    private int flagAllLocked(ExitReason reason) {
        int flagged = 0;
        for (Position position : positions.values()) {
            if (position.isOpen() && !position.isForceClose()) {
                position.flagForcedClose(reason);
                flagged++;
            }
        }
        return flagged;
    }

    private boolean isInstrumentEngagedLocked(String instrumentId) {
        for (Position position : positions.values()) {
            if (position.getInstrumentId().equals(instrumentId)) {
                return true;
            }
        }
        for (Reservation reservation : reservations.values()) {
            if (reservation.getInstrumentId().equals(instrumentId)) {
                return true;
            }
        }
        return false;
    }

    private BigDecimal committedCapitalLocked() {
        BigDecimal committed = BigDecimal.ZERO;
        for (Position position : positions.values()) {
            committed = committed.add(position.getSize());
        }
        for (Reservation reservation : reservations.values()) {
            committed = committed.add(reservation.getSize());
        }
        return committed;
    }

    /** (reference - current) / reference, or zero when reference is not positive. */
    private static BigDecimal lossFraction(BigDecimal reference, BigDecimal current) {
        if (reference.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return reference.subtract(current).divide(reference, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    private void publish(List<RiskEvent> events) {
        for (RiskEvent event : events) {
            applicationEventPublisher.publishEvent(event);
        }
    }
}
