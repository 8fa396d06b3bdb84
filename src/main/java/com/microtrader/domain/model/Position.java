package com.microtrader.domain.model;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.ExitReason;
import com.microtrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * An open (or closing/closed) scalp position.
 *
 * <p>Entry fields are fixed at creation. The lifecycle fields only move forward
 * (OPEN -> CLOSING -> CLOSED) and are mutated exclusively under the RiskManager's account lock;
 * the volatile fields keep unlocked readers (monitor, REST) consistent.
 *
 * <p>{@code size} is the notional in quote currency, not a coin quantity.
 */
@Getter
public class Position {

    private final String id;
    private final Instrument instrument;
    private final Direction direction;
    private final BigDecimal entryPrice;
    private final BigDecimal size;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final Instant openedAt;

    private volatile PositionStatus status = PositionStatus.OPEN;
    private volatile ExitReason forcedExitReason;
    private volatile ExitReason exitReason;
    private volatile BigDecimal exitPrice;
    private volatile BigDecimal realizedPnl;
    private volatile Instant closedAt;

    @Builder
    public Position(
            String id,
            Instrument instrument,
            Direction direction,
            BigDecimal entryPrice,
            BigDecimal size,
            BigDecimal stopLoss,
            BigDecimal takeProfit,
            Instant openedAt) {
        this.id = id;
        this.instrument = instrument;
        this.direction = direction;
        this.entryPrice = entryPrice;
        this.size = size;
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.openedAt = openedAt;
    }

    public String getInstrumentId() {
        return instrument.getId();
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /**
     * P&L if the position were closed at {@code price}: size * (price - entry) / entry,
     * negated for shorts. Rounded to 8 decimal places.
     */
    public BigDecimal pnlAt(BigDecimal price) {
        BigDecimal move = price.subtract(entryPrice).divide(entryPrice, 12, RoundingMode.HALF_UP);
        return size.multiply(move)
                .multiply(BigDecimal.valueOf(direction.sign()))
                .setScale(8, RoundingMode.HALF_UP);
    }

    public boolean isForceClose() {
        return forcedExitReason != null;
    }

    /** Marks the position for closing on the next monitor poll. The first reason sticks. */
    public void flagForcedClose(ExitReason reason) {
        if (forcedExitReason == null) {
            this.forcedExitReason = reason;
        }
    }

    /**
     * OPEN -> CLOSING.
     *
     * @return false if the position was not OPEN (a close is already under way or done)
     */
    public boolean beginClosing(ExitReason reason) {
        if (status != PositionStatus.OPEN) {
            return false;
        }
        this.exitReason = reason;
        this.status = PositionStatus.CLOSING;
        return true;
    }

    /** CLOSING -> CLOSED. */
    public void complete(BigDecimal exitPrice, BigDecimal realizedPnl, Instant closedAt) {
        if (status != PositionStatus.CLOSING) {
            throw new IllegalStateException("Position " + id + " cannot close from status " + status);
        }
        this.exitPrice = exitPrice;
        this.realizedPnl = realizedPnl;
        this.closedAt = closedAt;
        this.status = PositionStatus.CLOSED;
    }

    @Override
    public String toString() {
        return "Position{" + id + " " + direction + " " + getInstrumentId() + " size=" + size + " entry=" + entryPrice
                + " status=" + status + "}";
    }
}
