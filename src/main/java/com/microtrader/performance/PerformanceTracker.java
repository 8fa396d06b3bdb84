package com.microtrader.performance;

import com.microtrader.domain.model.AccountSnapshot;
import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.PerformanceSnapshot;
import com.microtrader.event.PositionEvent;
import com.microtrader.event.PositionEventType;
import com.microtrader.risk.RiskManager;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Records closed trades and takes periodic performance snapshots.
 *
 * <p>Both lists are append-only. The tracker only reads the account (through
 * {@link RiskManager#snapshot()}); it never changes it.
 *
 * <p>Snapshot arithmetic:
 * <ul>
 *   <li>growth% = (balance - initialCapital) / initialCapital * 100, 2 dp HALF_UP</li>
 *   <li>winRate = wins / trades, 4 dp HALF_UP, zero before the first trade</li>
 * </ul>
 */
@Service
public class PerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(PerformanceTracker.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskManager riskManager;
    private final TradeJournal tradeJournal;
    private final Clock clock;

    private final List<ClosedTrade> closedTrades = new CopyOnWriteArrayList<>();
    private final List<PerformanceSnapshot> snapshots = new CopyOnWriteArrayList<>();

    public PerformanceTracker(RiskManager riskManager, TradeJournal tradeJournal, Clock clock) {
        this.riskManager = riskManager;
        this.tradeJournal = tradeJournal;
        this.clock = clock;
    }

    @EventListener
    @Order(10)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.CLOSED) {
            recordTrade(ClosedTrade.of(event.getPosition()));
        }
    }

    public void recordTrade(ClosedTrade trade) {
        closedTrades.add(trade);
        tradeJournal.appendTrade(trade);
    }

    public PerformanceSnapshot takeSnapshot() {
        AccountSnapshot account = riskManager.snapshot();
        BigDecimal initialCapital = riskManager.getLimits().getInitialCapital();

        List<ClosedTrade> trades = List.copyOf(closedTrades);
        int wins = 0;
        BigDecimal totalPnl = BigDecimal.ZERO;
        for (ClosedTrade trade : trades) {
            if (trade.isWin()) {
                wins++;
            }
            totalPnl = totalPnl.add(trade.getPnl());
        }

        PerformanceSnapshot snapshot = PerformanceSnapshot.builder()
                .timestamp(clock.instant())
                .balance(account.getBalance())
                .growthPercent(growthPercent(account.getBalance(), initialCapital))
                .tradeCount(trades.size())
                .wins(wins)
                .winRate(winRate(wins, trades.size()))
                .totalPnl(totalPnl)
                .openPositions(account.getOpenPositions())
                .riskState(account.getRiskState())
                .build();

        snapshots.add(snapshot);
        log.info(
                "Performance: balance={} growth={}% trades={} winRate={} totalPnl={} open={} state={}",
                snapshot.getBalance(),
                snapshot.getGrowthPercent(),
                snapshot.getTradeCount(),
                snapshot.getWinRate(),
                snapshot.getTotalPnl(),
                snapshot.getOpenPositions(),
                snapshot.getRiskState());
        tradeJournal.appendSnapshot(snapshot);
        return snapshot;
    }

    static BigDecimal growthPercent(BigDecimal balance, BigDecimal initialCapital) {
        return balance.subtract(initialCapital).multiply(HUNDRED).divide(initialCapital, 2, RoundingMode.HALF_UP);
    }

    static BigDecimal winRate(int wins, int trades) {
        if (trades == 0) {
            return BigDecimal.ZERO.setScale(4);
        }
        return BigDecimal.valueOf(wins).divide(BigDecimal.valueOf(trades), 4, RoundingMode.HALF_UP);
    }

    public Optional<PerformanceSnapshot> latest() {
        int size = snapshots.size();
        return size == 0 ? Optional.empty() : Optional.of(snapshots.get(size - 1));
    }

    public List<PerformanceSnapshot> getSnapshots() {
        return List.copyOf(snapshots);
    }

    public List<ClosedTrade> getClosedTrades() {
        return List.copyOf(closedTrades);
    }
}
