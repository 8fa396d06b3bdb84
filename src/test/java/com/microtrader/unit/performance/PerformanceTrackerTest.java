package com.microtrader.unit.performance;

import static com.microtrader.unit.support.TestFixtures.DAY0;
import static com.microtrader.unit.support.TestFixtures.T0;
import static com.microtrader.unit.support.TestFixtures.defaultLimits;
import static com.microtrader.unit.support.TestFixtures.instrument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.ExitReason;
import com.microtrader.domain.enums.RiskState;
import com.microtrader.domain.model.AccountSnapshot;
import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.PerformanceSnapshot;
import com.microtrader.domain.model.Position;
import com.microtrader.event.PositionEvent;
import com.microtrader.event.PositionEventType;
import com.microtrader.performance.PerformanceTracker;
import com.microtrader.performance.TradeJournal;
import com.microtrader.risk.RiskManager;
import com.microtrader.unit.support.MutableClock;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PerformanceTrackerTest {

    @Mock
    private RiskManager riskManager;

    @Mock
    private TradeJournal tradeJournal;

    private PerformanceTracker performanceTracker;

    @BeforeEach
    void setUp() {
        performanceTracker = new PerformanceTracker(riskManager, tradeJournal, new MutableClock(T0));
    }

    private void accountAt(String balance, int openPositions) {
        when(riskManager.getLimits()).thenReturn(defaultLimits());
        when(riskManager.snapshot()).thenReturn(AccountSnapshot.builder()
                .balance(new BigDecimal(balance))
                .peakBalance(new BigDecimal(balance))
                .dayStartBalance(new BigDecimal("100.00"))
                .dailyPnl(new BigDecimal(balance).subtract(new BigDecimal("100.00")))
                .sessionBaseline(new BigDecimal("100.00"))
                .tradingDay(DAY0)
                .riskState(RiskState.NORMAL)
                .openPositions(openPositions)
                .reservedSlots(0)
                .committedCapital(BigDecimal.ZERO)
                .takenAt(T0)
                .build());
    }

    private static ClosedTrade trade(String positionId, String pnl) {
        return ClosedTrade.builder()
                .positionId(positionId)
                .instrumentId("ETH/USDT")
                .direction(Direction.LONG)
                .size(new BigDecimal("10"))
                .entryPrice(new BigDecimal("100"))
                .exitPrice(new BigDecimal("100").add(new BigDecimal(pnl).multiply(BigDecimal.TEN)))
                .pnl(new BigDecimal(pnl))
                .exitReason(ExitReason.TAKE_PROFIT)
                .openedAt(T0)
                .closedAt(T0.plusSeconds(60))
                .build();
    }

    @Nested
    @DisplayName("Snapshots")
    class Snapshots {

        @Test
        @DisplayName("Growth is measured against initial capital")
        void growth() {
            accountAt("102.50", 1);

            PerformanceSnapshot snapshot = performanceTracker.takeSnapshot();

            assertThat(snapshot.getGrowthPercent()).isEqualByComparingTo("2.50");
            assertThat(snapshot.getOpenPositions()).isEqualTo(1);
            assertThat(snapshot.getTimestamp()).isEqualTo(T0);
            verify(tradeJournal).appendSnapshot(snapshot);
        }

        @Test
        @DisplayName("Win rate and total P&L aggregate the closed trades")
        void winRate() {
            accountAt("100.30", 0);
            performanceTracker.recordTrade(trade("P1", "0.20"));
            performanceTracker.recordTrade(trade("P2", "-0.10"));
            performanceTracker.recordTrade(trade("P3", "0.20"));

            PerformanceSnapshot snapshot = performanceTracker.takeSnapshot();

            assertThat(snapshot.getTradeCount()).isEqualTo(3);
            assertThat(snapshot.getWins()).isEqualTo(2);
            assertThat(snapshot.getWinRate()).isEqualByComparingTo("0.6667");
            assertThat(snapshot.getTotalPnl()).isEqualByComparingTo("0.30");
        }

        @Test
        @DisplayName("Win rate is zero before the first trade")
        void noTrades() {
            accountAt("100.00", 0);

            PerformanceSnapshot snapshot = performanceTracker.takeSnapshot();

            assertThat(snapshot.getWinRate()).isEqualByComparingTo("0");
            assertThat(snapshot.getGrowthPercent()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Latest returns the most recent snapshot")
        void latest() {
            assertThat(performanceTracker.latest()).isEmpty();
            accountAt("99.00", 0);

            performanceTracker.takeSnapshot();
            PerformanceSnapshot second = performanceTracker.takeSnapshot();

            assertThat(performanceTracker.latest()).containsSame(second);
            assertThat(performanceTracker.getSnapshots()).hasSize(2);
            assertThat(second.getGrowthPercent()).isEqualByComparingTo("-1.00");
        }
    }

    @Nested
    @DisplayName("Trade recording")
    class TradeRecording {

        @Test
        @DisplayName("A CLOSED position event records and journals the trade")
        void closedEventRecorded() {
            Position position = Position.builder()
                    .id("P1")
                    .instrument(instrument("ETH/USDT"))
                    .direction(Direction.LONG)
                    .entryPrice(new BigDecimal("100"))
                    .size(new BigDecimal("10"))
                    .openedAt(T0)
                    .build();
            position.beginClosing(ExitReason.TIME_STOP);
            position.complete(new BigDecimal("101"), new BigDecimal("0.10"), T0.plusSeconds(300));

            performanceTracker.onPositionEvent(new PositionEvent(this, position, PositionEventType.CLOSED));

            assertThat(performanceTracker.getClosedTrades()).singleElement().satisfies(trade -> {
                assertThat(trade.getPositionId()).isEqualTo("P1");
                assertThat(trade.getExitReason()).isEqualTo(ExitReason.TIME_STOP);
                assertThat(trade.isWin()).isTrue();
            });
            verify(tradeJournal).appendTrade(any(ClosedTrade.class));
        }

        @Test
        @DisplayName("An OPENED position event is ignored")
        void openedEventIgnored() {
            Position position = Position.builder()
                    .id("P1")
                    .instrument(instrument("ETH/USDT"))
                    .direction(Direction.LONG)
                    .entryPrice(new BigDecimal("100"))
                    .size(new BigDecimal("10"))
                    .openedAt(T0)
                    .build();

            performanceTracker.onPositionEvent(new PositionEvent(this, position, PositionEventType.OPENED));

            assertThat(performanceTracker.getClosedTrades()).isEmpty();
            verify(tradeJournal, never()).appendTrade(any());
        }
    }
}
