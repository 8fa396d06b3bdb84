package com.microtrader.unit.observability;

import static com.microtrader.unit.support.TestFixtures.DAY0;
import static com.microtrader.unit.support.TestFixtures.T0;
import static com.microtrader.unit.support.TestFixtures.defaultLimits;
import static com.microtrader.unit.support.TestFixtures.instrument;
import static org.assertj.core.api.Assertions.assertThat;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.ExitReason;
import com.microtrader.domain.model.Position;
import com.microtrader.event.PositionEvent;
import com.microtrader.event.PositionEventType;
import com.microtrader.event.RiskEvent;
import com.microtrader.event.RiskEventType;
import com.microtrader.event.RiskLevel;
import com.microtrader.observability.GateDecision.DecisionOutcome;
import com.microtrader.observability.TradingMetrics;
import com.microtrader.risk.AccountState;
import com.microtrader.risk.RiskManager;
import com.microtrader.unit.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradingMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private RiskManager riskManager;
    private TradingMetrics tradingMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        riskManager = new RiskManager(
                defaultLimits(),
                AccountState.starting(new BigDecimal("100.00"), DAY0),
                new MutableClock(T0),
                event -> {});
        tradingMetrics = new TradingMetrics(meterRegistry, riskManager);
    }

    private double counter(String name, String... tags) {
        return meterRegistry.get(name).tags(tags).counter().count();
    }

    @Test
    @DisplayName("Gauges read the live account")
    void gauges() {
        assertThat(meterRegistry.get("microtrader.balance").gauge().value()).isEqualTo(100.0);
        assertThat(meterRegistry.get("microtrader.positions.open").gauge().value()).isZero();
        assertThat(meterRegistry.get("microtrader.risk.state").gauge().value()).isZero();
    }

    @Test
    @DisplayName("Order failures count both as an outcome and as a failed order")
    void orderFailedCounted() {
        tradingMetrics.recordDecision(DecisionOutcome.ORDER_FAILED);
        tradingMetrics.recordDecision(DecisionOutcome.REJECTED);

        assertThat(counter("microtrader.admissions", "outcome", "ORDER_FAILED")).isEqualTo(1.0);
        assertThat(counter("microtrader.admissions", "outcome", "REJECTED")).isEqualTo(1.0);
        assertThat(meterRegistry.get("microtrader.orders.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Position events count opens and closes by reason")
    void positionEvents() {
        Position position = Position.builder()
                .id("DRY-1")
                .instrument(instrument("ETH/USDT"))
                .direction(Direction.LONG)
                .entryPrice(new BigDecimal("100"))
                .size(new BigDecimal("10"))
                .openedAt(T0)
                .build();

        tradingMetrics.onPositionEvent(new PositionEvent(this, position, PositionEventType.OPENED));
        position.beginClosing(ExitReason.TAKE_PROFIT);
        tradingMetrics.onPositionEvent(new PositionEvent(this, position, PositionEventType.CLOSED));

        assertThat(meterRegistry.get("microtrader.orders.placed").counter().count()).isEqualTo(1.0);
        assertThat(counter("microtrader.positions.closed", "reason", "TAKE_PROFIT")).isEqualTo(1.0);
        assertThat(counter("microtrader.positions.closed", "reason", "STOP_LOSS")).isZero();
    }

    @Test
    @DisplayName("Circuit breaker trips are counted")
    void tripsCounted() {
        tradingMetrics.onRiskEvent(
                new RiskEvent(this, RiskEventType.CIRCUIT_BREAKER_TRIPPED, RiskLevel.CRITICAL, "tripped"));
        tradingMetrics.onRiskEvent(
                new RiskEvent(this, RiskEventType.TRADING_DAY_ROLLOVER, RiskLevel.INFO, "rollover"));

        assertThat(meterRegistry.get("microtrader.circuit.breaker.trips").counter().count()).isEqualTo(1.0);
    }
}
