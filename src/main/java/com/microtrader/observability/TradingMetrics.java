package com.microtrader.observability;

import com.microtrader.domain.enums.ExitReason;
import com.microtrader.domain.enums.RiskState;
import com.microtrader.event.PositionEvent;
import com.microtrader.event.PositionEventType;
import com.microtrader.event.RiskEvent;
import com.microtrader.event.RiskEventType;
import com.microtrader.observability.GateDecision.DecisionOutcome;
import com.microtrader.risk.RiskManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the trading loop's Micrometer metrics.
 *
 * <ul>
 *   <li><b>microtrader.admissions</b> (counter, tag outcome): every gate and execution outcome</li>
 *   <li><b>microtrader.orders.placed</b> / <b>microtrader.orders.failed</b> (counters)</li>
 *   <li><b>microtrader.positions.closed</b> (counter, tag reason)</li>
 *   <li><b>microtrader.circuit.breaker.trips</b> (counter)</li>
 *   <li><b>microtrader.balance</b>, <b>microtrader.positions.open</b>, <b>microtrader.risk.state</b>
 *       (gauges; risk state as its ordinal, 0 = NORMAL)</li>
 * </ul>
 *
 * <p>Gauges are lazily evaluated: Micrometer polls the supplier function when scraping.
 * Counters are incremented from Spring ApplicationEvent listeners and the execution coordinator.
 */
@Service
public class TradingMetrics {

    private static final Logger log = LoggerFactory.getLogger(TradingMetrics.class);

    private final Map<DecisionOutcome, Counter> admissionCounters = new EnumMap<>(DecisionOutcome.class);
    private final Map<ExitReason, Counter> closedCounters = new EnumMap<>(ExitReason.class);
    private final Counter ordersPlacedCounter;
    private final Counter ordersFailedCounter;
    private final Counter circuitBreakerTripCounter;

    public TradingMetrics(MeterRegistry meterRegistry, RiskManager riskManager) {
        for (DecisionOutcome outcome : DecisionOutcome.values()) {
            admissionCounters.put(
                    outcome,
                    Counter.builder("microtrader.admissions")
                            .description("Opportunities handled by the scan cycle, by outcome")
                            .tag("outcome", outcome.name())
                            .register(meterRegistry));
        }
        for (ExitReason reason : ExitReason.values()) {
            closedCounters.put(
                    reason,
                    Counter.builder("microtrader.positions.closed")
                            .description("Positions closed, by exit reason")
                            .tag("reason", reason.name())
                            .register(meterRegistry));
        }

        this.ordersPlacedCounter = Counter.builder("microtrader.orders.placed")
                .description("Entry orders filled by the venue")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("microtrader.orders.failed")
                .description("Entry orders rejected by the venue or abandoned after retries")
                .register(meterRegistry);
        this.circuitBreakerTripCounter = Counter.builder("microtrader.circuit.breaker.trips")
                .description("Circuit breaker trips")
                .register(meterRegistry);

        // Gauges (lazily evaluated by Micrometer during scrape)
        meterRegistry.gauge("microtrader.balance", riskManager, manager -> manager.snapshot()
                .getBalance()
                .doubleValue());
        meterRegistry.gauge("microtrader.positions.open", riskManager, RiskManager::getOpenPositionCount);
        meterRegistry.gauge("microtrader.risk.state", riskManager, manager -> {
            RiskState state = manager.getState();
            return state.ordinal();
        });
    }

    public void recordDecision(DecisionOutcome outcome) {
        admissionCounters.get(outcome).increment();
        if (outcome == DecisionOutcome.ORDER_FAILED) {
            ordersFailedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.OPENED) {
            ordersPlacedCounter.increment();
        } else if (event.getEventType() == PositionEventType.CLOSED) {
            ExitReason reason = event.getPosition().getExitReason();
            if (reason != null) {
                closedCounters.get(reason).increment();
            }
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.CIRCUIT_BREAKER_TRIPPED) {
            circuitBreakerTripCounter.increment();
            log.debug("Circuit breaker trip counted: {}", event.getMessage());
        }
    }
}
