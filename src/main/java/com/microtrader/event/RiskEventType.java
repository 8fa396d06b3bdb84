package com.microtrader.event;

/**
 * Classifies the risk-state change carried by a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Daily realized loss reached the cap; entries blocked until rollover. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Drawdown or session loss tripped the circuit breaker; all positions being closed. */
    CIRCUIT_BREAKER_TRIPPED,

    /** An operator cleared a latched circuit breaker. */
    CIRCUIT_BREAKER_RESET,

    /** Trading day rolled over; daily counters reset. */
    TRADING_DAY_ROLLOVER
}
