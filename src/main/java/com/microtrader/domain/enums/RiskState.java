package com.microtrader.domain.enums;

/**
 * Account-level risk state.
 *
 * <ul>
 *   <li>NORMAL: entries admitted subject to the gate checks</li>
 *   <li>DAY_LIMIT_REACHED: daily loss cap hit; no entries until the trading day rolls over</li>
 *   <li>HALTED: circuit breaker latched; no entries and every open position is force-closed.
 *       Left only by manual reset or restart.</li>
 * </ul>
 */
public enum RiskState {
    NORMAL,
    DAY_LIMIT_REACHED,
    HALTED
}
