package com.microtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Signal features derived from one instrument's market data. Value semantics: two feature
 * vectors with equal fields score identically.
 */
@Value
@Builder
public class MarketFeatures {

    String instrumentId;
    BigDecimal lastPrice;

    /** RSI(14) on closes, 0..100. */
    double rsi;

    /** EMA(8) of closes. */
    double emaFast;

    /** EMA(21) of closes. */
    double emaSlow;

    /** ATR(14). */
    double atr;

    /** Fractional close change over the last 5 bars. */
    double momentum;

    /** atr / lastPrice. */
    double volatility;

    /** (ask - bid) / mid. */
    double spread;

    /** Lowest low over the last 10 bars. */
    double support;

    /** Highest high over the last 10 bars. */
    double resistance;
}
