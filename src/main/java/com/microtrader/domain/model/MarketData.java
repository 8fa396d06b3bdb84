package com.microtrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Market data for one instrument as returned by the gateway: top of book plus recent candles,
 * oldest candle first.
 */
@Value
@Builder
public class MarketData {

    String instrumentId;
    BigDecimal lastPrice;
    BigDecimal bid;
    BigDecimal ask;
    List<Candle> candles;
    Instant timestamp;
}
