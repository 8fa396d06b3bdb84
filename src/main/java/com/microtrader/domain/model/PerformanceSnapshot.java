package com.microtrader.domain.model;

import com.microtrader.domain.enums.RiskState;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PerformanceSnapshot {

    Instant timestamp;
    BigDecimal balance;

    /** (balance - initialCapital) / initialCapital * 100, 2 dp. */
    BigDecimal growthPercent;

    int tradeCount;
    int wins;

    /** wins / tradeCount, 4 dp; zero with no trades. */
    BigDecimal winRate;

    BigDecimal totalPnl;
    int openPositions;
    RiskState riskState;
}
