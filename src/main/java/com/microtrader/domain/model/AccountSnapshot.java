package com.microtrader.domain.model;

import com.microtrader.domain.enums.RiskState;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable, consistent copy of the account state, taken under the account lock.
 */
@Value
@Builder
public class AccountSnapshot {

    BigDecimal balance;
    BigDecimal peakBalance;
    BigDecimal dayStartBalance;
    BigDecimal dailyPnl;
    BigDecimal sessionBaseline;
    LocalDate tradingDay;
    RiskState riskState;
    int openPositions;
    int reservedSlots;

    /** Sum of open position sizes plus reserved capital. */
    BigDecimal committedCapital;

    Instant takenAt;
}
