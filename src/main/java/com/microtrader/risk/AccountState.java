package com.microtrader.risk;

import com.microtrader.domain.enums.RiskState;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Mutable account state: balance, high-water mark, daily counters and the risk state.
 *
 * <p>Not thread-safe on its own. The instance is created once by the trading configuration
 * and handed to {@link RiskManager}, which is the only component allowed to touch it and does
 * so exclusively under its account lock. Everyone else reads an
 * {@link com.microtrader.domain.model.AccountSnapshot}.
 */
public class AccountState {

    private BigDecimal balance;
    private BigDecimal peakBalance;
    private BigDecimal dayStartBalance;
    private BigDecimal dailyPnl;
    private BigDecimal sessionBaseline;
    private LocalDate tradingDay;
    private RiskState riskState = RiskState.NORMAL;

    public AccountState(
            BigDecimal balance,
            BigDecimal peakBalance,
            BigDecimal dayStartBalance,
            BigDecimal dailyPnl,
            BigDecimal sessionBaseline,
            LocalDate tradingDay) {
        this.balance = balance;
        this.peakBalance = peakBalance;
        this.dayStartBalance = dayStartBalance;
        this.dailyPnl = dailyPnl;
        this.sessionBaseline = sessionBaseline;
        this.tradingDay = tradingDay;
    }

    /** Fresh account: every baseline equals the starting capital. */
    public static AccountState starting(BigDecimal capital, LocalDate tradingDay) {
        return new AccountState(capital, capital, capital, BigDecimal.ZERO, capital, tradingDay);
    }

    BigDecimal balance() {
        return balance;
    }

    BigDecimal peakBalance() {
        return peakBalance;
    }

    BigDecimal dayStartBalance() {
        return dayStartBalance;
    }

    BigDecimal dailyPnl() {
        return dailyPnl;
    }

    BigDecimal sessionBaseline() {
        return sessionBaseline;
    }

    LocalDate tradingDay() {
        return tradingDay;
    }

    RiskState riskState() {
        return riskState;
    }

    void riskState(RiskState riskState) {
        this.riskState = riskState;
    }

    /**
     * Books realized P&L: balance (floored at zero), daily P&L and the high-water mark.
     */
    void applyRealizedPnl(BigDecimal pnl) {
        balance = balance.add(pnl).max(BigDecimal.ZERO);
        dailyPnl = dailyPnl.add(pnl);
        peakBalance = peakBalance.max(balance);
    }

    void startTradingDay(LocalDate day) {
        tradingDay = day;
        dayStartBalance = balance;
        dailyPnl = BigDecimal.ZERO;
    }

    /** Re-bases the breaker's reference points to the current balance. */
    void rebase() {
        peakBalance = balance;
        sessionBaseline = balance;
    }
}
