package com.microtrader.config;

import com.microtrader.risk.AccountState;
import com.microtrader.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} bean and the starting {@link AccountState}.
 *
 * <p>Limits are validated here, so an inconsistent configuration fails context startup with a
 * {@link com.microtrader.exception.ConfigurationException} before the scheduler can start.
 *
 * <p>Properties prefix: {@code microtrader.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${microtrader.risk.initial-capital:100.00}") BigDecimal initialCapital,
            @Value("${microtrader.risk.max-concurrent-trades:8}") int maxConcurrentTrades,
            @Value("${microtrader.risk.daily-loss-limit:0.10}") BigDecimal dailyLossLimit,
            @Value("${microtrader.risk.max-drawdown-limit:0.20}") BigDecimal maxDrawdownLimit,
            @Value("${microtrader.risk.circuit-breaker-limit:0.15}") BigDecimal circuitBreakerLimit,
            @Value("${microtrader.risk.max-portfolio-exposure:0.60}") BigDecimal maxPortfolioExposure,
            @Value("${microtrader.risk.min-position-size:5.00}") BigDecimal minPositionSize,
            @Value("${microtrader.risk.max-position-size:15.00}") BigDecimal maxPositionSize,
            @Value("${microtrader.risk.scalp-take-profit:0.015}") BigDecimal scalpTakeProfit,
            @Value("${microtrader.risk.scalp-stop-loss:0.010}") BigDecimal scalpStopLoss) {
        return RiskLimits.builder()
                .initialCapital(initialCapital)
                .maxConcurrentPositions(maxConcurrentTrades)
                .dailyLossLimit(dailyLossLimit)
                .maxDrawdownLimit(maxDrawdownLimit)
                .circuitBreakerLimit(circuitBreakerLimit)
                .maxPortfolioExposure(maxPortfolioExposure)
                .minPositionSize(minPositionSize)
                .maxPositionSize(maxPositionSize)
                .scalpTakeProfit(scalpTakeProfit)
                .scalpStopLoss(scalpStopLoss)
                .build()
                .validate();
    }

    /** Session starts with every baseline at the configured capital, trading day = today (UTC). */
    @Bean
    public AccountState accountState(RiskLimits riskLimits, Clock clock) {
        return AccountState.starting(riskLimits.getInitialCapital(), LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    }
}
