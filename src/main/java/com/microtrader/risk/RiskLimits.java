package com.microtrader.risk;

import com.microtrader.exception.ConfigurationException;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Risk limits for the trading loop, read once at startup and immutable for the process
 * lifetime.
 *
 * <p>Fractions are expressed as decimals (0.10 = 10%). Sizes are notional amounts in quote
 * currency.
 */
@Value
@Builder
public class RiskLimits {

    /** Capital the account starts with; baseline for growth and the first trading day. */
    BigDecimal initialCapital;

    /** Maximum number of positions open (or reserved) at the same time. */
    int maxConcurrentPositions;

    /** Daily loss cap as a fraction of the day-start balance. */
    BigDecimal dailyLossLimit;

    /** Peak-to-current drawdown that trips the circuit breaker. */
    BigDecimal maxDrawdownLimit;

    /** Loss since the session baseline that trips the circuit breaker. */
    BigDecimal circuitBreakerLimit;

    /** Share of the balance that open and reserved positions may commit in total. */
    BigDecimal maxPortfolioExposure;

    BigDecimal minPositionSize;
    BigDecimal maxPositionSize;

    BigDecimal scalpTakeProfit;
    BigDecimal scalpStopLoss;

    /**
     * Rejects missing or inconsistent limits.
     *
     * @throws ConfigurationException describing the first invalid value
     */
    public RiskLimits validate() {
        requirePositive("initial-capital", initialCapital);
        if (maxConcurrentPositions < 1) {
            throw new ConfigurationException("max-concurrent-trades must be >= 1, got " + maxConcurrentPositions);
        }
        requireFraction("daily-loss-limit", dailyLossLimit);
        requireFraction("max-drawdown-limit", maxDrawdownLimit);
        requireFraction("circuit-breaker-limit", circuitBreakerLimit);
        requirePositive("max-portfolio-exposure", maxPortfolioExposure);
        if (maxPortfolioExposure.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigurationException("max-portfolio-exposure must not exceed 1, got " + maxPortfolioExposure);
        }
        requireFraction("scalp-take-profit", scalpTakeProfit);
        requireFraction("scalp-stop-loss", scalpStopLoss);
        requirePositive("min-position-size", minPositionSize);
        requirePositive("max-position-size", maxPositionSize);
        if (minPositionSize.compareTo(maxPositionSize) > 0) {
            throw new ConfigurationException(
                    "min-position-size " + minPositionSize + " exceeds max-position-size " + maxPositionSize);
        }
        if (minPositionSize.compareTo(initialCapital) > 0) {
            throw new ConfigurationException(
                    "min-position-size " + minPositionSize + " exceeds initial-capital " + initialCapital);
        }
        return this;
    }

    private static void requirePositive(String name, BigDecimal value) {
        if (value == null) {
            throw new ConfigurationException(name + " is required");
        }
        if (value.signum() <= 0) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
    }

    private static void requireFraction(String name, BigDecimal value) {
        requirePositive(name, value);
        if (value.compareTo(BigDecimal.ONE) >= 0) {
            throw new ConfigurationException(name + " must be a fraction below 1, got " + value);
        }
    }
}
