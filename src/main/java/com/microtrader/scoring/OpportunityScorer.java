package com.microtrader.scoring;

import com.microtrader.config.TradingSettings;
import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.SignalType;
import com.microtrader.domain.model.Instrument;
import com.microtrader.domain.model.MarketFeatures;
import com.microtrader.domain.model.Opportunity;
import com.microtrader.scanner.ScanResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Turns feature vectors into ranked {@link Opportunity}s.
 *
 * <p>Pure and deterministic: no clock, no randomness, no shared state. Two signals are scored
 * per instrument and the stronger one wins (momentum on a tie):
 * <ul>
 *   <li><b>Momentum:</b> direction follows the EMA(8)/EMA(21) trend (0.3), 5-bar momentum
 *       beyond 1% in that direction (0.3), RSI confirming without being stretched (0.2), and
 *       0.2 more in high volatility (> 2%) when momentum agrees.</li>
 *   <li><b>Reversal:</b> RSI below 30 (LONG) or above 70 (SHORT) scores 0.6, plus 0.2 when price
 *       sits within 1% of support (LONG) or resistance (SHORT).</li>
 * </ul>
 *
 * <p>Confidence is the score discounted by the spread relative to {@code maxSpread}.
 * Opportunities below {@code minConfidence} are dropped before ranking.
 */
@Component
public class OpportunityScorer {

    /** score desc, liquidity tier desc, instrument id asc: a total order. */
    public static final Comparator<Opportunity> RANKING = Comparator.comparing(Opportunity::getScore)
            .reversed()
            .thenComparing(
                    (Opportunity opportunity) -> opportunity.getInstrument().getLiquidityTier().rank(),
                    Comparator.reverseOrder())
            .thenComparing(Opportunity::getInstrumentId);

    static final double TREND_WEIGHT = 0.3;
    static final double MOMENTUM_WEIGHT = 0.3;
    static final double RSI_WEIGHT = 0.2;
    static final double VOLATILITY_WEIGHT = 0.2;
    static final double MOMENTUM_THRESHOLD = 0.01;
    static final double HIGH_VOLATILITY = 0.02;

    static final double OVERSOLD = 30.0;
    static final double OVERBOUGHT = 70.0;
    static final double EXTREME_WEIGHT = 0.6;
    static final double LEVEL_WEIGHT = 0.2;
    static final double LEVEL_PROXIMITY = 0.01;

    private static final int SCORE_SCALE = 4;

    private final BigDecimal minConfidence;
    private final BigDecimal maxSpread;

    public OpportunityScorer(TradingSettings tradingSettings) {
        this.minConfidence = tradingSettings.getMinConfidence();
        this.maxSpread = tradingSettings.getMaxSpread();
    }

    /**
     * Scores one instrument. Empty when neither signal fires.
     */
    public Optional<Opportunity> score(Instrument instrument, MarketFeatures features, Instant cycleTimestamp) {
        Candidate momentum = momentum(features);
        Candidate reversal = reversal(features);
        Candidate best = reversal.strength > momentum.strength ? reversal : momentum;
        if (best.strength <= 0.0) {
            return Optional.empty();
        }

        BigDecimal score = BigDecimal.valueOf(Math.min(1.0, best.strength)).setScale(SCORE_SCALE, RoundingMode.HALF_UP);
        double spreadPenalty = Math.min(1.0, features.getSpread() / maxSpread.doubleValue());
        BigDecimal confidence = score.multiply(BigDecimal.valueOf(1.0 - spreadPenalty))
                .setScale(SCORE_SCALE, RoundingMode.HALF_UP);

        return Optional.of(Opportunity.builder()
                .instrument(instrument)
                .direction(best.direction)
                .signalType(best.signalType)
                .score(score)
                .confidence(confidence)
                .entryPrice(features.getLastPrice())
                .timestamp(cycleTimestamp)
                .build());
    }

    /**
     * Scores every scan result, drops low-confidence candidates and returns them ranked.
     */
    public List<Opportunity> rank(Stream<ScanResult> scanResults, Instant cycleTimestamp) {
        return rankOpportunities(scanResults
                .map(result -> score(result.getInstrument(), result.getFeatures(), cycleTimestamp))
                .flatMap(Optional::stream)
                .toList());
    }

    /** Applies the confidence filter and ranking order to already-built opportunities. */
    public List<Opportunity> rankOpportunities(Collection<Opportunity> opportunities) {
        return opportunities.stream()
                .filter(opportunity -> opportunity.getConfidence().compareTo(minConfidence) >= 0)
                .sorted(RANKING)
                .toList();
    }

    private Candidate momentum(MarketFeatures features) {
        if (Double.isNaN(features.getEmaFast())
                || Double.isNaN(features.getEmaSlow())
                || features.getEmaFast() == features.getEmaSlow()) {
            return Candidate.NONE;
        }
        Direction direction = features.getEmaFast() > features.getEmaSlow() ? Direction.LONG : Direction.SHORT;
        int sign = direction.sign();
        double strength = TREND_WEIGHT;

        boolean momentumAgrees = features.getMomentum() * sign > MOMENTUM_THRESHOLD;
        boolean momentumOpposes = features.getMomentum() * sign < -MOMENTUM_THRESHOLD;
        if (momentumAgrees) {
            strength += MOMENTUM_WEIGHT;
        } else if (momentumOpposes) {
            strength -= MOMENTUM_WEIGHT;
        }

        double rsi = features.getRsi();
        boolean rsiConfirms = direction == Direction.LONG ? rsi > 40.0 && rsi < OVERBOUGHT : rsi > OVERSOLD && rsi < 60.0;
        if (rsiConfirms) {
            strength += RSI_WEIGHT;
        }

        if (momentumAgrees && features.getVolatility() > HIGH_VOLATILITY) {
            strength += VOLATILITY_WEIGHT;
        }
        return new Candidate(direction, SignalType.MOMENTUM, Math.max(0.0, strength));
    }

    private Candidate reversal(MarketFeatures features) {
        double rsi = features.getRsi();
        double price = features.getLastPrice().doubleValue();
        if (rsi < OVERSOLD) {
            double strength = EXTREME_WEIGHT;
            if (features.getSupport() > 0 && price <= features.getSupport() * (1 + LEVEL_PROXIMITY)) {
                strength += LEVEL_WEIGHT;
            }
            return new Candidate(Direction.LONG, SignalType.REVERSAL, strength);
        }
        if (rsi > OVERBOUGHT) {
            double strength = EXTREME_WEIGHT;
            if (features.getResistance() > 0 && price >= features.getResistance() * (1 - LEVEL_PROXIMITY)) {
                strength += LEVEL_WEIGHT;
            }
            return new Candidate(Direction.SHORT, SignalType.REVERSAL, strength);
        }
        return Candidate.NONE;
    }

    private static final class Candidate {

        static final Candidate NONE = new Candidate(Direction.LONG, SignalType.MOMENTUM, 0.0);

        final Direction direction;
        final SignalType signalType;
        final double strength;

        Candidate(Direction direction, SignalType signalType, double strength) {
            this.direction = direction;
            this.signalType = signalType;
            this.strength = strength;
        }
    }
}
