package com.microtrader.unit.scoring;

import static com.microtrader.unit.support.TestFixtures.T0;
import static com.microtrader.unit.support.TestFixtures.defaultSettings;
import static com.microtrader.unit.support.TestFixtures.instrument;
import static com.microtrader.unit.support.TestFixtures.opportunity;
import static org.assertj.core.api.Assertions.assertThat;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.LiquidityTier;
import com.microtrader.domain.enums.SignalType;
import com.microtrader.domain.model.Instrument;
import com.microtrader.domain.model.MarketFeatures;
import com.microtrader.domain.model.Opportunity;
import com.microtrader.scanner.ScanResult;
import com.microtrader.scoring.OpportunityScorer;
import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OpportunityScorerTest {

    private final OpportunityScorer scorer = new OpportunityScorer(defaultSettings());
    private final Instrument eth = instrument("ETH/USDT");

    private static MarketFeatures.MarketFeaturesBuilder features() {
        return MarketFeatures.builder()
                .instrumentId("ETH/USDT")
                .lastPrice(new BigDecimal("100"))
                .rsi(50)
                .emaFast(100)
                .emaSlow(100)
                .atr(1)
                .momentum(0)
                .volatility(0.01)
                .spread(0)
                .support(95)
                .resistance(105);
    }

    // ==============================
    // SIGNALS
    // ==============================

    @Nested
    @DisplayName("Signal scoring")
    class Signals {

        @Test
        @DisplayName("Trend, momentum, RSI and volatility all agreeing score 1.0 long")
        void fullMomentumLong() {
            MarketFeatures input = features()
                    .emaFast(101)
                    .momentum(0.02)
                    .rsi(55)
                    .volatility(0.03)
                    .build();

            Opportunity opportunity = scorer.score(eth, input, T0).orElseThrow();

            assertThat(opportunity.getDirection()).isEqualTo(Direction.LONG);
            assertThat(opportunity.getSignalType()).isEqualTo(SignalType.MOMENTUM);
            assertThat(opportunity.getScore()).isEqualByComparingTo("1.0000");
            assertThat(opportunity.getConfidence()).isEqualByComparingTo("1.0000");
            assertThat(opportunity.getEntryPrice()).isEqualByComparingTo("100");
            assertThat(opportunity.getTimestamp()).isEqualTo(T0);
        }

        @Test
        @DisplayName("Downtrend with agreeing momentum and RSI scores 0.8 short")
        void momentumShort() {
            MarketFeatures input = features()
                    .emaFast(99)
                    .momentum(-0.02)
                    .rsi(45)
                    .build();

            Opportunity opportunity = scorer.score(eth, input, T0).orElseThrow();

            assertThat(opportunity.getDirection()).isEqualTo(Direction.SHORT);
            assertThat(opportunity.getScore()).isEqualByComparingTo("0.8000");
        }

        @Test
        @DisplayName("Momentum against the trend subtracts its weight")
        void opposingMomentum() {
            MarketFeatures input = features()
                    .emaFast(101)
                    .momentum(-0.02)
                    .rsi(50)
                    .build();

            Opportunity opportunity = scorer.score(eth, input, T0).orElseThrow();

            assertThat(opportunity.getScore()).isEqualByComparingTo("0.2000");
        }

        @Test
        @DisplayName("Oversold near support is a 0.8 long reversal")
        void oversoldReversal() {
            MarketFeatures input = features().rsi(25).support(99.5).build();

            Opportunity opportunity = scorer.score(eth, input, T0).orElseThrow();

            assertThat(opportunity.getSignalType()).isEqualTo(SignalType.REVERSAL);
            assertThat(opportunity.getDirection()).isEqualTo(Direction.LONG);
            assertThat(opportunity.getScore()).isEqualByComparingTo("0.8000");
        }

        @Test
        @DisplayName("Overbought away from resistance is a 0.6 short reversal")
        void overboughtReversal() {
            MarketFeatures input = features().rsi(80).resistance(110).build();

            Opportunity opportunity = scorer.score(eth, input, T0).orElseThrow();

            assertThat(opportunity.getDirection()).isEqualTo(Direction.SHORT);
            assertThat(opportunity.getScore()).isEqualByComparingTo("0.6000");
        }

        @Test
        @DisplayName("Momentum wins a tie with reversal")
        void tieGoesToMomentum() {
            MarketFeatures input = features()
                    .emaFast(101)
                    .momentum(0.02)
                    .volatility(0.03)
                    .rsi(25)
                    .support(99.5)
                    .build();

            Opportunity opportunity = scorer.score(eth, input, T0).orElseThrow();

            assertThat(opportunity.getSignalType()).isEqualTo(SignalType.MOMENTUM);
            assertThat(opportunity.getScore()).isEqualByComparingTo("0.8000");
        }

        @Test
        @DisplayName("Flat EMAs and neutral RSI produce nothing")
        void noSignal() {
            assertThat(scorer.score(eth, features().build(), T0)).isEmpty();
        }

        @Test
        @DisplayName("Equal features always score equally")
        void deterministic() {
            MarketFeatures input = features().emaFast(101).momentum(0.015).rsi(60).build();

            assertThat(scorer.score(eth, input, T0)).isEqualTo(scorer.score(eth, input, T0));
        }
    }

    // ==============================
    // CONFIDENCE
    // ==============================

    @Nested
    @DisplayName("Spread penalty")
    class SpreadPenalty {

        @Test
        @DisplayName("Half the max spread halves confidence")
        void halfSpread() {
            MarketFeatures input = features()
                    .emaFast(101)
                    .momentum(0.02)
                    .rsi(55)
                    .volatility(0.03)
                    .spread(0.0025)
                    .build();

            Opportunity opportunity = scorer.score(eth, input, T0).orElseThrow();

            assertThat(opportunity.getScore()).isEqualByComparingTo("1.0000");
            assertThat(opportunity.getConfidence()).isEqualByComparingTo("0.5000");
        }

        @Test
        @DisplayName("Spread at or beyond the max zeroes confidence")
        void wideSpread() {
            MarketFeatures input = features().emaFast(101).momentum(0.02).spread(0.01).build();

            assertThat(scorer.score(eth, input, T0).orElseThrow().getConfidence()).isEqualByComparingTo("0");
        }
    }

    // ==============================
    // RANKING
    // ==============================

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @Test
        @DisplayName("Orders by score, then liquidity tier, then id, after the confidence filter")
        void rankingOrder() {
            Opportunity lowTier = opportunity(instrument("AAA/USDT", LiquidityTier.LOW), "0.9", "0.9");
            Opportunity highTierB = opportunity(instrument("BBB/USDT", LiquidityTier.HIGH), "0.9", "0.9");
            Opportunity highTierA = opportunity(instrument("CCC/USDT", LiquidityTier.HIGH), "0.9", "0.7");
            Opportunity best = opportunity(instrument("ZZZ/USDT", LiquidityTier.LOW), "0.95", "0.6");
            Opportunity tooUnsure = opportunity(instrument("DDD/USDT", LiquidityTier.HIGH), "0.99", "0.59");

            List<Opportunity> ranked =
                    scorer.rankOpportunities(List.of(lowTier, tooUnsure, highTierA, best, highTierB));

            assertThat(ranked)
                    .extracting(Opportunity::getInstrumentId)
                    .containsExactly("ZZZ/USDT", "BBB/USDT", "CCC/USDT", "AAA/USDT");
        }

        @Test
        @DisplayName("Rank scores scan results and drops the ones without a signal")
        void rankFromScan() {
            Instrument sol = instrument("SOL/USDT");
            Stream<ScanResult> scan = Stream.of(
                    new ScanResult(eth, features().build()),
                    new ScanResult(sol, features()
                            .instrumentId("SOL/USDT")
                            .emaFast(101)
                            .momentum(0.02)
                            .rsi(55)
                            .build()));

            List<Opportunity> ranked = scorer.rank(scan, T0);

            assertThat(ranked).hasSize(1);
            assertThat(ranked.get(0).getInstrumentId()).isEqualTo("SOL/USDT");
            assertThat(ranked.get(0).getScore()).isEqualByComparingTo("0.8000");
        }
    }
}
