package com.microtrader.scanner;

import com.microtrader.domain.model.Candle;
import com.microtrader.domain.model.MarketData;
import com.microtrader.domain.model.MarketFeatures;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighPriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowPriceIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.num.Num;

/**
 * Derives {@link MarketFeatures} from candles using ta4j indicators.
 *
 * <p>Bars are loaded into a throwaway BarSeries with synthetic, evenly spaced end times: the
 * indicators only depend on bar order, and synthetic times keep the output a pure function of
 * the OHLCV values.
 */
@Component
public class FeatureExtractor {

    static final int RSI_PERIOD = 14;
    static final int EMA_FAST_PERIOD = 8;
    static final int EMA_SLOW_PERIOD = 21;
    static final int ATR_PERIOD = 14;
    static final int MOMENTUM_LOOKBACK = 5;
    static final int RANGE_LOOKBACK = 10;

    /** Fewer candles than this and the slow EMA is meaningless. */
    public static final int MIN_CANDLES = EMA_SLOW_PERIOD;

    private static final ZonedDateTime SERIES_ORIGIN = ZonedDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    /**
     * @return features, or empty when there is not enough history or the last price is unusable
     */
    public Optional<MarketFeatures> extract(MarketData marketData) {
        List<Candle> candles = marketData.getCandles();
        if (candles == null || candles.size() < MIN_CANDLES) {
            return Optional.empty();
        }

        BarSeries series = new BaseBarSeriesBuilder()
                .withName(marketData.getInstrumentId())
                .build();
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            series.addBar(
                    SERIES_ORIGIN.plusDays(i + 1L),
                    candle.getOpen(),
                    candle.getHigh(),
                    candle.getLow(),
                    candle.getClose(),
                    candle.getVolume() != null ? candle.getVolume() : BigDecimal.ZERO);
        }

        int end = series.getEndIndex();
        ClosePriceIndicator close = new ClosePriceIndicator(series);

        BigDecimal lastPrice = marketData.getLastPrice() != null
                ? marketData.getLastPrice()
                : candles.get(candles.size() - 1).getClose();
        if (lastPrice == null || lastPrice.signum() <= 0) {
            return Optional.empty();
        }

        double rsi = valueOr(new RSIIndicator(close, RSI_PERIOD), end, 50.0);
        double emaFast = valueOr(new EMAIndicator(close, EMA_FAST_PERIOD), end, lastPrice.doubleValue());
        double emaSlow = valueOr(new EMAIndicator(close, EMA_SLOW_PERIOD), end, lastPrice.doubleValue());
        double atr = valueOr(new ATRIndicator(series, ATR_PERIOD), end, 0.0);
        double support = valueOr(new LowestValueIndicator(new LowPriceIndicator(series), RANGE_LOOKBACK), end, 0.0);
        double resistance =
                valueOr(new HighestValueIndicator(new HighPriceIndicator(series), RANGE_LOOKBACK), end, 0.0);

        double closeNow = close.getValue(end).doubleValue();
        double closeBack = close.getValue(end - (MOMENTUM_LOOKBACK - 1)).doubleValue();
        double momentum = closeBack > 0 ? (closeNow - closeBack) / closeBack : 0.0;

        return Optional.of(MarketFeatures.builder()
                .instrumentId(marketData.getInstrumentId())
                .lastPrice(lastPrice)
                .rsi(rsi)
                .emaFast(emaFast)
                .emaSlow(emaSlow)
                .atr(atr)
                .momentum(momentum)
                .volatility(atr / lastPrice.doubleValue())
                .spread(spread(marketData.getBid(), marketData.getAsk()))
                .support(support)
                .resistance(resistance)
                .build());
    }

    static double spread(BigDecimal bid, BigDecimal ask) {
        if (bid == null || ask == null || bid.signum() <= 0 || ask.compareTo(bid) < 0) {
            return 0.0;
        }
        BigDecimal mid = bid.add(ask).divide(BigDecimal.valueOf(2), 12, RoundingMode.HALF_UP);
        return ask.subtract(bid).divide(mid, 12, RoundingMode.HALF_UP).doubleValue();
    }

    private static double valueOr(Indicator<Num> indicator, int index, double fallback) {
        Num value = indicator.getValue(index);
        if (value == null || value.isNaN()) {
            return fallback;
        }
        double result = value.doubleValue();
        return Double.isNaN(result) || Double.isInfinite(result) ? fallback : result;
    }
}
