package com.microtrader.simulator;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.LiquidityTier;
import com.microtrader.domain.model.Candle;
import com.microtrader.domain.model.Instrument;
import com.microtrader.domain.model.MarketData;
import com.microtrader.exception.VenueRejectedException;
import com.microtrader.execution.OrderRequest;
import com.microtrader.gateway.CloseConfirmation;
import com.microtrader.gateway.MarketGateway;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of {@link MarketGateway}.
 *
 * <p>Prices follow a seeded random walk per instrument: every {@link #getMarketData} call appends
 * one one-minute candle, so a given seed and call sequence always replays the same market.
 * Orders fill immediately at the current price. Balance is debited and credited only by realized
 * P&L on close, the same accounting the RiskManager applies.
 *
 * <p>Venue semantics are honoured so the trading loop exercises its real paths:
 * <ul>
 *   <li>A repeated {@code clientOrderId} returns the original order id without a second fill</li>
 *   <li>Orders beyond the uncommitted balance fail with INSUFFICIENT_FUNDS</li>
 *   <li>Closing a position twice fails with ALREADY_CLOSED; unknown ids with NOT_FOUND</li>
 * </ul>
 *
 * <p>Active when {@code microtrader.gateway.mode=DRY_RUN} (the default).
 */
@Service
@ConditionalOnProperty(name = "microtrader.gateway.mode", havingValue = "DRY_RUN", matchIfMissing = true)
public class DryRunMarketGateway implements MarketGateway {

    private static final Logger log = LoggerFactory.getLogger(DryRunMarketGateway.class);

    static final int CANDLE_HISTORY = 60;
    static final Duration CANDLE_LENGTH = Duration.ofMinutes(1);

    private static final BigDecimal HALF_SPREAD = new BigDecimal("0.0005");
    private static final BigDecimal MIN_ORDER_SIZE = new BigDecimal("5");
    private static final int PRICE_SCALE = 8;
    private static final MathContext PRICE_PRECISION = new MathContext(10, RoundingMode.HALF_UP);

    /** id, tier, 24h volume, starting price, per-candle volatility. */
    private static final Object[][] LISTING = {
        {"BTC/USDT", LiquidityTier.HIGH, "2500000000", "65000", 0.0020},
        {"ETH/USDT", LiquidityTier.HIGH, "1200000000", "3200", 0.0025},
        {"SOL/USDT", LiquidityTier.HIGH, "450000000", "150", 0.0040},
        {"XRP/USDT", LiquidityTier.HIGH, "300000000", "0.52", 0.0035},
        {"DOGE/USDT", LiquidityTier.MEDIUM, "180000000", "0.12", 0.0060},
        {"ADA/USDT", LiquidityTier.MEDIUM, "90000000", "0.45", 0.0045},
        {"AVAX/USDT", LiquidityTier.MEDIUM, "60000000", "28", 0.0050},
        {"LINK/USDT", LiquidityTier.MEDIUM, "40000000", "14", 0.0050},
        {"SHIB/USDT", LiquidityTier.LOW, "25000000", "0.000018", 0.0080},
        {"PEPE/USDT", LiquidityTier.LOW, "20000000", "0.0000085", 0.0100},
        {"FLOKI/USDT", LiquidityTier.LOW, "6000000", "0.00015", 0.0090},
        {"BONK/USDT", LiquidityTier.LOW, "800000", "0.000021", 0.0120},
    };

    private final Random random;
    private final Clock clock;
    private final List<Instrument> instruments;

    private final Map<String, Deque<Candle>> candles = new HashMap<>();
    private final Map<String, Double> volatilities = new HashMap<>();
    private final Map<String, String> orderIdsByClientId = new HashMap<>();
    private final Map<String, VirtualPosition> openPositions = new LinkedHashMap<>();
    private final Set<String> closedPositionIds = new HashSet<>();

    private BigDecimal balance;
    private long orderSequence;

    public DryRunMarketGateway(
            @Value("${microtrader.gateway.dry-run.seed:42}") long seed,
            @Value("${microtrader.gateway.dry-run.balance:100.00}") BigDecimal startingBalance,
            Clock clock) {
        this.random = new Random(seed);
        this.clock = clock;
        this.balance = startingBalance;

        List<Instrument> listed = new ArrayList<>();
        for (Object[] row : LISTING) {
            String id = (String) row[0];
            listed.add(Instrument.builder()
                    .id(id)
                    .liquidityTier((LiquidityTier) row[1])
                    .volume24h(new BigDecimal((String) row[2]))
                    .minOrderSize(MIN_ORDER_SIZE)
                    .build());
            volatilities.put(id, (Double) row[4]);
            candles.put(id, seedHistory(new BigDecimal((String) row[3]), (Double) row[4]));
        }
        this.instruments = List.copyOf(listed);
        log.info("Dry-run gateway ready: {} instruments, seed={}, balance={}", instruments.size(), seed, balance);
    }

    @Override
    public List<Instrument> listInstruments() {
        return instruments;
    }

    @Override
    public synchronized MarketData getMarketData(Instrument instrument) {
        Deque<Candle> history = historyOf(instrument.getId());
        appendCandle(history, volatilities.get(instrument.getId()));

        BigDecimal last = history.getLast().getClose();
        return MarketData.builder()
                .instrumentId(instrument.getId())
                .lastPrice(last)
                .bid(last.multiply(BigDecimal.ONE.subtract(HALF_SPREAD), PRICE_PRECISION))
                .ask(last.multiply(BigDecimal.ONE.add(HALF_SPREAD), PRICE_PRECISION))
                .candles(List.copyOf(history))
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public synchronized String placeOrder(OrderRequest request) {
        String existing = orderIdsByClientId.get(request.getClientOrderId());
        if (existing != null) {
            log.info(
                    "Duplicate submission {} for {}, returning {}",
                    request.getClientOrderId(),
                    request.getInstrumentId(),
                    existing);
            return existing;
        }

        Deque<Candle> history = historyOf(request.getInstrumentId());
        BigDecimal committed = openPositions.values().stream()
                .map(VirtualPosition::size)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (committed.add(request.getSize()).compareTo(balance) > 0) {
            throw new VenueRejectedException(
                    VenueRejectedException.Kind.INSUFFICIENT_FUNDS,
                    "Order " + request.getSize() + " exceeds free balance " + balance.subtract(committed));
        }

        String orderId = "DRY-" + (++orderSequence);
        BigDecimal fillPrice = history.getLast().getClose();
        openPositions.put(
                orderId,
                new VirtualPosition(request.getInstrumentId(), request.getDirection(), request.getSize(), fillPrice));
        orderIdsByClientId.put(request.getClientOrderId(), orderId);
        log.debug(
                "Dry-run fill {}: {} {} size={} @ {}",
                orderId,
                request.getDirection(),
                request.getInstrumentId(),
                request.getSize(),
                fillPrice);
        return orderId;
    }

    @Override
    public synchronized CloseConfirmation closePosition(String positionId) {
        VirtualPosition position = openPositions.remove(positionId);
        if (position == null) {
            if (closedPositionIds.contains(positionId)) {
                throw new VenueRejectedException(
                        VenueRejectedException.Kind.ALREADY_CLOSED, "Position " + positionId + " already closed");
            }
            throw new VenueRejectedException(VenueRejectedException.Kind.NOT_FOUND, "Unknown position " + positionId);
        }
        closedPositionIds.add(positionId);

        BigDecimal exitPrice = historyOf(position.instrumentId()).getLast().getClose();
        BigDecimal move = exitPrice.subtract(position.entryPrice()).divide(position.entryPrice(), 12, RoundingMode.HALF_UP);
        BigDecimal pnl = position.size()
                .multiply(move)
                .multiply(BigDecimal.valueOf(position.direction().sign()))
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        balance = balance.add(pnl).max(BigDecimal.ZERO);
        log.debug("Dry-run close {} @ {} pnl={} balance={}", positionId, exitPrice, pnl, balance);

        return CloseConfirmation.builder()
                .positionId(positionId)
                .exitPrice(exitPrice)
                .filledAt(clock.instant())
                .build();
    }

    @Override
    public synchronized BigDecimal getBalance() {
        return balance;
    }

    /** Number of positions the venue still holds. */
    public synchronized int openPositionCount() {
        return openPositions.size();
    }

    // ---- Random walk ----

    private Deque<Candle> historyOf(String instrumentId) {
        Deque<Candle> history = candles.get(instrumentId);
        if (history == null) {
            throw new VenueRejectedException(VenueRejectedException.Kind.NOT_FOUND, "Unknown instrument " + instrumentId);
        }
        return history;
    }

    private Deque<Candle> seedHistory(BigDecimal startPrice, double volatility) {
        Deque<Candle> history = new ArrayDeque<>(CANDLE_HISTORY + 1);
        Instant openTime = clock.instant().minus(CANDLE_LENGTH.multipliedBy(CANDLE_HISTORY));
        BigDecimal close = startPrice;
        for (int i = 0; i < CANDLE_HISTORY; i++) {
            Candle candle = nextCandle(openTime, close, volatility);
            history.addLast(candle);
            close = candle.getClose();
            openTime = openTime.plus(CANDLE_LENGTH);
        }
        return history;
    }

    private void appendCandle(Deque<Candle> history, double volatility) {
        Candle last = history.getLast();
        history.addLast(nextCandle(last.getOpenTime().plus(CANDLE_LENGTH), last.getClose(), volatility));
        while (history.size() > CANDLE_HISTORY) {
            history.removeFirst();
        }
    }

    private Candle nextCandle(Instant openTime, BigDecimal open, double volatility) {
        double step = random.nextGaussian() * volatility;
        BigDecimal close = open.multiply(BigDecimal.valueOf(1.0 + step), PRICE_PRECISION);
        double wick = Math.abs(random.nextGaussian()) * volatility / 2;
        return Candle.builder()
                .openTime(openTime)
                .open(open)
                .high(open.max(close).multiply(BigDecimal.valueOf(1.0 + wick), PRICE_PRECISION))
                .low(open.min(close).multiply(BigDecimal.valueOf(1.0 - wick), PRICE_PRECISION))
                .close(close)
                .volume(BigDecimal.valueOf(1000 + random.nextInt(9000)))
                .build();
    }

    private record VirtualPosition(String instrumentId, Direction direction, BigDecimal size, BigDecimal entryPrice) {}
}
