package com.microtrader.universe;

import com.microtrader.config.TradingSettings;
import com.microtrader.domain.model.Instrument;
import com.microtrader.gateway.BoundedRetry;
import com.microtrader.gateway.MarketGateway;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maintains the fixed-size candidate instrument set.
 *
 * <p>Each refresh lists the venue's instruments, drops those below the 24h volume floor,
 * de-duplicates by id, orders by liquidity tier (most liquid first) then id, and keeps the first
 * {@code universeMaxSymbols}. The result is published as an immutable list through a volatile
 * reference, so scan cycles read it without locking.
 *
 * <p>Stale-but-available: a refresh that fails or yields nothing keeps serving the last
 * known-good set. Before the first successful refresh the universe is empty.
 */
@Service
public class UniverseManager {

    private static final Logger log = LoggerFactory.getLogger(UniverseManager.class);

    private static final Comparator<Instrument> UNIVERSE_ORDER = Comparator.comparing(
                    (Instrument instrument) -> instrument.getLiquidityTier().rank())
            .reversed()
            .thenComparing(Instrument::getId);

    private final MarketGateway marketGateway;
    private final BoundedRetry boundedRetry;
    private final TradingSettings tradingSettings;
    private final Clock clock;

    private volatile List<Instrument> instruments = List.of();
    private volatile Instant lastRefreshedAt;

    public UniverseManager(
            MarketGateway marketGateway, BoundedRetry boundedRetry, TradingSettings tradingSettings, Clock clock) {
        this.marketGateway = marketGateway;
        this.boundedRetry = boundedRetry;
        this.tradingSettings = tradingSettings;
        this.clock = clock;
    }

    /** Current universe, ordered. Never null. */
    public List<Instrument> instruments() {
        return instruments;
    }

    /**
     * Reloads the universe from the gateway.
     *
     * @return true if the universe was replaced, false if the previous set was kept
     */
    public boolean refresh() {
        List<Instrument> listed;
        try {
            listed = boundedRetry.call("listInstruments", marketGateway::listInstruments);
        } catch (RuntimeException e) {
            log.warn(
                    "Universe refresh failed, keeping {} instruments from {}: {}",
                    instruments.size(),
                    lastRefreshedAt,
                    e.getMessage());
            return false;
        }

        Map<String, Instrument> byId = new LinkedHashMap<>();
        for (Instrument instrument : listed) {
            if (instrument.getVolume24h() != null
                    && instrument.getVolume24h().compareTo(tradingSettings.getMinVolume24h()) < 0) {
                continue;
            }
            byId.putIfAbsent(instrument.getId(), instrument);
        }

        List<Instrument> selected = byId.values().stream()
                .sorted(UNIVERSE_ORDER)
                .limit(tradingSettings.getUniverseMaxSymbols())
                .toList();

        if (selected.isEmpty()) {
            log.warn(
                    "Universe refresh returned no eligible instruments ({} listed), keeping {} previous",
                    listed.size(),
                    instruments.size());
            return false;
        }

        instruments = selected;
        lastRefreshedAt = clock.instant();
        log.info("Universe refreshed: {} instruments ({} listed)", selected.size(), listed.size());
        return true;
    }

    public Instant getLastRefreshedAt() {
        return lastRefreshedAt;
    }
}
