package com.microtrader.scanner;

import com.microtrader.domain.model.Instrument;
import com.microtrader.domain.model.MarketData;
import com.microtrader.domain.model.MarketFeatures;
import com.microtrader.exception.TransientGatewayException;
import com.microtrader.exception.VenueRejectedException;
import com.microtrader.gateway.BoundedRetry;
import com.microtrader.gateway.MarketGateway;
import com.microtrader.universe.UniverseManager;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls market data for every instrument in the universe and derives its features.
 *
 * <p>{@link #scan()} returns a lazy, single-use stream: each instrument is fetched only when the
 * stream is consumed, and re-scanning requires a new call. Per-instrument failures are isolated.
 * Transient errors are retried with bounded backoff; if they persist, or the venue rejects the
 * request, or the history is too short, the instrument is skipped for this cycle and logged.
 */
@Service
public class MarketScanner {

    private static final Logger log = LoggerFactory.getLogger(MarketScanner.class);

    private final UniverseManager universeManager;
    private final MarketGateway marketGateway;
    private final BoundedRetry boundedRetry;
    private final FeatureExtractor featureExtractor;

    public MarketScanner(
            UniverseManager universeManager,
            MarketGateway marketGateway,
            BoundedRetry boundedRetry,
            FeatureExtractor featureExtractor) {
        this.universeManager = universeManager;
        this.marketGateway = marketGateway;
        this.boundedRetry = boundedRetry;
        this.featureExtractor = featureExtractor;
    }

    public Stream<ScanResult> scan() {
        List<Instrument> universe = universeManager.instruments();
        log.debug("Scanning {} instruments", universe.size());
        return universe.stream().map(this::scanInstrument).flatMap(Optional::stream);
    }

    Optional<ScanResult> scanInstrument(Instrument instrument) {
        try {
            MarketData marketData = boundedRetry.call(
                    "getMarketData(" + instrument.getId() + ")", () -> marketGateway.getMarketData(instrument));
            Optional<MarketFeatures> features = featureExtractor.extract(marketData);
            if (features.isEmpty()) {
                log.debug("Skipping {}: insufficient market data", instrument.getId());
                return Optional.empty();
            }
            return Optional.of(new ScanResult(instrument, features.get()));
        } catch (TransientGatewayException e) {
            log.warn("Skipping {} this cycle after {}: {}", instrument.getId(), e.getKind(), e.getMessage());
        } catch (VenueRejectedException e) {
            log.warn("Skipping {} this cycle, venue said {}: {}", instrument.getId(), e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Skipping {} this cycle, unexpected scan failure", instrument.getId(), e);
        }
        return Optional.empty();
    }
}
