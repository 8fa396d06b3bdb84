package com.microtrader.gateway;

import com.microtrader.domain.model.Instrument;
import com.microtrader.domain.model.MarketData;
import com.microtrader.execution.OrderRequest;
import java.math.BigDecimal;
import java.util.List;

/**
 * Unified abstraction for all venue operations. Every component that reads market data, places
 * orders or closes positions MUST go through this interface.
 *
 * <p>The repository ships {@code DryRunMarketGateway} (paper trading). A live connector is a
 * drop-in bean implementing the same contract; the core never branches on which one is active.
 *
 * <p>Failure contract, shared by every method:
 * <ul>
 *   <li>{@link com.microtrader.exception.TransientGatewayException} for timeouts and rate limits;
 *       callers may retry with bounded backoff</li>
 *   <li>{@link com.microtrader.exception.VenueRejectedException} when the venue refuses the
 *       request; callers must not retry</li>
 * </ul>
 *
 * <p>Implementations must be thread-safe: the scan cycle and the position monitor call in
 * concurrently.
 */
public interface MarketGateway {

    /**
     * Lists the instruments the venue currently offers (possibly pre-filtered upstream).
     */
    List<Instrument> listInstruments();

    /**
     * Fetches top of book and recent candles for one instrument.
     *
     * @throws com.microtrader.exception.VenueRejectedException NOT_FOUND if the venue does not
     *     know the instrument
     */
    MarketData getMarketData(Instrument instrument);

    /**
     * Places a market entry order with attached stop-loss and take-profit.
     *
     * <p>{@link OrderRequest#getClientOrderId()} is an idempotency key: resubmitting a request with
     * the same key (e.g. after a timeout whose outcome is unknown) must return the original order
     * id rather than open a second position.
     *
     * @return the venue order id, which also identifies the resulting position
     * @throws com.microtrader.exception.VenueRejectedException REJECTED or INSUFFICIENT_FUNDS
     */
    String placeOrder(OrderRequest request);

    /**
     * Closes a position at market.
     *
     * @throws com.microtrader.exception.VenueRejectedException ALREADY_CLOSED if the venue
     *     already flattened it (e.g. a venue-side stop fired)
     */
    CloseConfirmation closePosition(String positionId);

    /** Current account balance in quote currency. */
    BigDecimal getBalance();
}
