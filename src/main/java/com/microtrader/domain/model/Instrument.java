package com.microtrader.domain.model;

import com.microtrader.domain.enums.LiquidityTier;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A tradable instrument as listed by the venue. Immutable once loaded into the universe.
 */
@Value
@Builder
public class Instrument {

    /** Venue symbol, e.g. "DOGEUSDT". */
    String id;

    /** Smallest order the venue accepts, in quote currency. */
    BigDecimal minOrderSize;

    LiquidityTier liquidityTier;

    /** Rolling 24h traded value in quote currency. */
    BigDecimal volume24h;
}
