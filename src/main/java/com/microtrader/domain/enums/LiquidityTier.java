package com.microtrader.domain.enums;

/**
 * Coarse liquidity bucket of an instrument. Declared from most to least liquid; {@link #rank()}
 * is used as a ranking tie-breaker (higher rank wins).
 */
public enum LiquidityTier {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    LiquidityTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
