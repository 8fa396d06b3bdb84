package com.microtrader.domain.enums;

public enum Direction {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies a price move into a P&L sign. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
