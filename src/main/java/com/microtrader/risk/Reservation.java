package com.microtrader.risk;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * A concurrency slot plus capital held for one approved opportunity between the gate decision
 * and the fill. Must be either confirmed into a position or released.
 */
@Getter
public final class Reservation {

    private final long id;
    private final String instrumentId;
    private final BigDecimal size;

    public Reservation(long id, String instrumentId, BigDecimal size) {
        this.id = id;
        this.instrumentId = instrumentId;
        this.size = size;
    }

    @Override
    public String toString() {
        return "Reservation{" + id + " " + instrumentId + " " + size + "}";
    }
}
