package com.microtrader.domain.model;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.SignalType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A scored candidate trade. Created per scan cycle, discarded after the gating decision.
 */
@Value
@Builder
public class Opportunity {

    Instrument instrument;
    Direction direction;
    SignalType signalType;

    /** Signal strength in [0, 1], 4 decimal places. */
    BigDecimal score;

    /** Score discounted by spread, in [0, 1]. Drives position sizing. */
    BigDecimal confidence;

    BigDecimal entryPrice;

    /** Timestamp of the scan cycle that produced this opportunity. */
    Instant timestamp;

    public String getInstrumentId() {
        return instrument.getId();
    }
}
