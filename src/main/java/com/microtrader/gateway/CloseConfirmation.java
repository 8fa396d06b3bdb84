package com.microtrader.gateway;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Venue confirmation that a closing order filled. */
@Value
@Builder
public class CloseConfirmation {

    String positionId;
    BigDecimal exitPrice;
    Instant filledAt;
}
