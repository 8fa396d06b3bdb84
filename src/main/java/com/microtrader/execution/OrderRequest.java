package com.microtrader.execution;

import com.microtrader.domain.enums.Direction;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Entry order sent to the gateway. {@code size} is notional in quote currency.
 */
@Value
@Builder
public class OrderRequest {

    /** Idempotency key, stable across retries of the same submission. */
    String clientOrderId;

    String instrumentId;
    Direction direction;
    BigDecimal size;
    BigDecimal referencePrice;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
}
