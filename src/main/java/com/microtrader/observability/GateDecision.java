package com.microtrader.observability;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.RejectionReason;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One entry of the decision log: what the admission gate and the execution coordinator did with
 * a single opportunity.
 */
@Value
@Builder
public class GateDecision {

    Instant timestamp;
    String instrumentId;
    Direction direction;
    BigDecimal score;
    BigDecimal confidence;
    DecisionOutcome outcome;

    /** Set when {@code outcome} is REJECTED. */
    RejectionReason rejectionReason;

    /** Approved size in quote currency, null when rejected. */
    BigDecimal size;

    /** Venue order id once FILLED. */
    String orderId;

    String detail;

    public enum DecisionOutcome {
        /** Gate refused the opportunity. */
        REJECTED,
        /** Another submission for the instrument was still in flight. */
        SKIPPED_IN_FLIGHT,
        /** Order placed and position registered. */
        FILLED,
        /** Gate approved but the venue refused or retries ran out. */
        ORDER_FAILED,
        /** Cycle stopped before the opportunity was evaluated. */
        SKIPPED_SHUTDOWN
    }
}
