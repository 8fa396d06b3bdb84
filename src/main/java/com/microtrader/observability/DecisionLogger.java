package com.microtrader.observability;

import com.microtrader.domain.enums.RejectionReason;
import com.microtrader.domain.model.Opportunity;
import com.microtrader.observability.GateDecision.DecisionOutcome;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps every admission and execution outcome of the scan cycle for post-hoc inspection.
 *
 * <p>The ring buffer uses a {@link ConcurrentLinkedDeque} with a max size of
 * {@value #RING_BUFFER_SIZE}. New entries are added at the front (newest first), and the oldest
 * entries are evicted when the buffer is full. Rejections are also logged at WARN, fills at INFO.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final Clock clock;

    private final ConcurrentLinkedDeque<GateDecision> ringBuffer = new ConcurrentLinkedDeque<>();

    public DecisionLogger(Clock clock) {
        this.clock = clock;
    }

    // ---- Gate outcomes ----

    public void logRejected(Opportunity opportunity, RejectionReason reason, String detail) {
        logger.warn(
                "Rejected {} {} score={} confidence={}: {} ({})",
                opportunity.getDirection(),
                opportunity.getInstrumentId(),
                opportunity.getScore(),
                opportunity.getConfidence(),
                reason,
                detail);
        record(base(opportunity, DecisionOutcome.REJECTED)
                .rejectionReason(reason)
                .detail(detail)
                .build());
    }

    public void logSkippedInFlight(Opportunity opportunity) {
        logger.debug("Skipping {}: order already in flight", opportunity.getInstrumentId());
        record(base(opportunity, DecisionOutcome.SKIPPED_IN_FLIGHT)
                .detail("order already in flight")
                .build());
    }

    public void logSkippedShutdown(Opportunity opportunity) {
        record(base(opportunity, DecisionOutcome.SKIPPED_SHUTDOWN)
                .detail("shutdown requested")
                .build());
    }

    // ---- Execution outcomes ----

    public void logFilled(Opportunity opportunity, BigDecimal size, String orderId) {
        logger.info(
                "Filled {} {} size={} order={} score={}",
                opportunity.getDirection(),
                opportunity.getInstrumentId(),
                size,
                orderId,
                opportunity.getScore());
        record(base(opportunity, DecisionOutcome.FILLED)
                .size(size)
                .orderId(orderId)
                .build());
    }

    public void logOrderFailed(Opportunity opportunity, BigDecimal size, String detail) {
        logger.warn("Order for {} size={} failed: {}", opportunity.getInstrumentId(), size, detail);
        record(base(opportunity, DecisionOutcome.ORDER_FAILED)
                .size(size)
                .detail(detail)
                .build());
    }

    // ---- Ring buffer queries ----

    /**
     * Returns the most recent N decisions, newest first.
     */
    public List<GateDecision> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(Math.max(0, count)).toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    // ---- Internal ----

    private GateDecision.GateDecisionBuilder base(Opportunity opportunity, DecisionOutcome outcome) {
        return GateDecision.builder()
                .timestamp(clock.instant())
                .instrumentId(opportunity.getInstrumentId())
                .direction(opportunity.getDirection())
                .score(opportunity.getScore())
                .confidence(opportunity.getConfidence())
                .outcome(outcome);
    }

    private void record(GateDecision decision) {
        ringBuffer.addFirst(decision);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }
    }
}
