package com.microtrader.execution;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.model.Opportunity;
import com.microtrader.domain.model.Position;
import com.microtrader.event.PositionEvent;
import com.microtrader.event.PositionEventType;
import com.microtrader.exception.TransientGatewayException;
import com.microtrader.exception.VenueRejectedException;
import com.microtrader.gateway.BoundedRetry;
import com.microtrader.gateway.MarketGateway;
import com.microtrader.observability.DecisionLogger;
import com.microtrader.observability.GateDecision.DecisionOutcome;
import com.microtrader.observability.TradingMetrics;
import com.microtrader.risk.AdmissionDecision;
import com.microtrader.risk.Reservation;
import com.microtrader.risk.RiskLimits;
import com.microtrader.risk.RiskManager;
import com.microtrader.scheduler.ShutdownSignal;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Turns ranked opportunities into open positions.
 *
 * <p>Per opportunity, in rank order:
 * <ol>
 *   <li>Acquire the instrument's in-flight slot (skip if another submission holds it)</li>
 *   <li>Ask the RiskManager gate; a rejection is logged and the next opportunity is tried</li>
 *   <li>Place the entry order through {@link BoundedRetry}, carrying the idempotency key</li>
 *   <li>On fill, build the Position with scalp stop-loss and take-profit levels, confirm the
 *       reservation and publish {@link PositionEventType#OPENED}</li>
 * </ol>
 *
 * <p>Any failure after approval releases the reservation. The in-flight slot is always released.
 * Nothing is thrown out of {@link #execute(List)}: the scan cycle must survive any single bad
 * opportunity.
 */
@Service
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private static final int PRICE_SCALE = 8;

    private final RiskManager riskManager;
    private final MarketGateway marketGateway;
    private final BoundedRetry boundedRetry;
    private final InFlightOrderRegistry inFlightOrderRegistry;
    private final DecisionLogger decisionLogger;
    private final TradingMetrics tradingMetrics;
    private final ShutdownSignal shutdownSignal;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public ExecutionCoordinator(
            RiskManager riskManager,
            MarketGateway marketGateway,
            BoundedRetry boundedRetry,
            InFlightOrderRegistry inFlightOrderRegistry,
            DecisionLogger decisionLogger,
            TradingMetrics tradingMetrics,
            ShutdownSignal shutdownSignal,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.riskManager = riskManager;
        this.marketGateway = marketGateway;
        this.boundedRetry = boundedRetry;
        this.inFlightOrderRegistry = inFlightOrderRegistry;
        this.decisionLogger = decisionLogger;
        this.tradingMetrics = tradingMetrics;
        this.shutdownSignal = shutdownSignal;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Executes opportunities sequentially in the given (ranked) order. Stops between
     * opportunities once the shutdown signal is raised.
     */
    public ExecutionSummary execute(List<Opportunity> rankedOpportunities) {
        int filled = 0;
        int rejected = 0;
        int failed = 0;
        int skipped = 0;
        int considered = 0;

        for (Opportunity opportunity : rankedOpportunities) {
            if (shutdownSignal.isRaised()) {
                int remaining = rankedOpportunities.size() - considered;
                log.info("Shutdown requested, leaving {} opportunities unexecuted", remaining);
                decisionLogger.logSkippedShutdown(opportunity);
                tradingMetrics.recordDecision(DecisionOutcome.SKIPPED_SHUTDOWN);
                skipped += remaining;
                break;
            }
            considered++;

            DecisionOutcome outcome;
            try {
                outcome = executeOne(opportunity);
            } catch (RuntimeException e) {
                log.error("Unexpected failure executing {}", opportunity.getInstrumentId(), e);
                outcome = DecisionOutcome.ORDER_FAILED;
            }
            tradingMetrics.recordDecision(outcome);

            switch (outcome) {
                case FILLED -> filled++;
                case REJECTED -> rejected++;
                case ORDER_FAILED -> failed++;
                default -> skipped++;
            }
        }

        return ExecutionSummary.builder()
                .considered(considered)
                .filled(filled)
                .rejected(rejected)
                .failed(failed)
                .skipped(skipped)
                .build();
    }

    private DecisionOutcome executeOne(Opportunity opportunity) {
        String instrumentId = opportunity.getInstrumentId();
        String idempotencyKey = inFlightOrderRegistry.keyFor(instrumentId, opportunity.getTimestamp());
        if (!inFlightOrderRegistry.tryAcquire(instrumentId, idempotencyKey)) {
            decisionLogger.logSkippedInFlight(opportunity);
            return DecisionOutcome.SKIPPED_IN_FLIGHT;
        }
        try {
            AdmissionDecision decision = riskManager.admit(opportunity);
            if (decision.isRejected()) {
                decisionLogger.logRejected(opportunity, decision.getRejectionReason(), decision.getDetail());
                return DecisionOutcome.REJECTED;
            }
            return submit(opportunity, decision.getReservation(), idempotencyKey);
        } finally {
            inFlightOrderRegistry.release(instrumentId, idempotencyKey);
        }
    }

    private DecisionOutcome submit(Opportunity opportunity, Reservation reservation, String idempotencyKey) {
        RiskLimits limits = riskManager.getLimits();
        BigDecimal entry = opportunity.getEntryPrice();
        OrderRequest request = OrderRequest.builder()
                .clientOrderId(idempotencyKey)
                .instrumentId(opportunity.getInstrumentId())
                .direction(opportunity.getDirection())
                .size(reservation.getSize())
                .referencePrice(entry)
                .stopLoss(stopLossFor(opportunity.getDirection(), entry, limits.getScalpStopLoss()))
                .takeProfit(takeProfitFor(opportunity.getDirection(), entry, limits.getScalpTakeProfit()))
                .build();

        boolean confirmed = false;
        try {
            String orderId = boundedRetry.call(
                    "placeOrder(" + request.getInstrumentId() + ")", () -> marketGateway.placeOrder(request));

            Position position = Position.builder()
                    .id(orderId)
                    .instrument(opportunity.getInstrument())
                    .direction(request.getDirection())
                    .entryPrice(entry)
                    .size(request.getSize())
                    .stopLoss(request.getStopLoss())
                    .takeProfit(request.getTakeProfit())
                    .openedAt(clock.instant())
                    .build();
            riskManager.confirmOpen(reservation, position);
            confirmed = true;

            decisionLogger.logFilled(opportunity, request.getSize(), orderId);
            applicationEventPublisher.publishEvent(new PositionEvent(this, position, PositionEventType.OPENED));
            return DecisionOutcome.FILLED;
        } catch (TransientGatewayException e) {
            decisionLogger.logOrderFailed(
                    opportunity,
                    request.getSize(),
                    e.getKind() + " after " + boundedRetry.getMaxAttempts() + " attempts: " + e.getMessage());
            return DecisionOutcome.ORDER_FAILED;
        } catch (VenueRejectedException e) {
            decisionLogger.logOrderFailed(opportunity, request.getSize(), e.getKind() + ": " + e.getMessage());
            return DecisionOutcome.ORDER_FAILED;
        } finally {
            if (!confirmed) {
                riskManager.release(reservation);
            }
        }
    }

    /** LONG: entry * (1 - stopLoss); SHORT: entry * (1 + stopLoss). */
    static BigDecimal stopLossFor(Direction direction, BigDecimal entry, BigDecimal stopLoss) {
        BigDecimal factor = BigDecimal.ONE.subtract(stopLoss.multiply(BigDecimal.valueOf(direction.sign())));
        return entry.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /** LONG: entry * (1 + takeProfit); SHORT: entry * (1 - takeProfit). */
    static BigDecimal takeProfitFor(Direction direction, BigDecimal entry, BigDecimal takeProfit) {
        BigDecimal factor = BigDecimal.ONE.add(takeProfit.multiply(BigDecimal.valueOf(direction.sign())));
        return entry.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
