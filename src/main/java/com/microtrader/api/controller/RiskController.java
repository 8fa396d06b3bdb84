package com.microtrader.api.controller;

import com.microtrader.domain.enums.RiskState;
import com.microtrader.domain.model.AccountSnapshot;
import com.microtrader.risk.RiskLimits;
import com.microtrader.risk.RiskManager;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk management: status and circuit-breaker recovery.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/status -- account snapshot, risk state and configured limits</li>
 *   <li>POST /api/risk/circuit-breaker/reset -- clear a latched circuit breaker (409 if not halted)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskManager riskManager;

    public RiskController(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getRiskStatus() {
        AccountSnapshot account = riskManager.snapshot();
        RiskLimits limits = riskManager.getLimits();

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("riskState", account.getRiskState());
        status.put("balance", account.getBalance());
        status.put("peakBalance", account.getPeakBalance());
        status.put("dayStartBalance", account.getDayStartBalance());
        status.put("dailyPnl", account.getDailyPnl());
        status.put("sessionBaseline", account.getSessionBaseline());
        status.put("tradingDay", account.getTradingDay());
        status.put("openPositions", account.getOpenPositions());
        status.put("reservedSlots", account.getReservedSlots());
        status.put("committedCapital", account.getCommittedCapital());
        status.put("limits", limits);
        status.put("takenAt", account.getTakenAt());
        return ResponseEntity.ok(status);
    }

    /**
     * Manual recovery from HALTED. Peak and session baseline are re-based to the current balance.
     */
    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<Map<String, Object>> resetCircuitBreaker(
            @RequestParam(defaultValue = "api") String operator) {
        log.warn("Circuit breaker reset requested by {}", operator);
        RiskState newState = riskManager.resetCircuitBreaker(operator);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("riskState", newState);
        result.put("balance", riskManager.snapshot().getBalance());
        result.put("resetBy", operator);
        return ResponseEntity.ok(result);
    }
}
