package com.microtrader.api.controller;

import com.microtrader.exception.BusinessException;
import com.microtrader.exception.ErrorCode;
import com.microtrader.observability.DecisionLogger;
import com.microtrader.observability.GateDecision;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/decisions?limit=n -- most recent admission and execution decisions, newest first.
 */
@RestController
@RequestMapping("/api/decisions")
public class DecisionController {

    static final int MAX_LIMIT = 1000;

    private final DecisionLogger decisionLogger;

    public DecisionController(DecisionLogger decisionLogger) {
        this.decisionLogger = decisionLogger;
    }

    @GetMapping
    public ResponseEntity<List<GateDecision>> getRecentDecisions(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(
                    ErrorCode.BAD_REQUEST, "limit must be between 1 and " + MAX_LIMIT, Map.of("limit", limit));
        }
        return ResponseEntity.ok(decisionLogger.getRecentDecisions(limit));
    }
}
