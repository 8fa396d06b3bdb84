package com.microtrader.api.controller;

import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.PerformanceSnapshot;
import com.microtrader.exception.BusinessException;
import com.microtrader.exception.ErrorCode;
import com.microtrader.performance.PerformanceTracker;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only performance endpoints.
 *
 * <ul>
 *   <li>GET /api/performance/latest -- most recent snapshot (404 before the first one)</li>
 *   <li>GET /api/performance/snapshots -- every snapshot of this session, oldest first</li>
 *   <li>GET /api/performance/trades -- closed trades of this session, oldest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/performance")
public class PerformanceController {

    private final PerformanceTracker performanceTracker;

    public PerformanceController(PerformanceTracker performanceTracker) {
        this.performanceTracker = performanceTracker;
    }

    @GetMapping("/latest")
    public ResponseEntity<PerformanceSnapshot> getLatest() {
        PerformanceSnapshot snapshot = performanceTracker
                .latest()
                .orElseThrow(() -> new BusinessException(ErrorCode.NOT_FOUND, "No performance snapshot taken yet"));
        return ResponseEntity.ok(snapshot);
    }

    @GetMapping("/snapshots")
    public ResponseEntity<List<PerformanceSnapshot>> getSnapshots() {
        return ResponseEntity.ok(performanceTracker.getSnapshots());
    }

    @GetMapping("/trades")
    public ResponseEntity<List<ClosedTrade>> getTrades() {
        return ResponseEntity.ok(performanceTracker.getClosedTrades());
    }
}
