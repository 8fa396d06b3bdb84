package com.microtrader.performance;

import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.PerformanceSnapshot;

/**
 * Append-only sink for completed trades and performance snapshots.
 *
 * <p>Implementations must never throw into the trading path: a failed write is logged and
 * dropped.
 */
public interface TradeJournal {

    void appendTrade(ClosedTrade trade);

    void appendSnapshot(PerformanceSnapshot snapshot);
}
