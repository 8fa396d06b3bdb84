package com.microtrader.performance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.PerformanceSnapshot;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One line of the journal. Exactly one of {@code trade} and {@code snapshot} is set, matching
 * {@code type}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JournalEntry {

    public enum Type {
        TRADE,
        SNAPSHOT
    }

    Type type;
    Instant timestamp;
    ClosedTrade trade;
    PerformanceSnapshot snapshot;

    public static JournalEntry of(ClosedTrade trade) {
        return JournalEntry.builder()
                .type(Type.TRADE)
                .timestamp(trade.getClosedAt())
                .trade(trade)
                .build();
    }

    public static JournalEntry of(PerformanceSnapshot snapshot) {
        return JournalEntry.builder()
                .type(Type.SNAPSHOT)
                .timestamp(snapshot.getTimestamp())
                .snapshot(snapshot)
                .build();
    }
}
