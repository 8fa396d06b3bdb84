package com.microtrader.domain.model;

import com.microtrader.domain.enums.Direction;
import com.microtrader.domain.enums.ExitReason;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ClosedTrade {

    String positionId;
    String instrumentId;
    Direction direction;
    BigDecimal size;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal pnl;
    ExitReason exitReason;
    Instant openedAt;
    Instant closedAt;

    public boolean isWin() {
        return pnl.signum() > 0;
    }

    public static ClosedTrade of(Position position) {
        return ClosedTrade.builder()
                .positionId(position.getId())
                .instrumentId(position.getInstrumentId())
                .direction(position.getDirection())
                .size(position.getSize())
                .entryPrice(position.getEntryPrice())
                .exitPrice(position.getExitPrice())
                .pnl(position.getRealizedPnl())
                .exitReason(position.getExitReason())
                .openedAt(position.getOpenedAt())
                .closedAt(position.getClosedAt())
                .build();
    }
}
