package com.microtrader.domain.enums;

/** Why a position was closed, in monitor priority order (SHUTDOWN is a forced close variant). */
public enum ExitReason {
    FORCED_CLOSE,
    SHUTDOWN,
    STOP_LOSS,
    TAKE_PROFIT,
    TIME_STOP
}
