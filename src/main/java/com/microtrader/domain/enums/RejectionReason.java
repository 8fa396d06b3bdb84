package com.microtrader.domain.enums;

public enum RejectionReason {
    CIRCUIT_BREAKER_HALTED,
    DAILY_LIMIT_REACHED,
    CONCURRENCY_CAP_REACHED,
    INSTRUMENT_ALREADY_HELD,
    SIZE_BELOW_MINIMUM
}
