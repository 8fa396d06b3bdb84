package com.microtrader.domain.enums;

public enum SignalType {
    MOMENTUM,
    REVERSAL
}
