package com.microtrader.event;

public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
