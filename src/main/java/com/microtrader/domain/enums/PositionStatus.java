package com.microtrader.domain.enums;

/**
 * Lifecycle of a position. Transitions only move forward: OPEN -> CLOSING -> CLOSED.
 */
public enum PositionStatus {
    OPEN,
    CLOSING,
    CLOSED
}
