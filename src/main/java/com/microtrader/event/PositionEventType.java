package com.microtrader.event;

public enum PositionEventType {
    OPENED,
    CLOSED
}
