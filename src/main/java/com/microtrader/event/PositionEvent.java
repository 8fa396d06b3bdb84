package com.microtrader.event;

import com.microtrader.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a position is opened by the execution coordinator or closed by the position
 * monitor.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>PerformanceTracker: records closed trades and journals them</li>
 *   <li>TradingMetrics: counts opens and closes by exit reason</li>
 * </ul>
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
