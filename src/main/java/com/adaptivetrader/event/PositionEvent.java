package com.adaptivetrader.event;

import com.adaptivetrader.domain.model.Position;
import com.adaptivetrader.domain.model.TradeRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the PositionLedger when a position opens or closes.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>CustomMetricsService -- counts opened/closed positions</li>
 *   <li>EngineStatePersistenceService -- flushes state after a close</li>
 * </ul>
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;
    private final TradeRecord tradeRecord;

    /**
     * @param source      the component publishing this event
     * @param position    snapshot of the position after the change
     * @param eventType   what happened
     * @param tradeRecord the history entry for CLOSED events, null for OPENED
     */
    public PositionEvent(Object source, Position position, PositionEventType eventType, TradeRecord tradeRecord) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.tradeRecord = tradeRecord;
    }

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        this(source, position, eventType, null);
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public TradeRecord getTradeRecord() {
        return tradeRecord;
    }
}
