package com.adaptivetrader.event;

/**
 * Kind of position change carried by a {@link PositionEvent}.
 */
public enum PositionEventType {
    OPENED,
    CLOSED
}
