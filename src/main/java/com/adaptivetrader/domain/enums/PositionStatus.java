package com.adaptivetrader.domain.enums;

/**
 * Lifecycle of a position. OPEN -> CLOSED is the only transition; a closed
 * position is never reopened.
 */
public enum PositionStatus {
    OPEN,
    CLOSED
}
