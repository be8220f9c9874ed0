package com.adaptivetrader.domain.enums;

/**
 * Direction of a position. LONG profits when price rises, SHORT when it falls.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies raw price moves into P&L. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
