package com.adaptivetrader.domain.enums;

/**
 * Why a position was closed.
 *
 * <p>The first three are tick-driven and checked in declaration order, so a tick
 * that breaches several levels at once closes via the most protective one.
 */
public enum ExitReason {

    /** Price crossed the emergency stop (1.5x the normal stop distance). */
    EMERGENCY_STOP,

    /** Price crossed the stop loss. */
    STOP_LOSS,

    /** Price reached the take-profit target. */
    TAKE_PROFIT,

    /** Closed explicitly by an operator or an upstream component. */
    MANUAL
}
