package com.adaptivetrader.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A new position was vetoed by one or more risk limits. */
    RISK_LIMIT_REJECTION,

    /** Today's drawdown moved past the configured maximum. */
    DAILY_DRAWDOWN_BREACH,

    /** Risk score or drawdown is high enough that exposure should be trimmed. */
    REDUCE_EXPOSURE_ADVISED,

    /** A new trading day started and the daily counters were reset. */
    TRADING_DAY_ROLLOVER
}
