package com.adaptivetrader.domain.enums;

/**
 * Machine-readable reason attached to every {@link com.adaptivetrader.domain.model.TradeDecision}.
 *
 * <p>Approval reasons say which gate branch let the trade through; rejection
 * reasons map onto the engine's error taxonomy (invalid input, insufficient
 * size, risk limit exceeded).
 */
public enum DecisionReason {

    // ---- Approvals ----

    /** Pattern never observed; approved so it can build a history. */
    NEW_PATTERN,

    /** Pattern observed but below the minimum sample size. */
    EXPLORING,

    /** Pattern has enough history and passes win rate / loss streak checks. */
    PATTERN_QUALIFIED,

    // ---- Gate rejections ----

    INSUFFICIENT_SIGNALS,
    LOW_WIN_RATE,
    CONSECUTIVE_LOSSES,
    UNSEEN_PATTERN,

    // ---- Engine rejections ----

    INVALID_INPUT,
    INSUFFICIENT_SIZE,
    POSITION_ALREADY_OPEN,
    RISK_LIMIT_EXCEEDED
}
