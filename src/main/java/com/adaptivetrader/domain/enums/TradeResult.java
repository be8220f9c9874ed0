package com.adaptivetrader.domain.enums;

/**
 * Outcome of the most recent trade recorded against a pattern.
 * UNKNOWN until the first outcome arrives.
 */
public enum TradeResult {
    WIN,
    LOSS,
    UNKNOWN
}
