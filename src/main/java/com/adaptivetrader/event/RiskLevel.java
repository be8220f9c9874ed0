package com.adaptivetrader.event;

/**
 * Severity level for a {@link RiskEvent}.
 */
public enum RiskLevel {

    /** Informational, no action required. */
    INFO,

    /** A limit blocked something or is close to doing so. */
    WARNING,

    /** A hard limit is breached; new positions are blocked until it clears. */
    CRITICAL
}
