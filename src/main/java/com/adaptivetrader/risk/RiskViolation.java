package com.adaptivetrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single risk limit that vetoed a new position.
 *
 * <p>Codes: ORDER_RATE_LIMITED, EXPOSURE_LIMIT_EXCEEDED, DAILY_DRAWDOWN_EXCEEDED,
 * RISK_SCORE_TOO_HIGH, MAX_POSITIONS_REACHED, INVALID_CAPITAL.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String ORDER_RATE_LIMITED = "ORDER_RATE_LIMITED";
    public static final String EXPOSURE_LIMIT_EXCEEDED = "EXPOSURE_LIMIT_EXCEEDED";
    public static final String DAILY_DRAWDOWN_EXCEEDED = "DAILY_DRAWDOWN_EXCEEDED";
    public static final String RISK_SCORE_TOO_HIGH = "RISK_SCORE_TOO_HIGH";
    public static final String MAX_POSITIONS_REACHED = "MAX_POSITIONS_REACHED";
    public static final String INVALID_CAPITAL = "INVALID_CAPITAL";

    /** Machine-readable violation code. */
    private final String code;

    /** Human-readable description. */
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
