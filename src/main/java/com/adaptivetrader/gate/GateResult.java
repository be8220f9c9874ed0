package com.adaptivetrader.gate;

import com.adaptivetrader.domain.enums.DecisionReason;
import com.adaptivetrader.domain.model.Pattern;
import lombok.Getter;

/**
 * Verdict of the {@link TradeGate} for one signal set.
 */
@Getter
public class GateResult {

    private final boolean approved;
    private final DecisionReason reason;
    private final Pattern pattern;
    private final String message;

    private GateResult(boolean approved, DecisionReason reason, Pattern pattern, String message) {
        this.approved = approved;
        this.reason = reason;
        this.pattern = pattern;
        this.message = message;
    }

    public static GateResult approved(DecisionReason reason, Pattern pattern, String message) {
        return new GateResult(true, reason, pattern, message);
    }

    public static GateResult rejected(DecisionReason reason, Pattern pattern, String message) {
        return new GateResult(false, reason, pattern, message);
    }

    public boolean isRejected() {
        return !approved;
    }
}
