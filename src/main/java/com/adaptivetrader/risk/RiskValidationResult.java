package com.adaptivetrader.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of checking a prospective position against the risk limits.
 *
 * <p>Either approved (no violations) or rejected with every violation found, not
 * just the first.
 */
@Getter
public class RiskValidationResult {

    private final boolean approved;
    private final List<RiskViolation> violations;

    private RiskValidationResult(boolean approved, List<RiskViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static RiskValidationResult approved() {
        return new RiskValidationResult(true, Collections.emptyList());
    }

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        return new RiskValidationResult(false, List.copyOf(violations));
    }

    public boolean isRejected() {
        return !approved;
    }
}
