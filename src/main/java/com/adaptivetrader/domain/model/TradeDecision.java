package com.adaptivetrader.domain.model;

import com.adaptivetrader.domain.enums.DecisionReason;
import com.adaptivetrader.risk.RiskViolation;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one trade evaluation. Ephemeral: never persisted, safe to discard.
 *
 * <p>{@code sizeHint} is the notional the risk engine allowed (absent for gate
 * rejections). {@code position} is present only when the trade was approved and opened.
 */
@Getter
@Builder
public class TradeDecision {

    private final boolean approved;
    private final DecisionReason reason;
    private final String symbol;
    private final Pattern pattern;
    private final BigDecimal sizeHint;
    private final Position position;
    private final String message;

    @Builder.Default
    private final List<RiskViolation> violations = List.of();

    public Optional<BigDecimal> sizeHint() {
        return Optional.ofNullable(sizeHint);
    }

    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    public static TradeDecision rejected(String symbol, Pattern pattern, DecisionReason reason, String message) {
        return TradeDecision.builder()
                .approved(false)
                .symbol(symbol)
                .pattern(pattern)
                .reason(reason)
                .message(message)
                .build();
    }
}
