package com.adaptivetrader.domain.model;

import com.adaptivetrader.domain.enums.PositionSide;
import com.adaptivetrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position held by the {@link com.adaptivetrader.ledger.PositionLedger}.
 *
 * <p>Quantity is always positive; direction comes from {@link #side}. The pattern
 * observed at entry travels with the position so the realized outcome can be fed
 * back into pattern memory on close. {@code accountCapital} is the capital the
 * position was sized against and is the denominator for exposure.
 *
 * <p>Instances returned outside the ledger are copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private PositionSide side;
    private BigDecimal entryPrice;
    private BigDecimal quantity;
    private LocalDateTime entryTime;

    private BigDecimal stopLoss;
    private BigDecimal emergencyStop;
    private BigDecimal takeProfit;

    /** Null when trailing is disabled for this position. */
    private BigDecimal trailingStep;

    /** Price at which the last trailing ratchet happened (entry price initially). */
    private BigDecimal trailingAnchor;

    private BigDecimal lastPrice;
    private BigDecimal unrealizedPnl;

    private Pattern pattern;
    private BigDecimal accountCapital;

    private PositionStatus status;
    private LocalDateTime lastUpdated;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /** Notional at the given price (quantity * price). */
    public BigDecimal notionalAt(BigDecimal price) {
        return quantity.multiply(price);
    }

    /** Signed P&L if the position were closed at the given price. */
    public BigDecimal pnlAt(BigDecimal price) {
        return price.subtract(entryPrice).multiply(quantity).multiply(BigDecimal.valueOf(side.sign()));
    }

    public Position copy() {
        return toBuilder().build();
    }
}
