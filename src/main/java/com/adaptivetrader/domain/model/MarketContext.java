package com.adaptivetrader.domain.model;

import com.adaptivetrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market inputs for one trade evaluation, supplied by the signal/volatility collaborators.
 *
 * <p>{@code signalStrength} lies in [-1, 1]; its sign selects the side (zero or positive
 * is LONG). {@code volatility} and {@code atr} must be non-negative.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketContext {

    private BigDecimal price;
    private double signalStrength;
    private double volatility;
    private double atr;

    public PositionSide side() {
        return signalStrength < 0 ? PositionSide.SHORT : PositionSide.LONG;
    }
}
