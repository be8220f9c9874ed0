package com.adaptivetrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exit price levels attached to a position at entry.
 *
 * <p>Take-profit sits twice as far from entry as the stop loss; the emergency stop
 * sits 1.5x as far. The trailing step (null when trailing is off) is the price move
 * that ratchets the stops one notch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProtectiveLevels {

    private BigDecimal stopLoss;
    private BigDecimal emergencyStop;
    private BigDecimal takeProfit;
    private BigDecimal trailingStep;
}
