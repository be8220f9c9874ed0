package com.adaptivetrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the risk engine's aggregate state.
 *
 * <p>{@code currentExposure} and {@code dailyDrawdown} are fractions of capital;
 * {@code dailyDrawdown} is the magnitude of today's loss (0 when flat or up).
 * {@code riskScore} lies in [0, 100].
 *
 * <p>{@code maxDrawdown} is the deepest peak-to-trough fall of the realized equity curve
 * since startup, as a fraction of the equity at the peak; {@code maxDrawdownAmount} is the
 * same fall in quote currency. Neither resets at the trading-day boundary.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskMetrics {

    private double currentExposure;
    private double dailyDrawdown;
    private double riskScore;
    private double winRate;
    private double profitFactor;
    private double averageWinLossRatio;
    private double maxDrawdown;
    private BigDecimal maxDrawdownAmount;
    private int openPositions;
    private BigDecimal dailyRealizedPnl;
    private BigDecimal unrealizedPnl;
    private LocalDate tradingDay;
    private LocalDateTime updatedAt;

    public static RiskMetrics empty(LocalDate tradingDay, LocalDateTime now) {
        return RiskMetrics.builder()
                .dailyRealizedPnl(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .maxDrawdownAmount(BigDecimal.ZERO)
                .tradingDay(tradingDay)
                .updatedAt(now)
                .build();
    }
}
