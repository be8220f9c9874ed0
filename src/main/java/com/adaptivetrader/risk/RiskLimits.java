package com.adaptivetrader.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Risk limits and sizing constants for the risk engine.
 *
 * <p>Fractions are of account capital (0.02 = 2%). Loaded from application.properties
 * ({@code adaptivetrader.risk.*}) by {@link com.adaptivetrader.config.RiskConfig}.
 * The builder defaults match those properties so tests can override one field at a time.
 */
@Data
@Builder(toBuilder = true)
public class RiskLimits {

    // ==================== Sizing ====================

    /** Base position notional as a fraction of capital before multipliers. */
    @Builder.Default
    private double baseFraction = 0.01;

    /** Hard cap on a single position's notional as a fraction of capital. */
    @Builder.Default
    private double maxPositionSize = 0.02;

    /** Notional sizes are rounded down to this step. */
    @Builder.Default
    private BigDecimal sizeIncrement = new BigDecimal("0.00001");

    /** Asset quantities are rounded down to this step. */
    @Builder.Default
    private BigDecimal quantityIncrement = new BigDecimal("0.00001");

    /** Scale size by historical win rate (capped at 1.2x) once trade results exist. */
    @Builder.Default
    private boolean winRateScaling = false;

    // ==================== Account-Level Limits ====================

    /** Maximum total exposure across open positions as a fraction of capital. */
    @Builder.Default
    private double maxTotalRisk = 0.05;

    /** Maximum loss for the trading day as a fraction of capital. */
    @Builder.Default
    private double maxDailyDrawdown = 0.03;

    /** New positions are blocked while the risk score is above this. */
    @Builder.Default
    private double riskScoreCeiling = 80.0;

    /** Score above which exposure reduction is advised. */
    @Builder.Default
    private double reduceExposureScore = 70.0;

    @Builder.Default
    private int maxOpenPositions = 3;

    /** Minimum time between two orders. */
    @Builder.Default
    private Duration minOrderInterval = Duration.ofSeconds(60);

    // ==================== Risk Score ====================

    /** Weight of exposure utilization in the risk score. With drawdownWeight must sum to 100. */
    @Builder.Default
    private double exposureWeight = 40.0;

    @Builder.Default
    private double drawdownWeight = 60.0;

    // ==================== Performance Window ====================

    /** Number of most recent trade results used for win rate and profit factor. */
    @Builder.Default
    private int tradeWindow = 100;
}
