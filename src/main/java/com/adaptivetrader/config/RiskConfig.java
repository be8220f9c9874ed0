package com.adaptivetrader.config;

import com.adaptivetrader.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.properties.
 *
 * <p>Properties prefix: {@code adaptivetrader.risk.*}. The risk score weights must sum
 * to 100; startup fails otherwise.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${adaptivetrader.risk.base-fraction:0.01}") double baseFraction,
            @Value("${adaptivetrader.risk.max-position-size:0.02}") double maxPositionSize,
            @Value("${adaptivetrader.risk.size-increment:0.00001}") BigDecimal sizeIncrement,
            @Value("${adaptivetrader.risk.quantity-increment:0.00001}") BigDecimal quantityIncrement,
            @Value("${adaptivetrader.risk.win-rate-scaling:false}") boolean winRateScaling,
            @Value("${adaptivetrader.risk.max-total-risk:0.05}") double maxTotalRisk,
            @Value("${adaptivetrader.risk.max-daily-drawdown:0.03}") double maxDailyDrawdown,
            @Value("${adaptivetrader.risk.risk-score-ceiling:80}") double riskScoreCeiling,
            @Value("${adaptivetrader.risk.reduce-exposure-score:70}") double reduceExposureScore,
            @Value("${adaptivetrader.risk.max-open-positions:3}") int maxOpenPositions,
            @Value("${adaptivetrader.risk.min-order-interval:60s}") Duration minOrderInterval,
            @Value("${adaptivetrader.risk.exposure-weight:40}") double exposureWeight,
            @Value("${adaptivetrader.risk.drawdown-weight:60}") double drawdownWeight,
            @Value("${adaptivetrader.risk.trade-window:100}") int tradeWindow) {
        if (Math.abs(exposureWeight + drawdownWeight - 100.0) > 1e-9) {
            throw new IllegalStateException("adaptivetrader.risk exposure-weight + drawdown-weight must equal 100, got "
                    + (exposureWeight + drawdownWeight));
        }
        return RiskLimits.builder()
                .baseFraction(baseFraction)
                .maxPositionSize(maxPositionSize)
                .sizeIncrement(sizeIncrement)
                .quantityIncrement(quantityIncrement)
                .winRateScaling(winRateScaling)
                .maxTotalRisk(maxTotalRisk)
                .maxDailyDrawdown(maxDailyDrawdown)
                .riskScoreCeiling(riskScoreCeiling)
                .reduceExposureScore(reduceExposureScore)
                .maxOpenPositions(maxOpenPositions)
                .minOrderInterval(minOrderInterval)
                .exposureWeight(exposureWeight)
                .drawdownWeight(drawdownWeight)
                .tradeWindow(tradeWindow)
                .build();
    }
}
