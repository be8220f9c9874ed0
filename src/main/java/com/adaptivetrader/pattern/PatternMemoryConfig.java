package com.adaptivetrader.pattern;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Pattern memory settings. Properties prefix: {@code adaptivetrader.pattern.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "adaptivetrader.pattern")
public class PatternMemoryConfig {

    /** How many recent realized outcomes are kept per pattern (FIFO). */
    private int recentOutcomeCapacity = 5;

    /** Signal observations needed before the minimum trade score follows the overall win rate. */
    private int scoreCalibrationObservations = 50;

    /** Minimum trade score used until calibration kicks in. */
    private double defaultMinTradeScore = 1.0;
}
