package com.adaptivetrader.gate;

import com.adaptivetrader.domain.enums.UnseenPatternPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Trade gate thresholds, loaded from {@code adaptivetrader.gate.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>minSignals: 3 -- fewer distinct signals never trade</li>
 *   <li>minSampleSize: 3 -- outcomes needed before win rate / streak checks apply</li>
 *   <li>minWinRate: 0.5</li>
 *   <li>maxConsecutiveLosses: 2</li>
 *   <li>unseenPatternPolicy: EXPLORE</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "adaptivetrader.gate")
public class TradeGateConfig {

    private int minSignals = 3;
    private int minSampleSize = 3;
    private double minWinRate = 0.5;
    private int maxConsecutiveLosses = 2;
    private UnseenPatternPolicy unseenPatternPolicy = UnseenPatternPolicy.EXPLORE;
}
