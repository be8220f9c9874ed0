package com.adaptivetrader.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Per-signal weights together with the current minimum trade score.
 *
 * <p>{@code calibrated} is false until enough signal observations exist to derive the
 * minimum from the overall win rate; until then the configured default applies.
 */
@Value
@Builder
public class SignalScoreReport {

    double minTradeScore;
    boolean calibrated;
    List<SignalPerformance> signals;
}
