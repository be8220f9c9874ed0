package com.adaptivetrader.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome tally of one signal label across every pattern it appeared in.
 *
 * <p>The weight is {@code 2 * winRate}, so it lies in [0, 2] with 1.0 meaning a coin flip.
 * A signal with no outcomes weighs {@link #NEUTRAL_WEIGHT}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SignalPerformance {

    public static final double NEUTRAL_WEIGHT = 1.0;

    private String signal;
    private int wins;
    private int total;

    public double getWeight() {
        return total == 0 ? NEUTRAL_WEIGHT : 2.0 * wins / total;
    }

    public SignalPerformance copy() {
        return toBuilder().build();
    }
}
