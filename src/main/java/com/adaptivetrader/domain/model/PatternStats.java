package com.adaptivetrader.domain.model;

import com.adaptivetrader.domain.enums.TradeResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Win/loss history of one {@link Pattern}.
 *
 * <p>Owned by {@link com.adaptivetrader.pattern.PatternMemory}; instances handed
 * out to callers are defensive copies. {@code wins + losses} always equals the
 * number of outcomes recorded, and {@code recentOutcomes} holds at most the
 * configured capacity of realized P&L values, oldest first.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PatternStats {

    private int wins;
    private int losses;
    private int consecutiveLosses;

    @Builder.Default
    private TradeResult lastResult = TradeResult.UNKNOWN;

    /** Most recent realized P&L values, oldest first. */
    @Builder.Default
    private List<Double> recentOutcomes = new ArrayList<>();

    private LocalDateTime firstSeen;
    private LocalDateTime lastUpdated;

    @JsonIgnore
    public int getTotalObservations() {
        return wins + losses;
    }

    /** Empty when no outcome has been recorded yet, which is not the same as a 0% win rate. */
    @JsonIgnore
    public OptionalDouble getWinRate() {
        int total = getTotalObservations();
        if (total == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) wins / total);
    }

    public PatternStats copy() {
        return toBuilder()
                .lastResult(lastResult != null ? lastResult : TradeResult.UNKNOWN)
                .recentOutcomes(recentOutcomes != null ? new ArrayList<>(recentOutcomes) : new ArrayList<>())
                .build();
    }
}
