package com.adaptivetrader.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Canonical, order-independent key for a set of co-occurring signals.
 *
 * <p>Signals are trimmed, upper-cased, de-duplicated and sorted on construction,
 * so {@code [RSI_OVERSOLD, MACD_POSITIVE]} and {@code [macd_positive, RSI_OVERSOLD,
 * RSI_OVERSOLD]} produce equal patterns with the same {@link #key()}.
 *
 * <p>Serialized to JSON as its sorted signal array. The '+'-joined {@link #key()} is a
 * display form only; labels may themselves contain '+', so it is never parsed back.
 */
public final class Pattern implements Comparable<Pattern> {

    private static final String SEPARATOR = "+";

    private final List<String> signals;
    private final String key;

    private Pattern(List<String> signals) {
        this.signals = signals;
        this.key = String.join(SEPARATOR, signals);
    }

    /**
     * Builds the canonical pattern for a signal collection. Null and blank labels are dropped.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Pattern of(Collection<String> signals) {
        TreeSet<String> canonical = new TreeSet<>();
        if (signals != null) {
            for (String signal : signals) {
                String normalized = normalize(signal);
                if (normalized != null) {
                    canonical.add(normalized);
                }
            }
        }
        return new Pattern(List.copyOf(canonical));
    }

    public static Pattern of(String... signals) {
        return of(Arrays.asList(signals));
    }

    /** Normalized form of a single signal label, or null when blank. */
    public static String normalize(String signal) {
        if (signal == null || signal.isBlank()) {
            return null;
        }
        return signal.trim().toUpperCase(Locale.ROOT);
    }

    @JsonValue
    public List<String> getSignals() {
        return signals;
    }

    public int size() {
        return signals.size();
    }

    public String key() {
        return key;
    }

    @Override
    public int compareTo(Pattern other) {
        return key.compareTo(other.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Pattern)) {
            return false;
        }
        return signals.equals(((Pattern) o).signals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signals);
    }

    @Override
    public String toString() {
        return key;
    }
}
