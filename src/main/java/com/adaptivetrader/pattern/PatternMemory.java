package com.adaptivetrader.pattern;

import com.adaptivetrader.domain.enums.TradeResult;
import com.adaptivetrader.domain.model.Pattern;
import com.adaptivetrader.domain.model.PatternReportEntry;
import com.adaptivetrader.domain.model.PatternStats;
import com.adaptivetrader.domain.model.SignalPerformance;
import com.adaptivetrader.domain.model.SignalScoreReport;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Remembers how each signal pattern has performed.
 *
 * <p>Stats live in a dense list (the arena) and an index maps each {@link Pattern} to
 * its slot, so recording an outcome for a known pattern mutates in place. Patterns are
 * created lazily on their first outcome and never evicted.
 *
 * <p>Each outcome is also credited to every signal of the pattern. A signal's weight is
 * {@code 2 * winRate}; the trade score of a pattern is the mean weight of its signals,
 * with unknown signals counted as neutral. Once more than
 * {@code scoreCalibrationObservations} signal observations exist, the minimum trade score
 * becomes {@code 1.5 + 0.5 * overallSignalWinRate}. Scores are advisory and never gate
 * a trade.
 *
 * <p>Outcome bookkeeping:
 * <ul>
 *   <li>profit &gt; 0 is a win, anything else (including break-even) a loss</li>
 *   <li>a win resets consecutive losses to 0</li>
 *   <li>a loss increments consecutive losses if the previous outcome was also a loss,
 *       otherwise sets it to 1</li>
 *   <li>the profit is appended to the recent outcomes, dropping the oldest at capacity</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> a single {@link ReentrantReadWriteLock} guards the arena, the
 * index and the signal table. Readers get copies, never live stats.
 */
@Service
public class PatternMemory {

    private static final Logger log = LoggerFactory.getLogger(PatternMemory.class);

    private static final double CALIBRATED_MIN_SCORE_BASE = 1.5;
    private static final double CALIBRATED_MIN_SCORE_SPAN = 0.5;

    private final PatternMemoryConfig patternMemoryConfig;
    private final Clock clock;

    private final List<PatternStats> arena = new ArrayList<>();
    private final Map<Pattern, Integer> index = new HashMap<>();
    private final Map<String, SignalPerformance> signals = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public PatternMemory(PatternMemoryConfig patternMemoryConfig, Clock clock) {
        this.patternMemoryConfig = patternMemoryConfig;
        this.clock = clock;
    }

    /**
     * Canonicalizes a signal set into its pattern key. Pure; does not touch memory.
     */
    public Pattern identify(Collection<String> signals) {
        return Pattern.of(signals);
    }

    /**
     * Records a realized outcome against a pattern, creating its stats if absent.
     */
    public void recordOutcome(Pattern pattern, double profit) {
        if (Double.isNaN(profit)) {
            log.warn("Ignoring NaN outcome for pattern {}", pattern);
            return;
        }
        lock.writeLock().lock();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            PatternStats stats = statsFor(pattern, now);
            boolean win = profit > 0;

            if (win) {
                stats.setWins(stats.getWins() + 1);
                stats.setConsecutiveLosses(0);
            } else {
                stats.setLosses(stats.getLosses() + 1);
                stats.setConsecutiveLosses(
                        stats.getLastResult() == TradeResult.LOSS ? stats.getConsecutiveLosses() + 1 : 1);
            }
            stats.setLastResult(win ? TradeResult.WIN : TradeResult.LOSS);

            List<Double> recent = stats.getRecentOutcomes();
            recent.add(profit);
            while (recent.size() > patternMemoryConfig.getRecentOutcomeCapacity()) {
                recent.remove(0);
            }
            stats.setLastUpdated(now);
            creditSignals(pattern, win ? 1 : 0, 1);

            log.debug(
                    "Pattern {} outcome {} -> wins={} losses={} streak={}",
                    pattern,
                    profit,
                    stats.getWins(),
                    stats.getLosses(),
                    stats.getConsecutiveLosses());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Returns a copy of the pattern's stats, or empty if it has never been recorded. */
    public Optional<PatternStats> stats(Pattern pattern) {
        lock.readLock().lock();
        try {
            Integer slot = index.get(pattern);
            return slot == null ? Optional.empty() : Optional.of(arena.get(slot).copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Win rate of a pattern. Empty when the pattern has no observations, which callers
     * must treat as "unknown" rather than 0%.
     */
    public OptionalDouble winRate(Pattern pattern) {
        return stats(pattern).map(PatternStats::getWinRate).orElse(OptionalDouble.empty());
    }

    /** All patterns with their stats, most observed first. */
    public List<PatternReportEntry> report() {
        lock.readLock().lock();
        try {
            List<PatternReportEntry> entries = new ArrayList<>(index.size());
            index.forEach((pattern, slot) -> {
                PatternStats stats = arena.get(slot).copy();
                OptionalDouble winRate = stats.getWinRate();
                entries.add(PatternReportEntry.builder()
                        .pattern(pattern)
                        .stats(stats)
                        .winRate(winRate.isPresent() ? winRate.getAsDouble() : null)
                        .tradeScore(tradeScoreLocked(pattern))
                        .build());
            });
            entries.sort(Comparator.comparingInt(
                            (PatternReportEntry e) -> e.getStats().getTotalObservations())
                    .reversed()
                    .thenComparing(PatternReportEntry::getPattern));
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole memory with previously persisted entries.
     */
    public void restore(List<PatternReportEntry> entries) {
        lock.writeLock().lock();
        try {
            arena.clear();
            index.clear();
            signals.clear();
            for (PatternReportEntry entry : entries) {
                if (entry.getPattern() == null || entry.getStats() == null) {
                    continue;
                }
                PatternStats stats = entry.getStats().copy();
                List<Double> recent = stats.getRecentOutcomes();
                while (recent.size() > patternMemoryConfig.getRecentOutcomeCapacity()) {
                    recent.remove(0);
                }
                index.put(entry.getPattern(), arena.size());
                arena.add(stats);
                creditSignals(entry.getPattern(), stats.getWins(), stats.getTotalObservations());
            }
            log.info("Pattern memory restored with {} patterns", arena.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Mean weight of the pattern's signals. Signals never seen count as neutral; an empty
     * pattern scores 0.
     */
    public double tradeScore(Pattern pattern) {
        lock.readLock().lock();
        try {
            return tradeScoreLocked(pattern);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Weights of every signal seen so far, strongest first, plus the current minimum score. */
    public SignalScoreReport signalReport() {
        lock.readLock().lock();
        try {
            List<SignalPerformance> entries = new ArrayList<>(signals.size());
            int totalWins = 0;
            int totalObservations = 0;
            for (SignalPerformance performance : signals.values()) {
                entries.add(performance.copy());
                totalWins += performance.getWins();
                totalObservations += performance.getTotal();
            }
            entries.sort(Comparator.comparingDouble(SignalPerformance::getWeight)
                    .reversed()
                    .thenComparing(SignalPerformance::getSignal));

            boolean calibrated = totalObservations > patternMemoryConfig.getScoreCalibrationObservations();
            double minTradeScore = calibrated
                    ? CALIBRATED_MIN_SCORE_BASE + CALIBRATED_MIN_SCORE_SPAN * totalWins / totalObservations
                    : patternMemoryConfig.getDefaultMinTradeScore();
            return SignalScoreReport.builder()
                    .minTradeScore(minTradeScore)
                    .calibrated(calibrated)
                    .signals(entries)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return arena.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock.
    private void creditSignals(Pattern pattern, int wins, int total) {
        for (String signal : pattern.getSignals()) {
            SignalPerformance performance = signals.computeIfAbsent(
                    signal, s -> SignalPerformance.builder().signal(s).build());
            performance.setWins(performance.getWins() + wins);
            performance.setTotal(performance.getTotal() + total);
        }
    }

    // Caller holds a lock.
    private double tradeScoreLocked(Pattern pattern) {
        if (pattern.size() == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (String signal : pattern.getSignals()) {
            SignalPerformance performance = signals.get(signal);
            sum += performance != null ? performance.getWeight() : SignalPerformance.NEUTRAL_WEIGHT;
        }
        return sum / pattern.size();
    }

    // Caller holds the write lock.
    private PatternStats statsFor(Pattern pattern, LocalDateTime now) {
        Integer slot = index.get(pattern);
        if (slot != null) {
            return arena.get(slot);
        }
        PatternStats stats = PatternStats.builder().firstSeen(now).lastUpdated(now).build();
        index.put(pattern, arena.size());
        arena.add(stats);
        log.info("New pattern registered: {}", pattern);
        return stats;
    }
}
