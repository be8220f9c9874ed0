package com.adaptivetrader.unit.pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.adaptivetrader.domain.enums.TradeResult;
import com.adaptivetrader.domain.model.Pattern;
import com.adaptivetrader.domain.model.PatternReportEntry;
import com.adaptivetrader.domain.model.PatternStats;
import com.adaptivetrader.domain.model.SignalPerformance;
import com.adaptivetrader.domain.model.SignalScoreReport;
import com.adaptivetrader.pattern.PatternMemory;
import com.adaptivetrader.pattern.PatternMemoryConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PatternMemory covering outcome recording, loss streaks, the recent
 * outcome window, reporting and restore.
 */
class PatternMemoryTest {

    private static final Pattern PATTERN = Pattern.of("MACD_POSITIVE", "RSI_OVERSOLD", "VOLUME_SPIKE");

    private PatternMemory patternMemory;

    @BeforeEach
    void setUp() {
        PatternMemoryConfig config = new PatternMemoryConfig();
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
        patternMemory = new PatternMemory(config, clock);
    }

    @Nested
    @DisplayName("Recording outcomes")
    class RecordOutcome {

        @Test
        @DisplayName("Unknown pattern has no stats and no win rate")
        void unknownPattern() {
            assertThat(patternMemory.stats(PATTERN)).isEmpty();
            assertThat(patternMemory.winRate(PATTERN)).isEmpty();
        }

        @Test
        @DisplayName("Wins and losses are counted and win rate follows")
        void countsWinsAndLosses() {
            patternMemory.recordOutcome(PATTERN, 12.5);
            patternMemory.recordOutcome(PATTERN, -3.0);
            patternMemory.recordOutcome(PATTERN, 4.0);

            PatternStats stats = patternMemory.stats(PATTERN).orElseThrow();
            assertThat(stats.getWins()).isEqualTo(2);
            assertThat(stats.getLosses()).isEqualTo(1);
            assertThat(stats.getTotalObservations()).isEqualTo(3);
            assertThat(patternMemory.winRate(PATTERN).getAsDouble()).isEqualTo(2.0 / 3.0);
            assertThat(stats.getLastResult()).isEqualTo(TradeResult.WIN);
        }

        @Test
        @DisplayName("Zero profit counts as a loss")
        void breakEvenIsLoss() {
            patternMemory.recordOutcome(PATTERN, 0.0);

            PatternStats stats = patternMemory.stats(PATTERN).orElseThrow();
            assertThat(stats.getLosses()).isEqualTo(1);
            assertThat(stats.getWins()).isZero();
        }

        @Test
        @DisplayName("Consecutive losses grow only on back-to-back losses and reset on a win")
        void consecutiveLossStreak() {
            patternMemory.recordOutcome(PATTERN, -1.0);
            patternMemory.recordOutcome(PATTERN, -1.0);
            assertThat(patternMemory.stats(PATTERN).orElseThrow().getConsecutiveLosses()).isEqualTo(2);

            patternMemory.recordOutcome(PATTERN, 5.0);
            assertThat(patternMemory.stats(PATTERN).orElseThrow().getConsecutiveLosses()).isZero();

            patternMemory.recordOutcome(PATTERN, -1.0);
            assertThat(patternMemory.stats(PATTERN).orElseThrow().getConsecutiveLosses()).isEqualTo(1);
        }

        @Test
        @DisplayName("Recent outcomes keep only the last five, oldest first")
        void recentOutcomesCapped() {
            for (int i = 1; i <= 7; i++) {
                patternMemory.recordOutcome(PATTERN, i);
            }

            assertThat(patternMemory.stats(PATTERN).orElseThrow().getRecentOutcomes())
                    .containsExactly(3.0, 4.0, 5.0, 6.0, 7.0);
        }

        @Test
        @DisplayName("NaN outcome is ignored")
        void nanIgnored() {
            patternMemory.recordOutcome(PATTERN, Double.NaN);

            assertThat(patternMemory.stats(PATTERN)).isEmpty();
        }

        @Test
        @DisplayName("Stats handed out are copies")
        void statsAreCopies() {
            patternMemory.recordOutcome(PATTERN, 1.0);

            patternMemory.stats(PATTERN).orElseThrow().setWins(99);

            assertThat(patternMemory.stats(PATTERN).orElseThrow().getWins()).isEqualTo(1);
        }

        @Test
        @DisplayName("Concurrent recording loses no outcomes")
        void concurrentRecording() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            for (int i = 0; i < 400; i++) {
                double profit = i % 2 == 0 ? 1.0 : -1.0;
                executor.submit(() -> patternMemory.recordOutcome(PATTERN, profit));
            }
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            PatternStats stats = patternMemory.stats(PATTERN).orElseThrow();
            assertThat(stats.getTotalObservations()).isEqualTo(400);
            assertThat(stats.getWins()).isEqualTo(200);
        }
    }

    @Nested
    @DisplayName("Report and restore")
    class ReportAndRestore {

        @Test
        @DisplayName("Report lists most observed patterns first")
        void reportOrdering() {
            Pattern other = Pattern.of("A", "B", "C");
            patternMemory.recordOutcome(other, 1.0);
            patternMemory.recordOutcome(PATTERN, 1.0);
            patternMemory.recordOutcome(PATTERN, -1.0);

            List<PatternReportEntry> report = patternMemory.report();

            assertThat(report).extracting(PatternReportEntry::getPattern).containsExactly(PATTERN, other);
            assertThat(report.get(0).getWinRate()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Restore replaces memory with the given entries")
        void restoreReplaces() {
            patternMemory.recordOutcome(Pattern.of("X", "Y", "Z"), 1.0);
            PatternStats stats = PatternStats.builder()
                    .wins(3)
                    .losses(1)
                    .recentOutcomes(new ArrayList<>(List.of(1.0, 2.0, -1.0, 3.0)))
                    .lastResult(TradeResult.WIN)
                    .build();

            patternMemory.restore(List.of(PatternReportEntry.builder()
                    .pattern(PATTERN)
                    .stats(stats)
                    .winRate(0.75)
                    .build()));

            assertThat(patternMemory.size()).isEqualTo(1);
            assertThat(patternMemory.winRate(PATTERN).getAsDouble()).isEqualTo(0.75);
        }
    }

    @Nested
    @DisplayName("Signal weights")
    class SignalWeights {

        @Test
        @DisplayName("Each signal is weighted by twice its win rate across all patterns")
        void weightsAcrossPatterns() {
            patternMemory.recordOutcome(Pattern.of("A", "B", "C"), 5.0);
            patternMemory.recordOutcome(Pattern.of("A", "B", "D"), -5.0);

            SignalScoreReport report = patternMemory.signalReport();

            assertThat(report.getSignals())
                    .extracting(SignalPerformance::getSignal)
                    .containsExactly("C", "A", "B", "D");
            assertThat(report.getSignals())
                    .extracting(SignalPerformance::getWeight)
                    .containsExactly(2.0, 1.0, 1.0, 0.0);
        }

        @Test
        @DisplayName("Trade score averages signal weights, unknown signals counting as neutral")
        void tradeScore() {
            patternMemory.recordOutcome(Pattern.of("A", "B", "C"), 5.0);
            patternMemory.recordOutcome(Pattern.of("A", "B", "D"), -5.0);

            assertThat(patternMemory.tradeScore(Pattern.of("A", "C", "D"))).isCloseTo(1.0, within(1e-12));
            assertThat(patternMemory.tradeScore(Pattern.of("C", "E", "F"))).isCloseTo(4.0 / 3.0, within(1e-12));
            assertThat(patternMemory.tradeScore(Pattern.of())).isZero();
            assertThat(patternMemory.report())
                    .filteredOn(e -> e.getPattern().equals(Pattern.of("A", "B", "C")))
                    .singleElement()
                    .satisfies(e -> assertThat(e.getTradeScore()).isCloseTo(4.0 / 3.0, within(1e-12)));
        }

        @Test
        @DisplayName("Minimum trade score follows the overall win rate once calibrated")
        void minTradeScoreCalibration() {
            for (int i = 0; i < 12; i++) {
                patternMemory.recordOutcome(PATTERN, 1.0);
            }
            for (int i = 0; i < 4; i++) {
                patternMemory.recordOutcome(PATTERN, -1.0);
            }
            SignalScoreReport before = patternMemory.signalReport();
            assertThat(before.isCalibrated()).isFalse();
            assertThat(before.getMinTradeScore()).isEqualTo(1.0);

            patternMemory.recordOutcome(PATTERN, -1.0);

            SignalScoreReport after = patternMemory.signalReport();
            assertThat(after.isCalibrated()).isTrue();
            assertThat(after.getMinTradeScore()).isCloseTo(1.5 + 0.5 * 36.0 / 51.0, within(1e-12));
        }

        @Test
        @DisplayName("Restore rebuilds signal weights from the pattern table")
        void restoreRebuildsWeights() {
            patternMemory.recordOutcome(Pattern.of("X", "Y", "Z"), -1.0);

            patternMemory.restore(List.of(
                    PatternReportEntry.builder()
                            .pattern(Pattern.of("A", "B", "C"))
                            .stats(PatternStats.builder().wins(3).losses(1).build())
                            .build(),
                    PatternReportEntry.builder()
                            .pattern(Pattern.of("A", "D", "E"))
                            .stats(PatternStats.builder().wins(0).losses(4).build())
                            .build()));

            SignalScoreReport report = patternMemory.signalReport();
            assertThat(report.getSignals()).extracting(SignalPerformance::getSignal).doesNotContain("X");
            assertThat(report.getSignals())
                    .filteredOn(p -> p.getSignal().equals("A"))
                    .singleElement()
                    .satisfies(p -> {
                        assertThat(p.getWins()).isEqualTo(3);
                        assertThat(p.getTotal()).isEqualTo(8);
                        assertThat(p.getWeight()).isCloseTo(0.75, within(1e-12));
                    });
        }
    }
}
