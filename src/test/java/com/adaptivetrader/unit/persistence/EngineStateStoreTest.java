package com.adaptivetrader.unit.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.adaptivetrader.domain.enums.PositionSide;
import com.adaptivetrader.domain.enums.PositionStatus;
import com.adaptivetrader.domain.enums.TradeResult;
import com.adaptivetrader.domain.model.Pattern;
import com.adaptivetrader.domain.model.PatternReportEntry;
import com.adaptivetrader.domain.model.PatternStats;
import com.adaptivetrader.domain.model.Position;
import com.adaptivetrader.exception.PersistenceException;
import com.adaptivetrader.persistence.EngineState;
import com.adaptivetrader.persistence.EngineStateStore;
import com.adaptivetrader.persistence.PersistenceConfig;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineStateStoreTest {

    private static final Pattern PATTERN = Pattern.of("MACD_POSITIVE", "RSI_OVERSOLD", "VOLUME_SPIKE");

    @TempDir
    Path tempDir;

    private PersistenceConfig config;
    private EngineStateStore store;

    @BeforeEach
    void setUp() {
        config = new PersistenceConfig();
        config.setFile(tempDir.resolve("state").resolve("engine-state.json"));
        store = new EngineStateStore(config);
    }

    @Test
    @DisplayName("Missing file loads as empty")
    void missingFile() {
        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("Saved patterns and positions load back intact")
    void saveAndLoad() {
        LocalDateTime now = LocalDateTime.of(2026, 3, 2, 10, 0);
        PatternStats stats = PatternStats.builder()
                .wins(3)
                .losses(2)
                .consecutiveLosses(1)
                .lastResult(TradeResult.LOSS)
                .recentOutcomes(new ArrayList<>(List.of(4.0, -2.0, 1.5)))
                .firstSeen(now.minusDays(2))
                .lastUpdated(now)
                .build();
        Position position = Position.builder()
                .id("p-1")
                .symbol("BTCUSDT")
                .side(PositionSide.LONG)
                .entryPrice(new BigDecimal("100"))
                .quantity(new BigDecimal("1.274"))
                .entryTime(now)
                .stopLoss(new BigDecimal("97.98"))
                .emergencyStop(new BigDecimal("96.97"))
                .takeProfit(new BigDecimal("104.04"))
                .trailingAnchor(new BigDecimal("100"))
                .lastPrice(new BigDecimal("101"))
                .pattern(PATTERN)
                .accountCapital(new BigDecimal("10000"))
                .status(PositionStatus.OPEN)
                .build();

        store.save(EngineState.builder()
                .savedAt(now)
                .patterns(List.of(PatternReportEntry.builder()
                        .pattern(PATTERN)
                        .stats(stats)
                        .winRate(0.6)
                        .build()))
                .positions(List.of(position))
                .build());

        EngineState loaded = store.load().orElseThrow();

        assertThat(loaded.getVersion()).isEqualTo(EngineState.CURRENT_VERSION);
        assertThat(loaded.getPatterns()).hasSize(1);
        PatternReportEntry entry = loaded.getPatterns().get(0);
        assertThat(entry.getPattern()).isEqualTo(PATTERN);
        assertThat(entry.getStats()).isEqualTo(stats);
        assertThat(loaded.getPositions()).hasSize(1);
        Position restored = loaded.getPositions().get(0);
        assertThat(restored.getPattern()).isEqualTo(PATTERN);
        assertThat(restored.getStopLoss()).isEqualByComparingTo("97.98");
        assertThat(restored.getEntryTime()).isEqualTo(now);
        assertThat(restored.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Corrupt file raises a persistence error")
    void corruptFile() throws IOException {
        Files.createDirectories(config.getFile().getParent());
        Files.writeString(config.getFile(), "{not json");

        assertThatThrownBy(() -> store.load()).isInstanceOf(PersistenceException.class);
    }
}
