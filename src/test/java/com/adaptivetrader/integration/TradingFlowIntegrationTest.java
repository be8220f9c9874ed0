package com.adaptivetrader.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.adaptivetrader.core.engine.TradingEngine;
import com.adaptivetrader.domain.enums.DecisionReason;
import com.adaptivetrader.domain.enums.ExitReason;
import com.adaptivetrader.domain.model.MarketContext;
import com.adaptivetrader.domain.model.Pattern;
import com.adaptivetrader.domain.model.PortfolioSummary;
import com.adaptivetrader.domain.model.RiskMetrics;
import com.adaptivetrader.domain.model.TradeDecision;
import com.adaptivetrader.domain.model.TradeRecord;
import com.adaptivetrader.gate.TradeGate;
import com.adaptivetrader.gate.TradeGateConfig;
import com.adaptivetrader.ledger.PositionLedger;
import com.adaptivetrader.pattern.PatternMemory;
import com.adaptivetrader.pattern.PatternMemoryConfig;
import com.adaptivetrader.persistence.EngineStatePersistenceService;
import com.adaptivetrader.persistence.EngineStateStore;
import com.adaptivetrader.persistence.PersistenceConfig;
import com.adaptivetrader.risk.RiskEngine;
import com.adaptivetrader.risk.RiskLimits;
import com.adaptivetrader.support.MutableClock;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Cross-service flow: evaluate -> open -> tick -> exit -> pattern learning -> risk metrics,
 * then persist and restore into a fresh engine.
 */
@ExtendWith(MockitoExtension.class)
class TradingFlowIntegrationTest {

    private static final List<String> SIGNALS = List.of("RSI_OVERSOLD", "MACD_POSITIVE", "VOLUME_SPIKE");
    private static final BigDecimal CAPITAL = new BigDecimal("10000");

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private Engine engine;

    /** One fully wired engine instance. */
    private final class Engine {
        final PatternMemory patternMemory;
        final RiskEngine riskEngine;
        final PositionLedger positionLedger;
        final TradingEngine tradingEngine;
        final EngineStatePersistenceService persistence;

        Engine() {
            patternMemory = new PatternMemory(new PatternMemoryConfig(), clock);
            riskEngine = new RiskEngine(RiskLimits.builder().build(), clock, applicationEventPublisher);
            positionLedger = new PositionLedger(patternMemory, riskEngine, applicationEventPublisher, clock);
            tradingEngine = new TradingEngine(
                    new TradeGate(patternMemory, new TradeGateConfig()),
                    patternMemory,
                    riskEngine,
                    positionLedger,
                    applicationEventPublisher);
            PersistenceConfig persistenceConfig = new PersistenceConfig();
            persistenceConfig.setEnabled(true);
            persistenceConfig.setFile(tempDir.resolve("engine-state.json"));
            persistence = new EngineStatePersistenceService(
                    persistenceConfig, new EngineStateStore(persistenceConfig), tradingEngine, clock);
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        engine = new Engine();
    }

    private static MarketContext context(String price) {
        return MarketContext.builder()
                .price(new BigDecimal(price))
                .signalStrength(0.8)
                .volatility(0.01)
                .atr(1.0)
                .build();
    }

    @Test
    @DisplayName("Winning trade feeds pattern memory and realized P&L")
    void winningTradeLifecycle() {
        TradeDecision decision = engine.tradingEngine.evaluateTrade("BTCUSDT", SIGNALS, CAPITAL, context("100"));
        assertThat(decision.isApproved()).isTrue();

        assertThat(engine.tradingEngine.onPriceTick("BTCUSDT", new BigDecimal("102"))).isEmpty();
        PortfolioSummary midway = engine.tradingEngine.portfolioSummary();
        assertThat(midway.getOpenCount()).isEqualTo(1);
        assertThat(midway.getTotalUnrealizedPnl()).isPositive();

        List<TradeRecord> closed = engine.tradingEngine.onPriceTick("BTCUSDT", new BigDecimal("104.1"));

        assertThat(closed).singleElement().satisfies(record -> {
            assertThat(record.getExitReason()).isEqualTo(ExitReason.TAKE_PROFIT);
            assertThat(record.isWin()).isTrue();
        });
        assertThat(engine.patternMemory.stats(Pattern.of(SIGNALS)).orElseThrow().getWins()).isEqualTo(1);

        PortfolioSummary after = engine.tradingEngine.portfolioSummary();
        assertThat(after.getOpenCount()).isZero();
        assertThat(after.getTotalRealizedPnl()).isPositive();

        RiskMetrics metrics = engine.tradingEngine.riskMetrics();
        assertThat(metrics.getCurrentExposure()).isZero();
        assertThat(metrics.getWinRate()).isEqualTo(1.0);
        assertThat(metrics.getDailyDrawdown()).isZero();
    }

    @Test
    @DisplayName("Pattern that keeps losing is learned and then refused")
    void losingPatternIsLearned() {
        for (int i = 0; i < 3; i++) {
            TradeDecision decision = engine.tradingEngine.evaluateTrade("BTCUSDT", SIGNALS, CAPITAL, context("100"));
            assertThat(decision.isApproved()).as("trade %d", i).isTrue();
            engine.tradingEngine.onPriceTick("BTCUSDT", new BigDecimal("97.5"));
            clock.advance(Duration.ofMinutes(5));
        }

        TradeDecision refused = engine.tradingEngine.evaluateTrade("BTCUSDT", SIGNALS, CAPITAL, context("100"));

        assertThat(refused.isApproved()).isFalse();
        assertThat(refused.getReason()).isEqualTo(DecisionReason.LOW_WIN_RATE);
        assertThat(engine.tradingEngine.patternReport().get(0).getWinRate()).isZero();
    }

    @Test
    @DisplayName("Patterns and open positions survive a restart")
    void stateSurvivesRestart() {
        engine.tradingEngine.evaluateTrade("BTCUSDT", SIGNALS, CAPITAL, context("100"));
        engine.tradingEngine.onPriceTick("BTCUSDT", new BigDecimal("97"));
        clock.advance(Duration.ofMinutes(5));
        engine.tradingEngine.evaluateTrade("ETHUSDT", SIGNALS, CAPITAL, context("2000"));
        engine.persistence.saveOnShutdown();

        Engine restarted = new Engine();
        restarted.persistence.restoreOnStartup();

        assertThat(restarted.patternMemory.stats(Pattern.of(SIGNALS)).orElseThrow().getLosses()).isEqualTo(1);
        assertThat(restarted.positionLedger.openPositions())
                .extracting(p -> p.getSymbol())
                .containsExactly("ETHUSDT");
        assertThat(restarted.riskEngine.getMetrics().getOpenPositions()).isEqualTo(1);

        List<TradeRecord> closed = restarted.tradingEngine.onPriceTick("ETHUSDT", new BigDecimal("1900"));
        assertThat(closed).singleElement().extracting(TradeRecord::getExitReason).isEqualTo(ExitReason.EMERGENCY_STOP);
    }

    @Test
    @DisplayName("Signal label containing '+' keeps its learned stats across a restart")
    void plusInSignalLabelSurvivesRestart() {
        List<String> signals = List.of("EMA_9+21_CROSS", "RSI_OVERSOLD", "VOLUME_SPIKE");
        engine.tradingEngine.evaluateTrade("BTCUSDT", signals, CAPITAL, context("100"));
        engine.tradingEngine.onPriceTick("BTCUSDT", new BigDecimal("97"));
        engine.persistence.saveOnShutdown();

        Engine restarted = new Engine();
        restarted.persistence.restoreOnStartup();

        Pattern pattern = Pattern.of(signals);
        assertThat(restarted.patternMemory.report())
                .singleElement()
                .satisfies(entry -> assertThat(entry.getPattern().getSignals())
                        .containsExactly("EMA_9+21_CROSS", "RSI_OVERSOLD", "VOLUME_SPIKE"));
        assertThat(restarted.patternMemory.stats(pattern).orElseThrow().getLosses()).isEqualTo(1);
    }
}
