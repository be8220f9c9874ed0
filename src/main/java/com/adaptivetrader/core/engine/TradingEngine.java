package com.adaptivetrader.core.engine;

import com.adaptivetrader.domain.enums.DecisionReason;
import com.adaptivetrader.domain.enums.ExitReason;
import com.adaptivetrader.domain.enums.PositionSide;
import com.adaptivetrader.domain.model.MarketContext;
import com.adaptivetrader.domain.model.PatternReportEntry;
import com.adaptivetrader.domain.model.PortfolioSummary;
import com.adaptivetrader.domain.model.Position;
import com.adaptivetrader.domain.model.ProtectiveLevels;
import com.adaptivetrader.domain.model.RiskMetrics;
import com.adaptivetrader.domain.model.TradeDecision;
import com.adaptivetrader.domain.model.TradeRecord;
import com.adaptivetrader.event.TradeDecisionEvent;
import com.adaptivetrader.exception.BusinessException;
import com.adaptivetrader.exception.ErrorCode;
import com.adaptivetrader.gate.GateResult;
import com.adaptivetrader.gate.TradeGate;
import com.adaptivetrader.ledger.PositionLedger;
import com.adaptivetrader.pattern.PatternMemory;
import com.adaptivetrader.persistence.EngineState;
import com.adaptivetrader.risk.RiskEngine;
import com.adaptivetrader.risk.RiskValidationResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point that turns a signal set into a trade decision and, when approved, an open position.
 *
 * <p>Evaluation pipeline, stopping at the first rejection:
 * <ol>
 *   <li>Input validation (INVALID_INPUT)</li>
 *   <li>{@link TradeGate}: signal count and pattern history</li>
 *   <li>{@link RiskEngine#sizePosition}: zero size is INSUFFICIENT_SIZE</li>
 *   <li>One open position per symbol (POSITION_ALREADY_OPEN)</li>
 *   <li>{@link RiskEngine#validateNewPosition} (RISK_LIMIT_EXCEEDED)</li>
 *   <li>Protective levels, quantity, and an immediate paper fill at the reference price</li>
 * </ol>
 *
 * <p>Every evaluation publishes a {@link TradeDecisionEvent}. Rejections are returned
 * as values, never thrown.
 *
 * <p>{@link #evaluateTrade}, {@link #onPriceTick}, {@link #closePosition} and the state
 * capture used for persistence are serialized through one lock so a tick never interleaves
 * with a half-finished entry. Read-only queries bypass it.
 */
@Service
public class TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final TradeGate tradeGate;
    private final PatternMemory patternMemory;
    private final RiskEngine riskEngine;
    private final PositionLedger positionLedger;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final ReentrantLock engineLock = new ReentrantLock();

    public TradingEngine(
            TradeGate tradeGate,
            PatternMemory patternMemory,
            RiskEngine riskEngine,
            PositionLedger positionLedger,
            ApplicationEventPublisher applicationEventPublisher) {
        this.tradeGate = tradeGate;
        this.patternMemory = patternMemory;
        this.riskEngine = riskEngine;
        this.positionLedger = positionLedger;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Evaluates a signal set for {@code symbol} and opens a position if every check passes.
     *
     * @param signals active signal names; order and case do not matter
     * @param capital current account capital
     * @param context reference price, signal strength, volatility and ATR
     */
    public TradeDecision evaluateTrade(
            String symbol, Collection<String> signals, BigDecimal capital, MarketContext context) {
        engineLock.lock();
        try {
            return publish(doEvaluate(symbol, signals, capital, context));
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Feeds a price update to the ledger.
     *
     * @return trade records for positions closed by this tick
     */
    public List<TradeRecord> onPriceTick(String symbol, BigDecimal price) {
        engineLock.lock();
        try {
            return positionLedger.onPriceTick(symbol, price);
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Manually closes the open position on {@code symbol}.
     */
    public Optional<TradeRecord> closePosition(String symbol, BigDecimal exitPrice) {
        engineLock.lock();
        try {
            return positionLedger.close(symbol, exitPrice, ExitReason.MANUAL);
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Captures pattern memory and open positions as one consistent state. Holding the engine
     * lock means no close is halfway between leaving the book and reaching pattern memory.
     */
    public EngineState captureState(LocalDateTime savedAt) {
        engineLock.lock();
        try {
            return EngineState.builder()
                    .savedAt(savedAt)
                    .patterns(patternMemory.report())
                    .positions(positionLedger.openPositions())
                    .build();
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Replaces pattern memory and the open book with a previously captured state.
     */
    public void restoreState(EngineState state) {
        engineLock.lock();
        try {
            patternMemory.restore(state.getPatterns());
            positionLedger.restore(state.getPositions());
        } finally {
            engineLock.unlock();
        }
    }

    public PortfolioSummary portfolioSummary() {
        return positionLedger.portfolioSummary();
    }

    public List<PatternReportEntry> patternReport() {
        return patternMemory.report();
    }

    public RiskMetrics riskMetrics() {
        return riskEngine.getMetrics();
    }

    // ========================
    // PIPELINE
    // ========================

    private TradeDecision doEvaluate(
            String symbol, Collection<String> signals, BigDecimal capital, MarketContext context) {
        String invalid = validateInput(symbol, signals, capital, context);
        if (invalid != null) {
            log.warn("Invalid trade request for {}: {}", symbol, invalid);
            return TradeDecision.rejected(symbol, null, DecisionReason.INVALID_INPUT, invalid);
        }

        GateResult gateResult = tradeGate.evaluate(signals);
        if (gateResult.isRejected()) {
            return TradeDecision.rejected(
                    symbol, gateResult.getPattern(), gateResult.getReason(), gateResult.getMessage());
        }

        BigDecimal notional = riskEngine.sizePosition(
                capital,
                context.getSignalStrength(),
                context.getVolatility(),
                riskEngine.getMetrics().getCurrentExposure());
        if (notional.signum() <= 0) {
            return TradeDecision.rejected(
                    symbol, gateResult.getPattern(), DecisionReason.INSUFFICIENT_SIZE, "Position size rounds to zero");
        }

        if (positionLedger.hasOpenPosition(symbol)) {
            return TradeDecision.rejected(
                    symbol,
                    gateResult.getPattern(),
                    DecisionReason.POSITION_ALREADY_OPEN,
                    "A position is already open for " + symbol);
        }

        RiskValidationResult validation = riskEngine.validateNewPosition(symbol, notional, capital);
        if (validation.isRejected()) {
            return TradeDecision.builder()
                    .approved(false)
                    .symbol(symbol)
                    .pattern(gateResult.getPattern())
                    .reason(DecisionReason.RISK_LIMIT_EXCEEDED)
                    .sizeHint(notional)
                    .violations(validation.getViolations())
                    .message(validation.getViolations().get(0).getMessage())
                    .build();
        }

        PositionSide side = context.side();
        Optional<ProtectiveLevels> levels =
                riskEngine.computeStops(context.getPrice(), side, context.getAtr(), context.getVolatility());
        if (levels.isEmpty()) {
            return TradeDecision.rejected(
                    symbol, gateResult.getPattern(), DecisionReason.INVALID_INPUT, "Cannot compute protective levels");
        }

        BigDecimal quantity = toQuantity(notional, context.getPrice());
        if (quantity.signum() <= 0) {
            return TradeDecision.rejected(
                    symbol, gateResult.getPattern(), DecisionReason.INSUFFICIENT_SIZE, "Quantity rounds to zero");
        }

        Position position;
        try {
            position = positionLedger.open(
                    symbol, side, quantity, context.getPrice(), levels.get(), gateResult.getPattern(), capital);
        } catch (BusinessException e) {
            if (e.getErrorCode() != ErrorCode.POSITION_ALREADY_OPEN) {
                throw e;
            }
            return TradeDecision.rejected(
                    symbol, gateResult.getPattern(), DecisionReason.POSITION_ALREADY_OPEN, e.getMessage());
        }

        riskEngine.registerOrder();
        riskEngine.updateMetrics(positionLedger.openPositions(), positionLedger.lastPrices());

        return TradeDecision.builder()
                .approved(true)
                .symbol(symbol)
                .pattern(gateResult.getPattern())
                .reason(gateResult.getReason())
                .sizeHint(notional)
                .position(position)
                .message(gateResult.getMessage())
                .build();
    }

    private TradeDecision publish(TradeDecision decision) {
        if (decision.isApproved()) {
            log.info(
                    "Trade approved: {} pattern={} reason={} size={}",
                    decision.getSymbol(),
                    decision.getPattern(),
                    decision.getReason(),
                    decision.getSizeHint());
        } else {
            log.info(
                    "Trade rejected: {} pattern={} reason={} ({})",
                    decision.getSymbol(),
                    decision.getPattern(),
                    decision.getReason(),
                    decision.getMessage());
        }
        applicationEventPublisher.publishEvent(new TradeDecisionEvent(this, decision));
        return decision;
    }

    private BigDecimal toQuantity(BigDecimal notional, BigDecimal price) {
        BigDecimal increment = riskEngine.getLimits().getQuantityIncrement();
        if (increment == null || increment.signum() <= 0) {
            return notional.divide(price, 8, RoundingMode.DOWN);
        }
        return notional.divide(price.multiply(increment), 0, RoundingMode.DOWN).multiply(increment);
    }

    private static String validateInput(
            String symbol, Collection<String> signals, BigDecimal capital, MarketContext context) {
        if (symbol == null || symbol.isBlank()) {
            return "Symbol is required";
        }
        if (signals == null) {
            return "Signals are required";
        }
        if (capital == null || capital.signum() <= 0) {
            return "Capital must be positive";
        }
        if (context == null || context.getPrice() == null || context.getPrice().signum() <= 0) {
            return "Reference price must be positive";
        }
        double strength = context.getSignalStrength();
        if (!Double.isFinite(strength) || Math.abs(strength) > 1.0) {
            return "Signal strength must be within [-1, 1]";
        }
        if (!Double.isFinite(context.getVolatility()) || context.getVolatility() < 0) {
            return "Volatility must be non-negative";
        }
        if (!Double.isFinite(context.getAtr()) || context.getAtr() <= 0) {
            return "ATR must be positive";
        }
        return null;
    }
}
