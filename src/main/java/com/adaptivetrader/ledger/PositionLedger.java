package com.adaptivetrader.ledger;

import com.adaptivetrader.domain.enums.ExitReason;
import com.adaptivetrader.domain.enums.PositionSide;
import com.adaptivetrader.domain.enums.PositionStatus;
import com.adaptivetrader.domain.model.Pattern;
import com.adaptivetrader.domain.model.PortfolioSummary;
import com.adaptivetrader.domain.model.Position;
import com.adaptivetrader.domain.model.ProtectiveLevels;
import com.adaptivetrader.domain.model.TradeRecord;
import com.adaptivetrader.event.PositionEvent;
import com.adaptivetrader.event.PositionEventType;
import com.adaptivetrader.exception.BusinessException;
import com.adaptivetrader.exception.ErrorCode;
import com.adaptivetrader.pattern.PatternMemory;
import com.adaptivetrader.risk.RiskEngine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Book of open positions, latest prices and closed-trade history.
 *
 * <p>Holds at most one open position per symbol. On every price tick the position's
 * exits are checked in priority order (emergency stop, stop loss, take profit) and a
 * triggered exit closes the position at the tick price. Surviving positions then have
 * their trailing stop ratcheted.
 *
 * <p>Closing a position, whether by tick or explicitly, feeds the realized P&L back to
 * {@link PatternMemory} and {@link RiskEngine} and publishes a {@link PositionEvent}.
 *
 * <p><b>Thread safety:</b> a single {@link ReentrantReadWriteLock} guards positions,
 * prices and history. Collaborators and listeners are called after the lock is released.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PatternMemory patternMemory;
    private final RiskEngine riskEngine;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Open positions keyed by symbol, in opening order. */
    private final Map<String, Position> positions = new LinkedHashMap<>();

    private final Map<String, BigDecimal> lastPrices = new HashMap<>();
    private final List<TradeRecord> tradeHistory = new ArrayList<>();

    public PositionLedger(
            PatternMemory patternMemory,
            RiskEngine riskEngine,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.patternMemory = patternMemory;
        this.riskEngine = riskEngine;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Opens a new position.
     *
     * @param capital the account capital the position was sized against
     * @throws BusinessException VALIDATION_ERROR for a non-positive quantity or price,
     *                           POSITION_ALREADY_OPEN when the symbol is already held
     */
    public Position open(
            String symbol,
            PositionSide side,
            BigDecimal quantity,
            BigDecimal entryPrice,
            ProtectiveLevels levels,
            Pattern pattern,
            BigDecimal capital) {
        if (symbol == null || symbol.isBlank() || side == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Symbol and side are required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Quantity must be positive", Map.of("quantity", String.valueOf(quantity)));
        }
        if (entryPrice == null || entryPrice.signum() <= 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Entry price must be positive",
                    Map.of("entryPrice", String.valueOf(entryPrice)));
        }

        Position snapshot;
        lock.writeLock().lock();
        try {
            Position existing = positions.get(symbol);
            if (existing != null) {
                throw new BusinessException(
                        ErrorCode.POSITION_ALREADY_OPEN,
                        "Position already open for " + symbol,
                        Map.of("symbol", symbol, "positionId", existing.getId()));
            }

            LocalDateTime now = LocalDateTime.now(clock);
            Position position = Position.builder()
                    .id(UUID.randomUUID().toString())
                    .symbol(symbol)
                    .side(side)
                    .entryPrice(entryPrice)
                    .quantity(quantity)
                    .entryTime(now)
                    .stopLoss(levels != null ? levels.getStopLoss() : null)
                    .emergencyStop(levels != null ? levels.getEmergencyStop() : null)
                    .takeProfit(levels != null ? levels.getTakeProfit() : null)
                    .trailingStep(levels != null ? levels.getTrailingStep() : null)
                    .trailingAnchor(entryPrice)
                    .lastPrice(entryPrice)
                    .unrealizedPnl(BigDecimal.ZERO)
                    .pattern(pattern)
                    .accountCapital(capital)
                    .status(PositionStatus.OPEN)
                    .lastUpdated(now)
                    .build();

            positions.put(symbol, position);
            lastPrices.put(symbol, entryPrice);
            snapshot = position.copy();
        } finally {
            lock.writeLock().unlock();
        }

        log.info(
                "Opened {} {} qty={} @ {} (stop={}, takeProfit={}, pattern={})",
                side,
                symbol,
                quantity,
                entryPrice,
                snapshot.getStopLoss(),
                snapshot.getTakeProfit(),
                pattern);
        applicationEventPublisher.publishEvent(new PositionEvent(this, snapshot, PositionEventType.OPENED));
        return snapshot;
    }

    /**
     * Applies a price update to the open position on {@code symbol}, if any.
     *
     * <p>Ticks for symbols without an open position only update the last price.
     * Non-positive prices are ignored.
     *
     * @return the trade record of a position closed by this tick, or an empty list
     */
    public List<TradeRecord> onPriceTick(String symbol, BigDecimal price) {
        if (symbol == null || price == null || price.signum() <= 0) {
            log.warn("Ignoring invalid price tick: symbol={}, price={}", symbol, price);
            return List.of();
        }

        List<TradeRecord> closed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            lastPrices.put(symbol, price);
            Position position = positions.get(symbol);
            if (position == null) {
                log.debug("Tick for {} with no open position", symbol);
                return List.of();
            }

            position.setLastPrice(price);
            position.setUnrealizedPnl(position.pnlAt(price));
            position.setLastUpdated(LocalDateTime.now(clock));

            ExitReason exitReason = checkExit(position, price);
            if (exitReason != null) {
                closed.add(closeLocked(position, price, exitReason));
            } else {
                ratchetTrailingStop(position, price);
            }
        } finally {
            lock.writeLock().unlock();
        }

        closed.forEach(this::afterClose);
        if (closed.isEmpty()) {
            riskEngine.updateMetrics(openPositions(), lastPrices());
        }
        return closed;
    }

    /**
     * Closes the open position on {@code symbol} at the given price.
     *
     * @return the trade record, or empty when the symbol has no open position
     */
    public Optional<TradeRecord> close(String symbol, BigDecimal exitPrice, ExitReason reason) {
        if (exitPrice == null || exitPrice.signum() <= 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Exit price must be positive",
                    Map.of("exitPrice", String.valueOf(exitPrice)));
        }

        TradeRecord record;
        lock.writeLock().lock();
        try {
            Position position = positions.get(symbol);
            if (position == null) {
                return Optional.empty();
            }
            lastPrices.put(symbol, exitPrice);
            record = closeLocked(position, exitPrice, reason != null ? reason : ExitReason.MANUAL);
        } finally {
            lock.writeLock().unlock();
        }

        afterClose(record);
        return Optional.of(record);
    }

    public Optional<Position> getPosition(String symbol) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(positions.get(symbol)).map(Position::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasOpenPosition(String symbol) {
        lock.readLock().lock();
        try {
            return positions.containsKey(symbol);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Position> openPositions() {
        lock.readLock().lock();
        try {
            return positions.values().stream().map(Position::copy).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TradeRecord> tradeHistory() {
        lock.readLock().lock();
        try {
            return List.copyOf(tradeHistory);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, BigDecimal> lastPrices() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new HashMap<>(lastPrices));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Aggregates the book at the latest known prices. Pure read.
     */
    public PortfolioSummary portfolioSummary() {
        lock.readLock().lock();
        try {
            BigDecimal exposure = BigDecimal.ZERO;
            BigDecimal unrealized = BigDecimal.ZERO;
            for (Position position : positions.values()) {
                BigDecimal price = lastPrices.getOrDefault(position.getSymbol(), position.getEntryPrice());
                exposure = exposure.add(position.notionalAt(price));
                unrealized = unrealized.add(position.pnlAt(price));
            }
            BigDecimal realized = tradeHistory.stream()
                    .map(TradeRecord::getRealizedPnl)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);

            return PortfolioSummary.builder()
                    .openCount(positions.size())
                    .totalExposure(exposure)
                    .totalUnrealizedPnl(unrealized)
                    .totalRealizedPnl(realized)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the open book with previously persisted positions. History is not restored.
     */
    public void restore(Collection<Position> restored) {
        lock.writeLock().lock();
        try {
            positions.clear();
            lastPrices.clear();
            for (Position position : restored) {
                if (!position.isOpen()) {
                    continue;
                }
                positions.put(position.getSymbol(), position.copy());
                BigDecimal price = position.getLastPrice() != null ? position.getLastPrice() : position.getEntryPrice();
                lastPrices.put(position.getSymbol(), price);
            }
            log.info("Restored {} open positions", positions.size());
        } finally {
            lock.writeLock().unlock();
        }
        riskEngine.updateMetrics(openPositions(), lastPrices());
    }

    // ========================
    // INTERNALS
    // ========================

    static ExitReason checkExit(Position position, BigDecimal price) {
        if (position.getSide() == PositionSide.LONG) {
            if (position.getEmergencyStop() != null && price.compareTo(position.getEmergencyStop()) <= 0) {
                return ExitReason.EMERGENCY_STOP;
            }
            if (position.getStopLoss() != null && price.compareTo(position.getStopLoss()) <= 0) {
                return ExitReason.STOP_LOSS;
            }
            if (position.getTakeProfit() != null && price.compareTo(position.getTakeProfit()) >= 0) {
                return ExitReason.TAKE_PROFIT;
            }
        } else {
            if (position.getEmergencyStop() != null && price.compareTo(position.getEmergencyStop()) >= 0) {
                return ExitReason.EMERGENCY_STOP;
            }
            if (position.getStopLoss() != null && price.compareTo(position.getStopLoss()) >= 0) {
                return ExitReason.STOP_LOSS;
            }
            if (position.getTakeProfit() != null && price.compareTo(position.getTakeProfit()) <= 0) {
                return ExitReason.TAKE_PROFIT;
            }
        }
        return null;
    }

    // Moves stops in whole steps only; the anchor advances by the same amount.
    private void ratchetTrailingStop(Position position, BigDecimal price) {
        BigDecimal step = position.getTrailingStep();
        if (step == null || step.signum() <= 0 || position.getStopLoss() == null) {
            return;
        }
        BigDecimal direction = BigDecimal.valueOf(position.getSide().sign());
        BigDecimal favourableMove = price.subtract(position.getTrailingAnchor()).multiply(direction);
        BigDecimal steps = favourableMove.divide(step, 0, RoundingMode.DOWN);
        if (steps.signum() <= 0) {
            return;
        }

        BigDecimal shift = step.multiply(steps).multiply(direction);
        position.setStopLoss(position.getStopLoss().add(shift));
        if (position.getEmergencyStop() != null) {
            position.setEmergencyStop(position.getEmergencyStop().add(shift));
        }
        position.setTrailingAnchor(position.getTrailingAnchor().add(shift));
        log.debug(
                "Trailed {} stop to {} (anchor {})",
                position.getSymbol(),
                position.getStopLoss(),
                position.getTrailingAnchor());
    }

    // Caller holds the write lock.
    private TradeRecord closeLocked(Position position, BigDecimal exitPrice, ExitReason reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal realizedPnl = position.pnlAt(exitPrice);
        BigDecimal entryNotional = position.notionalAt(position.getEntryPrice());
        BigDecimal returnPercent = entryNotional.signum() == 0
                ? BigDecimal.ZERO
                : realizedPnl.multiply(HUNDRED).divide(entryNotional, PERCENT_SCALE, RoundingMode.HALF_UP);

        position.setStatus(PositionStatus.CLOSED);
        position.setLastPrice(exitPrice);
        position.setUnrealizedPnl(BigDecimal.ZERO);
        position.setLastUpdated(now);
        positions.remove(position.getSymbol());

        TradeRecord record = TradeRecord.builder()
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .entryPrice(position.getEntryPrice())
                .exitPrice(exitPrice)
                .quantity(position.getQuantity())
                .realizedPnl(realizedPnl)
                .returnPercent(returnPercent)
                .exitReason(reason)
                .entryTime(position.getEntryTime())
                .exitTime(now)
                .holdingTime(Duration.between(position.getEntryTime(), now))
                .pattern(position.getPattern())
                .build();
        tradeHistory.add(record);

        log.info(
                "Closed {} {} @ {} reason={} pnl={} ({}%)",
                position.getSide(),
                position.getSymbol(),
                exitPrice,
                reason,
                realizedPnl,
                returnPercent);
        return record;
    }

    private void afterClose(TradeRecord record) {
        if (record.getPattern() != null) {
            patternMemory.recordOutcome(record.getPattern(), record.getRealizedPnl().doubleValue());
        }
        riskEngine.recordTradeResult(record);
        riskEngine.updateMetrics(openPositions(), lastPrices());

        Position closedSnapshot = Position.builder()
                .id(record.getPositionId())
                .symbol(record.getSymbol())
                .side(record.getSide())
                .entryPrice(record.getEntryPrice())
                .quantity(record.getQuantity())
                .entryTime(record.getEntryTime())
                .lastPrice(record.getExitPrice())
                .unrealizedPnl(BigDecimal.ZERO)
                .pattern(record.getPattern())
                .status(PositionStatus.CLOSED)
                .lastUpdated(record.getExitTime())
                .build();
        applicationEventPublisher.publishEvent(
                new PositionEvent(this, closedSnapshot, PositionEventType.CLOSED, record));
    }
}
