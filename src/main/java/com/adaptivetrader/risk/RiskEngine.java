package com.adaptivetrader.risk;

import com.adaptivetrader.domain.enums.PositionSide;
import com.adaptivetrader.domain.model.Position;
import com.adaptivetrader.domain.model.ProtectiveLevels;
import com.adaptivetrader.domain.model.RiskMetrics;
import com.adaptivetrader.domain.model.TradeRecord;
import com.adaptivetrader.event.RiskEvent;
import com.adaptivetrader.event.RiskEventType;
import com.adaptivetrader.event.RiskLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Sizes positions, prices their protective levels, and vetoes new positions when
 * aggregate risk is too high.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li><b>Sizing:</b> {@link #sizePosition} scales a base fraction of capital by signal
 *       strength, volatility and current exposure, capped at the max position size.</li>
 *   <li><b>Stops:</b> {@link #computeStops} places stop, emergency stop and take-profit
 *       from ATR with a fixed 2:1 reward to risk.</li>
 *   <li><b>Pre-trade:</b> {@link #validateNewPosition} checks the order rate limit,
 *       exposure, daily drawdown, risk score and open position count.</li>
 *   <li><b>Metrics:</b> {@link #updateMetrics} recomputes exposure, drawdown and risk
 *       score from the open positions; {@link #recordTradeResult} maintains win rate and
 *       profit factor over a rolling window of closed trades, and the maximum drawdown of
 *       the realized equity curve over all trades.</li>
 * </ul>
 *
 * <p>Daily counters reset when the clock crosses into a new trading day.
 *
 * <p><b>Thread safety:</b> one {@link ReentrantReadWriteLock} guards all mutable state.
 * Events are published after the lock is released.
 */
@Service
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    private static final int LEVEL_SCALE = 8;
    private static final double MAX_WIN_RATE_MULTIPLIER = 1.2;
    private static final double REDUCE_EXPOSURE_DRAWDOWN_FRACTION = 0.8;

    private final RiskLimits riskLimits;
    private final Clock clock;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Deque<TradeRecord> recentTrades = new ArrayDeque<>();
    private RiskMetrics metrics;
    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;
    private BigDecimal referenceCapital = BigDecimal.ZERO;
    private BigDecimal cumulativeRealizedPnl = BigDecimal.ZERO;
    private BigDecimal peakRealizedPnl = BigDecimal.ZERO;
    private LocalDate tradingDay;
    private Instant lastOrderTime;
    private boolean drawdownBreachAnnounced;
    private boolean reduceExposureAnnounced;

    public RiskEngine(RiskLimits riskLimits, Clock clock, ApplicationEventPublisher applicationEventPublisher) {
        this.riskLimits = riskLimits;
        this.clock = clock;
        this.applicationEventPublisher = applicationEventPublisher;
        this.tradingDay = LocalDate.now(clock);
        this.metrics = RiskMetrics.empty(tradingDay, LocalDateTime.now(clock));
    }

    // ========================
    // SIZING
    // ========================

    /**
     * Calculates the notional (in quote currency) to commit to a new position.
     *
     * <p>Formula: {@code capital * baseFraction * (0.5 + |signalStrength|)
     * * clamp(1 - 2 * volatility, 0.5, 1) * clamp(1 - exposure / maxTotalRisk, 0, 1)},
     * optionally scaled by the historical win rate, capped at
     * {@code capital * maxPositionSize} and rounded down to the size increment.
     *
     * @return the notional, or zero when any input is invalid or the size rounds away
     */
    public BigDecimal sizePosition(
            BigDecimal capital, double signalStrength, double volatility, double currentExposure) {
        if (capital == null || capital.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        if (!Double.isFinite(signalStrength)
                || Math.abs(signalStrength) > 1.0
                || !Double.isFinite(volatility)
                || volatility < 0
                || !Double.isFinite(currentExposure)
                || currentExposure < 0
                || riskLimits.getMaxTotalRisk() <= 0) {
            log.warn(
                    "Invalid sizing input: strength={}, volatility={}, exposure={}",
                    signalStrength,
                    volatility,
                    currentExposure);
            return BigDecimal.ZERO;
        }

        double signalMultiplier = 0.5 + Math.abs(signalStrength);
        double volatilityMultiplier = clamp(1 - volatility * 2, 0.5, 1.0);
        double exposureMultiplier = clamp(1 - currentExposure / riskLimits.getMaxTotalRisk(), 0.0, 1.0);
        double winRateMultiplier = winRateMultiplier();

        BigDecimal size = capital.multiply(BigDecimal.valueOf(riskLimits.getBaseFraction()
                * signalMultiplier
                * volatilityMultiplier
                * exposureMultiplier
                * winRateMultiplier));

        BigDecimal maxAllowed = capital.multiply(BigDecimal.valueOf(riskLimits.getMaxPositionSize()));
        size = size.min(maxAllowed);
        size = roundDown(size, riskLimits.getSizeIncrement());

        log.debug(
                "Sized position: capital={} signal={} vol={} exposure={} -> {}",
                capital,
                signalMultiplier,
                volatilityMultiplier,
                exposureMultiplier,
                size);
        return size;
    }

    // ========================
    // PROTECTIVE LEVELS
    // ========================

    /**
     * Computes stop loss, emergency stop, take profit and trailing step.
     *
     * <p>{@code baseStop = 2 * atr}, widened by {@code (1 + volatility)}. Take profit is
     * twice the adjusted stop distance from entry; the emergency stop 1.5 times. The
     * trailing step is half the unadjusted base stop.
     *
     * @return empty when the entry price, ATR or volatility is unusable
     */
    public Optional<ProtectiveLevels> computeStops(
            BigDecimal entryPrice, PositionSide side, double atr, double volatility) {
        if (entryPrice == null
                || entryPrice.signum() <= 0
                || side == null
                || !Double.isFinite(atr)
                || atr <= 0
                || !Double.isFinite(volatility)
                || volatility < 0) {
            log.warn("Cannot compute stops: entry={}, side={}, atr={}, volatility={}", entryPrice, side, atr, volatility);
            return Optional.empty();
        }

        BigDecimal baseStop = BigDecimal.valueOf(atr * 2);
        BigDecimal adjustedStop =
                baseStop.multiply(BigDecimal.valueOf(1 + volatility)).setScale(LEVEL_SCALE, RoundingMode.HALF_UP);
        BigDecimal direction = BigDecimal.valueOf(side.sign());

        BigDecimal stopLoss = entryPrice.subtract(adjustedStop.multiply(direction));
        BigDecimal emergencyStop = entryPrice.subtract(adjustedStop.multiply(new BigDecimal("1.5")).multiply(direction));
        BigDecimal takeProfit = entryPrice.add(adjustedStop.multiply(BigDecimal.valueOf(2)).multiply(direction));
        BigDecimal trailingStep = baseStop.multiply(new BigDecimal("0.5")).setScale(LEVEL_SCALE, RoundingMode.HALF_UP);

        return Optional.of(ProtectiveLevels.builder()
                .stopLoss(stopLoss)
                .emergencyStop(emergencyStop)
                .takeProfit(takeProfit)
                .trailingStep(trailingStep)
                .build());
    }

    // ========================
    // PRE-TRADE VALIDATION
    // ========================

    /**
     * Checks a prospective position against every account-level limit.
     *
     * <p>All checks run; the result lists every violation found.
     *
     * @param notional the position notional from {@link #sizePosition}
     * @param capital  current account capital
     */
    public RiskValidationResult validateNewPosition(String symbol, BigDecimal notional, BigDecimal capital) {
        List<RiskEvent> pendingEvents = new ArrayList<>();
        RiskValidationResult result;

        lock.writeLock().lock();
        try {
            rollTradingDayIfNeeded(pendingEvents);
            List<RiskViolation> violations = new ArrayList<>();

            if (capital == null || capital.signum() <= 0) {
                violations.add(RiskViolation.of(RiskViolation.INVALID_CAPITAL, "Capital must be positive: " + capital));
            } else {
                referenceCapital = capital;
            }

            Instant now = clock.instant();
            if (lastOrderTime != null) {
                Duration sinceLast = Duration.between(lastOrderTime, now);
                if (sinceLast.compareTo(riskLimits.getMinOrderInterval()) < 0) {
                    violations.add(RiskViolation.of(
                            RiskViolation.ORDER_RATE_LIMITED,
                            "Last order was " + sinceLast.toSeconds() + "s ago, minimum interval is "
                                    + riskLimits.getMinOrderInterval().toSeconds() + "s"));
                }
            }

            if (capital != null && capital.signum() > 0 && notional != null) {
                double newExposure = notional.doubleValue() / capital.doubleValue() + metrics.getCurrentExposure();
                if (newExposure > riskLimits.getMaxTotalRisk()) {
                    violations.add(RiskViolation.of(
                            RiskViolation.EXPOSURE_LIMIT_EXCEEDED,
                            String.format(
                                    "Exposure would reach %.4f, limit is %.4f",
                                    newExposure, riskLimits.getMaxTotalRisk())));
                }
            }

            if (metrics.getDailyDrawdown() > riskLimits.getMaxDailyDrawdown()) {
                violations.add(RiskViolation.of(
                        RiskViolation.DAILY_DRAWDOWN_EXCEEDED,
                        String.format(
                                "Daily drawdown %.4f exceeds %.4f",
                                metrics.getDailyDrawdown(), riskLimits.getMaxDailyDrawdown())));
            }

            if (metrics.getRiskScore() > riskLimits.getRiskScoreCeiling()) {
                violations.add(RiskViolation.of(
                        RiskViolation.RISK_SCORE_TOO_HIGH,
                        String.format(
                                "Risk score %.1f above ceiling %.1f",
                                metrics.getRiskScore(), riskLimits.getRiskScoreCeiling())));
            }

            if (metrics.getOpenPositions() >= riskLimits.getMaxOpenPositions()) {
                violations.add(RiskViolation.of(
                        RiskViolation.MAX_POSITIONS_REACHED,
                        "Maximum number of open positions reached: " + metrics.getOpenPositions()));
            }

            if (violations.isEmpty()) {
                result = RiskValidationResult.approved();
            } else {
                log.warn("Position on {} rejected by risk limits: {}", symbol, violations);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("symbol", symbol);
                details.put("violationCount", violations.size());
                details.put("firstViolation", violations.get(0).getCode());
                pendingEvents.add(new RiskEvent(
                        this,
                        RiskEventType.RISK_LIMIT_REJECTION,
                        RiskLevel.WARNING,
                        "Position on " + symbol + " rejected: " + violations.get(0).getMessage(),
                        details));
                result = RiskValidationResult.rejected(violations);
            }
        } finally {
            lock.writeLock().unlock();
        }

        pendingEvents.forEach(applicationEventPublisher::publishEvent);
        return result;
    }

    /**
     * Convenience form of {@link #validateNewPosition} for callers that only need yes/no.
     */
    public boolean canOpenPosition(String symbol, BigDecimal notional, BigDecimal capital) {
        return validateNewPosition(symbol, notional, capital).isApproved();
    }

    /** Stamps the order rate limiter. Called after a position is opened. */
    public void registerOrder() {
        lock.writeLock().lock();
        try {
            lastOrderTime = clock.instant();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================
    // METRICS
    // ========================

    /**
     * Recomputes exposure, daily drawdown and risk score from the current open positions.
     *
     * <p>Exposure is the summed notional of each position over the capital it was sized
     * against. Drawdown is today's realized plus open unrealized loss as a fraction of
     * capital (zero when the day is flat or up). The risk score weights exposure and
     * drawdown utilization, each capped at 1, by the configured weights.
     *
     * @param openPositions positions currently open
     * @param currentPrices latest price per symbol; positions without one use their last price
     */
    public RiskMetrics updateMetrics(Collection<Position> openPositions, Map<String, BigDecimal> currentPrices) {
        List<RiskEvent> pendingEvents = new ArrayList<>();
        RiskMetrics snapshot;

        lock.writeLock().lock();
        try {
            rollTradingDayIfNeeded(pendingEvents);

            double exposure = 0.0;
            BigDecimal unrealized = BigDecimal.ZERO;
            int openCount = 0;
            for (Position position : openPositions) {
                BigDecimal price = priceFor(position, currentPrices);
                if (price == null) {
                    continue;
                }
                openCount++;
                BigDecimal capital = position.getAccountCapital();
                if (capital != null && capital.signum() > 0) {
                    exposure += position.notionalAt(price).doubleValue() / capital.doubleValue();
                    referenceCapital = capital;
                }
                unrealized = unrealized.add(position.pnlAt(price));
            }

            double drawdown = 0.0;
            BigDecimal dayPnl = dailyRealizedPnl.add(unrealized);
            if (dayPnl.signum() < 0 && referenceCapital.signum() > 0) {
                drawdown = dayPnl.negate().doubleValue() / referenceCapital.doubleValue();
            }

            metrics = metrics.toBuilder()
                    .currentExposure(exposure)
                    .dailyDrawdown(drawdown)
                    .riskScore(riskScore(exposure, drawdown))
                    .openPositions(openCount)
                    .unrealizedPnl(unrealized)
                    .dailyRealizedPnl(dailyRealizedPnl)
                    .tradingDay(tradingDay)
                    .updatedAt(LocalDateTime.now(clock))
                    .build();
            snapshot = metrics.toBuilder().build();

            collectThresholdEvents(pendingEvents);
        } finally {
            lock.writeLock().unlock();
        }

        pendingEvents.forEach(applicationEventPublisher::publishEvent);
        return snapshot;
    }

    /**
     * Adds a closed trade to the rolling performance window, today's realized P&L and the
     * realized equity curve. Exposure and daily drawdown are refreshed by the next
     * {@link #updateMetrics} call.
     *
     * <p>The equity curve is the running sum of realized P&L, starting at zero. The maximum
     * drawdown is the largest fall from a running peak, taken against
     * {@code referenceCapital + peak} when that is positive.
     */
    public void recordTradeResult(TradeRecord tradeRecord) {
        List<RiskEvent> pendingEvents = new ArrayList<>();

        lock.writeLock().lock();
        try {
            rollTradingDayIfNeeded(pendingEvents);

            recentTrades.addLast(tradeRecord);
            while (recentTrades.size() > riskLimits.getTradeWindow()) {
                recentTrades.removeFirst();
            }
            if (tradeRecord.getRealizedPnl() != null) {
                dailyRealizedPnl = dailyRealizedPnl.add(tradeRecord.getRealizedPnl());
                trackEquityCurve(tradeRecord.getRealizedPnl());
            }

            int wins = 0;
            int losses = 0;
            double grossProfit = 0.0;
            double grossLoss = 0.0;
            for (TradeRecord trade : recentTrades) {
                double pnl = trade.getRealizedPnl() != null ? trade.getRealizedPnl().doubleValue() : 0.0;
                if (pnl > 0) {
                    wins++;
                    grossProfit += pnl;
                } else if (pnl < 0) {
                    losses++;
                    grossLoss += -pnl;
                }
            }
            int total = recentTrades.size();
            double averageWin = wins > 0 ? grossProfit / wins : 0.0;
            double averageLoss = losses > 0 ? grossLoss / losses : 0.0;

            metrics = metrics.toBuilder()
                    .winRate(total > 0 ? (double) wins / total : 0.0)
                    .profitFactor(grossLoss > 0 ? grossProfit / grossLoss : 0.0)
                    .averageWinLossRatio(averageLoss > 0 ? averageWin / averageLoss : 0.0)
                    .dailyRealizedPnl(dailyRealizedPnl)
                    .updatedAt(LocalDateTime.now(clock))
                    .build();
        } finally {
            lock.writeLock().unlock();
        }

        pendingEvents.forEach(applicationEventPublisher::publishEvent);
    }

    /**
     * True when the risk score is above the reduce-exposure threshold or drawdown has
     * used more than 80% of the daily allowance.
     */
    public boolean shouldReduceExposure() {
        lock.readLock().lock();
        try {
            return shouldReduceExposure(metrics);
        } finally {
            lock.readLock().unlock();
        }
    }

    public RiskMetrics getMetrics() {
        lock.readLock().lock();
        try {
            return metrics.toBuilder().build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public RiskLimits getLimits() {
        return riskLimits;
    }

    // ========================
    // INTERNALS
    // ========================

    // Caller holds the write lock.
    private void trackEquityCurve(BigDecimal realizedPnl) {
        cumulativeRealizedPnl = cumulativeRealizedPnl.add(realizedPnl);
        peakRealizedPnl = peakRealizedPnl.max(cumulativeRealizedPnl);
        BigDecimal fall = peakRealizedPnl.subtract(cumulativeRealizedPnl);
        BigDecimal deepest = metrics.getMaxDrawdownAmount() != null ? metrics.getMaxDrawdownAmount() : BigDecimal.ZERO;
        if (fall.compareTo(deepest) <= 0) {
            return;
        }
        BigDecimal peakEquity = referenceCapital.add(peakRealizedPnl);
        double fraction = peakEquity.signum() > 0 ? fall.doubleValue() / peakEquity.doubleValue() : 0.0;
        metrics = metrics.toBuilder().maxDrawdownAmount(fall).maxDrawdown(fraction).build();
        log.info("New maximum drawdown {} ({} of peak equity)", fall, String.format("%.4f", fraction));
    }

    // Caller holds the write lock.
    private void rollTradingDayIfNeeded(List<RiskEvent> pendingEvents) {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(tradingDay)) {
            return;
        }
        LocalDate previousDay = tradingDay;
        tradingDay = today;
        dailyRealizedPnl = BigDecimal.ZERO;
        drawdownBreachAnnounced = false;
        reduceExposureAnnounced = false;
        metrics = metrics.toBuilder()
                .dailyDrawdown(0.0)
                .dailyRealizedPnl(BigDecimal.ZERO)
                .riskScore(riskScore(metrics.getCurrentExposure(), 0.0))
                .tradingDay(today)
                .updatedAt(LocalDateTime.now(clock))
                .build();
        log.info("Trading day rolled over from {} to {}, daily counters reset", previousDay, today);
        pendingEvents.add(new RiskEvent(
                this,
                RiskEventType.TRADING_DAY_ROLLOVER,
                RiskLevel.INFO,
                "New trading day " + today,
                Map.of("previousDay", String.valueOf(previousDay), "tradingDay", today.toString())));
    }

    // Caller holds the write lock.
    private void collectThresholdEvents(List<RiskEvent> pendingEvents) {
        boolean breached = metrics.getDailyDrawdown() > riskLimits.getMaxDailyDrawdown();
        if (breached && !drawdownBreachAnnounced) {
            log.error(
                    "Daily drawdown {} breached limit {}",
                    metrics.getDailyDrawdown(),
                    riskLimits.getMaxDailyDrawdown());
            pendingEvents.add(new RiskEvent(
                    this,
                    RiskEventType.DAILY_DRAWDOWN_BREACH,
                    RiskLevel.CRITICAL,
                    "Daily drawdown limit breached",
                    Map.of(
                            "dailyDrawdown", metrics.getDailyDrawdown(),
                            "limit", riskLimits.getMaxDailyDrawdown())));
        }
        drawdownBreachAnnounced = breached;

        boolean reduce = shouldReduceExposure(metrics);
        if (reduce && !reduceExposureAnnounced) {
            log.warn("Exposure reduction advised: riskScore={}", metrics.getRiskScore());
            pendingEvents.add(new RiskEvent(
                    this,
                    RiskEventType.REDUCE_EXPOSURE_ADVISED,
                    RiskLevel.WARNING,
                    "Risk score or drawdown high, reduce exposure",
                    Map.of("riskScore", metrics.getRiskScore(), "dailyDrawdown", metrics.getDailyDrawdown())));
        }
        reduceExposureAnnounced = reduce;
    }

    private boolean shouldReduceExposure(RiskMetrics current) {
        return current.getRiskScore() > riskLimits.getReduceExposureScore()
                || current.getDailyDrawdown() > riskLimits.getMaxDailyDrawdown() * REDUCE_EXPOSURE_DRAWDOWN_FRACTION;
    }

    private double riskScore(double exposure, double drawdown) {
        double exposureUtilization =
                riskLimits.getMaxTotalRisk() > 0 ? Math.min(1.0, exposure / riskLimits.getMaxTotalRisk()) : 1.0;
        double drawdownUtilization =
                riskLimits.getMaxDailyDrawdown() > 0 ? Math.min(1.0, drawdown / riskLimits.getMaxDailyDrawdown()) : 1.0;
        double score = riskLimits.getExposureWeight() * exposureUtilization
                + riskLimits.getDrawdownWeight() * drawdownUtilization;
        return clamp(score, 0.0, 100.0);
    }

    private double winRateMultiplier() {
        if (!riskLimits.isWinRateScaling()) {
            return 1.0;
        }
        lock.readLock().lock();
        try {
            double winRate = metrics.getWinRate();
            return winRate > 0 ? Math.min(MAX_WIN_RATE_MULTIPLIER, winRate) : 1.0;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static BigDecimal priceFor(Position position, Map<String, BigDecimal> currentPrices) {
        BigDecimal price = currentPrices != null ? currentPrices.get(position.getSymbol()) : null;
        if (price == null) {
            price = position.getLastPrice() != null ? position.getLastPrice() : position.getEntryPrice();
        }
        return price;
    }

    static BigDecimal roundDown(BigDecimal value, BigDecimal increment) {
        if (increment == null || increment.signum() <= 0) {
            return value;
        }
        return value.divide(increment, 0, RoundingMode.DOWN).multiply(increment);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
