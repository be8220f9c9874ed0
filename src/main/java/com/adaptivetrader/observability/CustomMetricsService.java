package com.adaptivetrader.observability;

import com.adaptivetrader.event.PositionEvent;
import com.adaptivetrader.event.PositionEventType;
import com.adaptivetrader.event.RiskEvent;
import com.adaptivetrader.event.TradeDecisionEvent;
import com.adaptivetrader.ledger.PositionLedger;
import com.adaptivetrader.pattern.PatternMemory;
import com.adaptivetrader.risk.RiskEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer meters.
 *
 * <ul>
 *   <li><b>trade.decisions.approved</b> / <b>trade.decisions.rejected</b> (counters)</li>
 *   <li><b>positions.opened</b> / <b>positions.closed</b> (counters)</li>
 *   <li><b>risk.events</b> (counter, tagged by type)</li>
 *   <li><b>risk.score</b>, <b>risk.exposure</b>, <b>positions.open</b>, <b>patterns.tracked</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are polled by Micrometer on scrape; counters are driven by application events.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter decisionsApprovedCounter;
    private final Counter decisionsRejectedCounter;
    private final Counter positionsOpenedCounter;
    private final Counter positionsClosedCounter;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            RiskEngine riskEngine,
            PositionLedger positionLedger,
            PatternMemory patternMemory) {
        this.meterRegistry = meterRegistry;

        this.decisionsApprovedCounter = Counter.builder("trade.decisions.approved")
                .description("Trade evaluations that opened a position")
                .register(meterRegistry);
        this.decisionsRejectedCounter = Counter.builder("trade.decisions.rejected")
                .description("Trade evaluations rejected by the gate, sizing or risk limits")
                .register(meterRegistry);
        this.positionsOpenedCounter = Counter.builder("positions.opened")
                .description("Positions opened")
                .register(meterRegistry);
        this.positionsClosedCounter = Counter.builder("positions.closed")
                .description("Positions closed by exit rule or manually")
                .register(meterRegistry);

        meterRegistry.gauge("risk.score", riskEngine, engine -> engine.getMetrics().getRiskScore());
        meterRegistry.gauge("risk.exposure", riskEngine, engine -> engine.getMetrics().getCurrentExposure());
        meterRegistry.gauge("positions.open", positionLedger, ledger -> ledger.openPositions().size());
        meterRegistry.gauge("patterns.tracked", patternMemory, PatternMemory::size);
    }

    @EventListener
    @Order(20)
    public void onTradeDecision(TradeDecisionEvent event) {
        if (event.getDecision().isApproved()) {
            decisionsApprovedCounter.increment();
        } else {
            decisionsRejectedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.OPENED) {
            positionsOpenedCounter.increment();
        } else if (event.getEventType() == PositionEventType.CLOSED) {
            positionsClosedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        meterRegistry.counter("risk.events", "type", event.getEventType().name()).increment();
        log.debug("Risk event {} ({})", event.getEventType(), event.getLevel());
    }
}
