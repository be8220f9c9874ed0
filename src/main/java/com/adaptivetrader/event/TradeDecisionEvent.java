package com.adaptivetrader.event;

import com.adaptivetrader.domain.model.TradeDecision;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the TradingEngine after every trade evaluation, approved or not.
 */
public class TradeDecisionEvent extends ApplicationEvent {

    private final TradeDecision decision;

    public TradeDecisionEvent(Object source, TradeDecision decision) {
        super(source);
        this.decision = decision;
    }

    public TradeDecision getDecision() {
        return decision;
    }
}
