package com.adaptivetrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time read of the position ledger. Computed on demand, never cached.
 *
 * <p>{@code totalExposure} is the summed notional of open positions at their last price.
 */
@Value
@Builder
public class PortfolioSummary {

    int openCount;
    BigDecimal totalExposure;
    BigDecimal totalUnrealizedPnl;
    BigDecimal totalRealizedPnl;
}
